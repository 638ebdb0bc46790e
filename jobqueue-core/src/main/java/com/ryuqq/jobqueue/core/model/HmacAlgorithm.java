package com.ryuqq.jobqueue.core.model;

/**
 * 서명에 사용할 HMAC 알고리즘.
 *
 * <p>{@link #label()}은 PREFIXED 스타일의 접두어("sha256=")에 사용됩니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public enum HmacAlgorithm {

    MD5("md5", "HmacMD5"),
    SHA1("sha1", "HmacSHA1"),
    SHA224("sha224", "HmacSHA224"),
    SHA256("sha256", "HmacSHA256"),
    SHA384("sha384", "HmacSHA384"),
    SHA512("sha512", "HmacSHA512");

    private final String label;
    private final String jcaName;

    HmacAlgorithm(String label, String jcaName) {
        this.label = label;
        this.jcaName = jcaName;
    }

    public String label() {
        return label;
    }

    /**
     * {@link javax.crypto.Mac#getInstance(String)}에 전달할 이름.
     *
     * @return JCA 알고리즘 이름
     */
    public String jcaName() {
        return jcaName;
    }

    /**
     * 소문자 라벨("sha256")로 알고리즘 조회.
     *
     * @param label 알고리즘 라벨 (대소문자 무시)
     * @return HmacAlgorithm
     * @throws IllegalArgumentException 지원하지 않는 라벨인 경우
     */
    public static HmacAlgorithm fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("label cannot be null");
        }
        for (HmacAlgorithm algorithm : values()) {
            if (algorithm.label.equalsIgnoreCase(label)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unsupported HMAC algorithm: " + label);
    }
}
