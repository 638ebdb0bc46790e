package com.ryuqq.jobqueue.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Job 생성 시 payload 서명 설정.
 *
 * <p>secret이 직접 지정되면 그것을, 아니면 vaultName으로 secret vault를 조회합니다.
 * 둘 다 없으면 서명하지 않습니다 ({@link #none()}).</p>
 *
 * <p><strong>기본값:</strong> headerName=X-HMAC-Signature, style=PLAIN,
 * algorithm=sha256, encoding=hex</p>
 *
 * @param secret 서명 secret (null 가능)
 * @param vaultName secret vault 참조 이름 (null 가능)
 * @param headerName 서명을 기록할 헤더 이름
 * @param style 서명 값 형식
 * @param algorithm HMAC 알고리즘
 * @param encoding digest 인코딩
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public record SigningConfig(
    byte[] secret,
    String vaultName,
    String headerName,
    SignatureStyle style,
    HmacAlgorithm algorithm,
    SignatureEncoding encoding
) {

    public static final String DEFAULT_HEADER_NAME = "X-HMAC-Signature";

    private static final SigningConfig NONE = new SigningConfig(null, null, DEFAULT_HEADER_NAME,
        SignatureStyle.PLAIN, HmacAlgorithm.SHA256, SignatureEncoding.HEX);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException headerName이 비어있거나 style/algorithm/encoding이 null인 경우
     */
    public SigningConfig {
        if (headerName == null || headerName.isBlank()) {
            throw new IllegalArgumentException("headerName cannot be null or blank");
        }
        if (style == null) {
            throw new IllegalArgumentException("style cannot be null");
        }
        if (algorithm == null) {
            throw new IllegalArgumentException("algorithm cannot be null");
        }
        if (encoding == null) {
            throw new IllegalArgumentException("encoding cannot be null");
        }
        if (vaultName != null && vaultName.isBlank()) {
            throw new IllegalArgumentException("vaultName cannot be blank");
        }
        secret = secret == null ? null : secret.clone();
    }

    /**
     * 서명하지 않는 설정.
     *
     * @return secret, vaultName이 모두 없는 설정
     */
    public static SigningConfig none() {
        return NONE;
    }

    /**
     * 직접 지정한 secret으로 서명하는 기본 설정.
     *
     * @param secret secret bytes
     * @return SigningConfig
     */
    public static SigningConfig withSecret(byte[] secret) {
        if (secret == null || secret.length == 0) {
            throw new IllegalArgumentException("secret cannot be null or empty");
        }
        return new SigningConfig(secret, null, DEFAULT_HEADER_NAME,
            SignatureStyle.PLAIN, HmacAlgorithm.SHA256, SignatureEncoding.HEX);
    }

    /**
     * secret vault 참조로 서명하는 기본 설정.
     *
     * @param vaultName vault secret 이름
     * @return SigningConfig
     */
    public static SigningConfig fromVault(String vaultName) {
        if (vaultName == null) {
            throw new IllegalArgumentException("vaultName cannot be null");
        }
        return new SigningConfig(null, vaultName, DEFAULT_HEADER_NAME,
            SignatureStyle.PLAIN, HmacAlgorithm.SHA256, SignatureEncoding.HEX);
    }

    /**
     * 서명 대상인지 확인.
     *
     * @return secret 또는 vaultName이 지정된 경우 true
     */
    public boolean isEnabled() {
        return secret != null || vaultName != null;
    }

    @Override
    public byte[] secret() {
        return secret == null ? null : secret.clone();
    }

    public SigningConfig withHeaderName(String headerName) {
        return new SigningConfig(secret, vaultName, headerName, style, algorithm, encoding);
    }

    public SigningConfig withStyle(SignatureStyle style) {
        return new SigningConfig(secret, vaultName, headerName, style, algorithm, encoding);
    }

    public SigningConfig withAlgorithm(HmacAlgorithm algorithm) {
        return new SigningConfig(secret, vaultName, headerName, style, algorithm, encoding);
    }

    public SigningConfig withEncoding(SignatureEncoding encoding) {
        return new SigningConfig(secret, vaultName, headerName, style, algorithm, encoding);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SigningConfig that = (SigningConfig) o;
        return Arrays.equals(secret, that.secret)
            && Objects.equals(vaultName, that.vaultName)
            && headerName.equals(that.headerName)
            && style == that.style
            && algorithm == that.algorithm
            && encoding == that.encoding;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(vaultName, headerName, style, algorithm, encoding);
        return 31 * result + Arrays.hashCode(secret);
    }

    @Override
    public String toString() {
        // secret 값은 노출하지 않음
        return "SigningConfig{" +
            "secret=" + (secret == null ? "none" : "***") +
            ", vaultName=" + vaultName +
            ", headerName=" + headerName +
            ", style=" + style +
            ", algorithm=" + algorithm.label() +
            ", encoding=" + encoding +
            '}';
    }
}
