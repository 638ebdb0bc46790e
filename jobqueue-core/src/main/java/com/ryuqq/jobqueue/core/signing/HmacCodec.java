package com.ryuqq.jobqueue.core.signing;

import com.ryuqq.jobqueue.core.model.HmacAlgorithm;
import com.ryuqq.jobqueue.core.model.SignatureEncoding;
import com.ryuqq.jobqueue.core.model.SignatureStyle;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;

/**
 * HMAC 계산 및 인코딩.
 *
 * <p>메시지는 UTF-8로 인코딩하여 서명합니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public final class HmacCodec {

    private static final HexFormat HEX = HexFormat.of();

    private HmacCodec() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * HMAC digest 계산.
     *
     * @param algorithm HMAC 알고리즘
     * @param key secret (비어있으면 안 됨)
     * @param message 서명할 메시지
     * @return digest bytes
     * @throws IllegalArgumentException 인자가 null이거나 key가 비어있는 경우
     * @throws SigningException JCA가 알고리즘을 지원하지 않는 경우
     */
    public static byte[] digest(HmacAlgorithm algorithm, byte[] key, String message) {
        if (algorithm == null) {
            throw new IllegalArgumentException("algorithm cannot be null");
        }
        if (key == null || key.length == 0) {
            throw new IllegalArgumentException("key cannot be null or empty");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        try {
            Mac mac = Mac.getInstance(algorithm.jcaName());
            mac.init(new SecretKeySpec(key, algorithm.jcaName()));
            return mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new SigningException("Failed to compute " + algorithm.label() + " HMAC", e);
        }
    }

    /**
     * digest 인코딩.
     *
     * @param digest digest bytes
     * @param encoding HEX(소문자) 또는 BASE64
     * @return 인코딩된 문자열
     */
    public static String encode(byte[] digest, SignatureEncoding encoding) {
        return switch (encoding) {
            case HEX -> HEX.formatHex(digest);
            case BASE64 -> Base64.getEncoder().encodeToString(digest);
        };
    }

    /**
     * 서명 헤더 값 생성.
     *
     * <p>PREFIXED 스타일이면 {@code "<algorithm>="} 접두어를 붙입니다 (예: {@code sha256=ab12...}).</p>
     *
     * @param algorithm HMAC 알고리즘
     * @param key secret
     * @param message 서명할 메시지
     * @param encoding digest 인코딩
     * @param style 서명 값 형식
     * @return 헤더 값
     */
    public static String signature(HmacAlgorithm algorithm, byte[] key, String message,
                                   SignatureEncoding encoding, SignatureStyle style) {
        String encoded = encode(digest(algorithm, key, message), encoding);
        return style == SignatureStyle.PREFIXED ? algorithm.label() + "=" + encoded : encoded;
    }

    /**
     * HMAC-SHA256 hex 값 (poll/ack 인증용).
     *
     * @param key secret
     * @param message 서명할 메시지
     * @return 소문자 hex
     */
    public static String hexSha256(byte[] key, String message) {
        return encode(digest(HmacAlgorithm.SHA256, key, message), SignatureEncoding.HEX);
    }

    /**
     * 상수 시간 문자열 비교.
     *
     * @param expected 기대값
     * @param actual 전달받은 값 (null이면 false)
     * @return 일치하면 true
     */
    public static boolean matches(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            actual.getBytes(StandardCharsets.UTF_8)
        );
    }
}
