package com.ryuqq.jobqueue.core.signing;

import com.ryuqq.jobqueue.core.model.SigningConfig;
import com.ryuqq.jobqueue.core.spi.SecretResolver;

import java.util.Optional;

/**
 * Job의 서명 secret 조회.
 *
 * <p>직접 지정된 secret을 우선하고, 없으면 vault 이름으로 {@link SecretResolver}에 조회합니다.
 * 서명(제출 시)과 poll/ack 인증이 같은 규칙을 사용합니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public class SecretLookup {

    private final SecretResolver secretResolver;

    public SecretLookup(SecretResolver secretResolver) {
        if (secretResolver == null) {
            throw new IllegalArgumentException("secretResolver cannot be null");
        }
        this.secretResolver = secretResolver;
    }

    /**
     * secret 조회.
     *
     * @param signing 서명 설정
     * @return secret bytes (비어있지 않음), 없으면 empty
     */
    public Optional<byte[]> secretFor(SigningConfig signing) {
        if (signing == null) {
            return Optional.empty();
        }
        byte[] direct = signing.secret();
        if (direct != null && direct.length > 0) {
            return Optional.of(direct);
        }
        if (signing.vaultName() == null) {
            return Optional.empty();
        }
        return secretResolver.resolve(signing.vaultName())
            .filter(secret -> secret.length > 0);
    }
}
