package com.ryuqq.jobqueue.core.signing;

import com.ryuqq.jobqueue.core.model.JobSpec;
import com.ryuqq.jobqueue.core.model.JobValidationException;
import com.ryuqq.jobqueue.core.model.SigningConfig;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 제출 시점의 payload 서명.
 *
 * <p>정규화된 payload 텍스트(키 정렬, 공백 없는 JSON)를 설정된 알고리즘으로 서명하여
 * 설정된 헤더 이름으로 헤더 목록에 추가합니다.</p>
 *
 * <p><strong>주의:</strong> 서명은 Job 생성 시 한 번만 계산됩니다. 이후 payload가 변경되어도
 * 다시 계산하지 않습니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public class PayloadSigner {

    private final SecretLookup secretLookup;

    public PayloadSigner(SecretLookup secretLookup) {
        if (secretLookup == null) {
            throw new IllegalArgumentException("secretLookup cannot be null");
        }
        this.secretLookup = secretLookup;
    }

    /**
     * 서명 헤더가 병합된 헤더 생성.
     *
     * @param spec 제출 요청
     * @return 서명 대상이 아니면 spec의 헤더 그대로, 아니면 서명 헤더가 추가된 헤더
     * @throws JobValidationException vault 이름이 secret으로 해석되지 않는 경우
     */
    public Map<String, String> sign(JobSpec spec) {
        SigningConfig signing = spec.signing();
        if (!signing.isEnabled()) {
            return spec.headers();
        }

        byte[] secret = secretLookup.secretFor(signing)
            .orElseThrow(() -> new JobValidationException(
                "Signing secret not found in vault: " + signing.vaultName()));

        String signature = HmacCodec.signature(
            signing.algorithm(),
            secret,
            spec.payload().toCanonicalText(),
            signing.encoding(),
            signing.style()
        );

        Map<String, String> headers = new LinkedHashMap<>(spec.headers());
        headers.put(signing.headerName(), signature);
        return headers;
    }
}
