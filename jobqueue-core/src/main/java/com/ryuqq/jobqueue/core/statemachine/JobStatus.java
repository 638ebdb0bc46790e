package com.ryuqq.jobqueue.core.statemachine;

/**
 * Job의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * NEW ──────────┬─► PROCESSING ─┬─► COMPLETED
 *  │  ▲         │       ▲       ├─► REDIRECTED
 *  │  │         │       │       ├─► SERVER_ERROR
 *  │  └─ (408) ─┼───────┤       ├─► TOO_MANY
 *  │            │       │       ├─► OTHER
 *  │            │     FAILED ◄──┘
 *  ▼            │
 * POLLED ───────┴─► COMPLETED (ack)
 *
 * NEW ─► COMPLETED (auto-ack poll)
 * </pre>
 *
 * <p>COMPLETED, REDIRECTED, SERVER_ERROR, TOO_MANY, OTHER는 종료 상태이며
 * 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public enum JobStatus {

    /**
     * 대기 중 (최초 상태, 또는 poll lease 만료 후 재대기).
     */
    NEW("new"),

    /**
     * claim 되어 실행 중. HTTP Job은 결과가 해석될 때까지 이 상태를 유지합니다.
     */
    PROCESSING("processing"),

    /**
     * 외부 consumer가 poll하여 lease를 보유 중.
     */
    POLLED("polled"),

    /**
     * 성공.
     */
    COMPLETED("completed"),

    /**
     * 성공 (redirect 응답으로 파생 Job 1건 생성).
     */
    REDIRECTED("redirected"),

    /**
     * 실패 (재시도 대상).
     */
    FAILED("failed"),

    /**
     * 5xx 응답 (영구 실패).
     */
    SERVER_ERROR("server_error"),

    /**
     * 재시도 한도 초과 (영구 실패).
     */
    TOO_MANY("too_many"),

    /**
     * 분류되지 않은 응답 (영구).
     */
    OTHER("other");

    private final String label;

    JobStatus(String label) {
        this.label = label;
    }

    /**
     * 저장소/로그 표기용 소문자 이름.
     *
     * @return 상태 이름 (예: "too_many")
     */
    public String label() {
        return label;
    }

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, REDIRECTED, SERVER_ERROR, TOO_MANY, OTHER인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == REDIRECTED || this == SERVER_ERROR
            || this == TOO_MANY || this == OTHER;
    }
}
