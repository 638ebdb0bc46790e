package com.ryuqq.jobqueue.application.runtime;

/**
 * 주기적으로 호출되는 엔진 작업.
 *
 * <p>엔진은 자체 스레드를 갖지 않으며, 시간에 따른 상태 전이(재시도, lease 만료)는
 * 외부에서 주기적으로 이 메서드들을 호출해야 진행됩니다.</p>
 *
 * <p><strong>호출 주기 (기본):</strong></p>
 * <ul>
 *   <li>{@link #sweep()}: 60초마다</li>
 *   <li>{@link #resolve()}: 10초 간격으로 60초에 6회</li>
 *   <li>{@link #reap()}: 필요 시 (장시간 PROCESSING 정리)</li>
 * </ul>
 *
 * <p>모든 메서드는 여러 인스턴스에서 동시에 호출되어도 안전해야 합니다. 같은 Job은
 * 동시에 두 번 처리되지 않습니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public interface EngineRuntime {

    /**
     * claim sweep 1회 실행.
     *
     * @return claim하여 처리한 Job 수
     */
    int sweep();

    /**
     * 해석 완료된 HTTP 요청의 결과 분류 1회 실행.
     *
     * @return 결과를 적용한 Job 수
     */
    int resolve();

    /**
     * 진행 중인 요청 없이 PROCESSING에 머문 Job 정리 1회 실행.
     *
     * @return 정리한 Job 수
     */
    int reap();
}
