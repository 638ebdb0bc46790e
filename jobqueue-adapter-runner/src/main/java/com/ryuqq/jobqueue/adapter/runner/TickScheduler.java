package com.ryuqq.jobqueue.adapter.runner;

import com.ryuqq.jobqueue.application.runtime.EngineRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * EngineRuntime 주기 실행기 (선택).
 *
 * <p>엔진은 스스로 시간을 진행하지 않으므로, 외부 스케줄러가 없는 환경에서 이 클래스로
 * sweep/resolve/reap를 주기적으로 호출합니다.</p>
 *
 * <p><strong>기본 스케줄 (60초 tick):</strong></p>
 * <pre>
 * t=0s   sweep, resolve, reap
 * t=10s  resolve
 * t=20s  resolve
 * ...
 * t=50s  resolve
 * t=60s  sweep, resolve, reap
 * </pre>
 *
 * <p>각 작업의 예외는 로깅 후 무시되어 다음 실행에 영향을 주지 않습니다.</p>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public final class TickScheduler {

    private static final Logger log = LoggerFactory.getLogger(TickScheduler.class);

    private final EngineRuntime runtime;
    private final TickConfig config;
    private final ScheduledExecutorService scheduler;

    /**
     * 생성자 (단일 스레드 스케줄러 사용).
     *
     * @param runtime 엔진
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TickScheduler(EngineRuntime runtime, TickConfig config) {
        this(runtime, config, Executors.newSingleThreadScheduledExecutor());
    }

    /**
     * 생성자 (스케줄러 주입).
     *
     * @param runtime 엔진
     * @param config 설정
     * @param scheduler 스케줄러
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TickScheduler(EngineRuntime runtime, TickConfig config, ScheduledExecutorService scheduler) {
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.runtime = runtime;
        this.config = config;
        this.scheduler = scheduler;
    }

    /**
     * 주기 실행 시작.
     */
    public void start() {
        long tick = config.tickIntervalMs();

        scheduler.scheduleAtFixedRate(() -> runSafely("sweep", runtime::sweep), 0, tick, TimeUnit.MILLISECONDS);
        for (int i = 0; i < config.resolutionsPerTick(); i++) {
            long offset = i * config.resolutionIntervalMs();
            scheduler.scheduleAtFixedRate(() -> runSafely("resolve", runtime::resolve), offset, tick, TimeUnit.MILLISECONDS);
        }
        if (config.reapEnabled()) {
            scheduler.scheduleAtFixedRate(() -> runSafely("reap", runtime::reap), 0, tick, TimeUnit.MILLISECONDS);
        }

        log.info("Tick scheduler started: tick={}ms, resolutions={}, reap={}",
            tick, config.resolutionsPerTick(), config.reapEnabled());
    }

    /**
     * 주기 실행 종료.
     *
     * <p>진행 중인 작업이 완료되도록 대기합니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void stop() throws InterruptedException {
        scheduler.shutdown();
        if (!scheduler.awaitTermination(60, TimeUnit.SECONDS)) {
            scheduler.shutdownNow();
        }
        log.info("Tick scheduler stopped");
    }

    private void runSafely(String task, Task action) {
        try {
            int count = action.run();
            log.debug("Tick task {} processed {} jobs", task, count);
        } catch (Exception e) {
            log.error("Tick task {} failed", task, e);
        }
    }

    @FunctionalInterface
    private interface Task {
        int run();
    }
}
