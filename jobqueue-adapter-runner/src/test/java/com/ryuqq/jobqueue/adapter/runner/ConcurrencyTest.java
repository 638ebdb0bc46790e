package com.ryuqq.jobqueue.adapter.runner;

import com.ryuqq.jobqueue.core.model.HttpResult;
import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.JobSpec;
import com.ryuqq.jobqueue.core.model.JobType;
import com.ryuqq.jobqueue.core.model.OutboundRequest;
import com.ryuqq.jobqueue.core.model.Payload;
import com.ryuqq.jobqueue.core.statemachine.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 동시성 통합 테스트.
 *
 * <p>여러 sweep/resolve가 동시에 실행되어도 같은 Job이 두 번 실행되거나
 * 결과가 두 번 적용되지 않는지 검증합니다.</p>
 */
class ConcurrencyTest {

    private static final int JOBS = 300;
    private static final int WORKERS = 8;

    private EngineFixture fixture;
    private EngineJobQueue engine;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        engine = fixture.engine();
    }

    @Test
    void 동시_sweep은_같은_FUNC_Job을_두_번_실행하지_않음() throws Exception {
        // given
        Map<String, AtomicInteger> invocations = new ConcurrentHashMap<>();
        fixture.functions.register("jobs", "count", args ->
            String.valueOf(invocations.computeIfAbsent(args.get("n"), key -> new AtomicInteger()).incrementAndGet()));
        List<Job> jobs = new ArrayList<>();
        for (int i = 0; i < JOBS; i++) {
            jobs.add(engine.submit(JobSpec.builder(JobType.FUNC)
                .target("jobs.count")
                .payload(Payload.of(Map.of("n", "job-" + i)))
                .build()));
        }

        // when
        int claimed = runConcurrently(engine::sweep);

        // then
        assertThat(claimed).isEqualTo(JOBS);
        assertThat(invocations).hasSize(JOBS);
        assertThat(invocations.values()).allSatisfy(count -> assertThat(count.get()).isEqualTo(1));
        assertThat(jobs).allSatisfy(job ->
            assertThat(engine.find(job.id()).orElseThrow().status()).isEqualTo(JobStatus.COMPLETED));
    }

    @Test
    void 동시_sweep과_resolve는_HTTP_Job마다_요청_하나와_실패_기록_하나만_남김() throws Exception {
        // given
        fixture.http.respondWith(HttpResult.response(404, Map.of(), "missing"));
        List<Job> jobs = new ArrayList<>();
        for (int i = 0; i < JOBS; i++) {
            jobs.add(engine.submit(JobSpec.builder(JobType.GET)
                .target("https://hooks.example.com/items/" + i)
                .build()));
        }

        // when
        runConcurrently(engine::sweep);
        int resolved = runConcurrently(engine::resolve);

        // then
        assertThat(resolved).isEqualTo(JOBS);
        assertThat(fixture.http.submittedRequests())
            .extracting(OutboundRequest::uri)
            .doesNotHaveDuplicates()
            .hasSize(JOBS);
        assertThat(jobs).allSatisfy(job -> {
            Job reloaded = engine.find(job.id()).orElseThrow();
            assertThat(reloaded.status()).isEqualTo(JobStatus.FAILED);
            assertThat(reloaded.retryCount()).isEqualTo(1);
            assertThat(engine.failures(job.id())).hasSize(1);
        });
    }

    /**
     * 같은 작업을 WORKERS개의 스레드에서 동시에 반복 실행하고 처리 건수 합계를 반환.
     */
    private int runConcurrently(Pass pass) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(WORKERS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < WORKERS; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    int total = 0;
                    int processed;
                    do {
                        processed = pass.run();
                        total += processed;
                    } while (processed > 0);
                    return total;
                }));
            }
            start.countDown();

            int sum = 0;
            for (Future<Integer> future : futures) {
                sum += future.get(30, TimeUnit.SECONDS);
            }
            return sum;
        } finally {
            executor.shutdown();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    @FunctionalInterface
    private interface Pass {
        int run();
    }
}
