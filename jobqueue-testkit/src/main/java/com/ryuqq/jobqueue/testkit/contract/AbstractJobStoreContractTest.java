package com.ryuqq.jobqueue.testkit.contract;

import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.JobId;
import com.ryuqq.jobqueue.core.model.JobSpec;
import com.ryuqq.jobqueue.core.model.JobType;
import com.ryuqq.jobqueue.core.model.NewJob;
import com.ryuqq.jobqueue.core.model.ResponseSnapshot;
import com.ryuqq.jobqueue.core.spi.JobClaim;
import com.ryuqq.jobqueue.core.spi.JobStore;
import com.ryuqq.jobqueue.core.spi.JobUpdate;
import com.ryuqq.jobqueue.core.statemachine.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract tests every {@link JobStore} implementation must pass.
 *
 * <p>Covers the claim discipline and the job invariants:</p>
 * <ul>
 *   <li>At most one open claim per job; contended rows are skipped, never waited on</li>
 *   <li>Terminal jobs are never reclaimed</li>
 *   <li>Status changes outside the transition table are rejected</li>
 *   <li>retry_count never decreases</li>
 *   <li>Concurrent sweeps partition the eligible set</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyJobStoreContractTest extends AbstractJobStoreContractTest {
 *     {@literal @}Override
 *     protected JobStore createStore() {
 *         return new MyJobStore(...);
 *     }
 * }
 * </pre>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public abstract class AbstractJobStoreContractTest {

    protected static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    protected JobStore store;

    /**
     * Creates a fresh, empty store for each test.
     *
     * @return store under test
     */
    protected abstract JobStore createStore();

    @BeforeEach
    protected void setUpStore() {
        store = createStore();
    }

    // ============================================================
    // 삽입 / 조회
    // ============================================================

    @Test
    void insert_서로_다른_ID와_NEW_상태() {
        Job first = insertHttp(NOW);
        Job second = insertHttp(NOW);

        assertThat(first.id()).isNotEqualTo(second.id());
        assertThat(first.status()).isEqualTo(JobStatus.NEW);
        assertThat(first.retryCount()).isZero();
        assertThat(store.find(first.id())).contains(first);
    }

    @Test
    void find_없는_ID는_empty() {
        assertThat(store.find(JobId.of(987654321L))).isEmpty();
    }

    // ============================================================
    // claimEligible
    // ============================================================

    @Test
    void claimEligible_도래한_Job만_run_at_순서로() {
        // given
        Job later = insertHttp(NOW.minusSeconds(10));
        Job earlier = insertHttp(NOW.minusSeconds(20));
        insertHttp(NOW.plusSeconds(30));

        // when
        List<JobClaim> claims = store.claimEligible(NOW, 10);

        // then
        try {
            assertThat(claims).extracting(claim -> claim.job().id())
                .containsExactly(earlier.id(), later.id());
        } finally {
            claims.forEach(JobClaim::close);
        }
    }

    @Test
    void claimEligible_배치_크기_제한() {
        for (int i = 0; i < 5; i++) {
            insertHttp(NOW);
        }

        List<JobClaim> claims = store.claimEligible(NOW, 3);
        try {
            assertThat(claims).hasSize(3);
        } finally {
            claims.forEach(JobClaim::close);
        }
    }

    @Test
    void claimEligible_이미_claim된_Job은_건너뜀() {
        // given
        Job held = insertHttp(NOW);
        Job free = insertHttp(NOW);
        JobClaim holding = store.claim(held.id()).orElseThrow();

        // when
        List<JobClaim> claims = store.claimEligible(NOW, 10);

        // then
        try {
            assertThat(claims).extracting(claim -> claim.job().id()).containsExactly(free.id());
        } finally {
            claims.forEach(JobClaim::close);
            holding.close();
        }
    }

    @Test
    void claimEligible_NEW_POLL_Job은_대상이_아님() {
        insertPoll("owner-a", NOW);

        assertThat(store.claimEligible(NOW, 10)).isEmpty();
    }

    @Test
    void claimEligible_종료_상태_Job은_다시_claim_되지_않음() {
        // given
        Job job = insertHttp(NOW);
        moveTo(job.id(), JobStatus.PROCESSING, JobStatus.SERVER_ERROR);

        // when
        List<JobClaim> claims = store.claimEligible(NOW.plusSeconds(3600), 10);

        // then
        assertThat(claims).isEmpty();
    }

    @Test
    void claimEligible_재시도_한도를_넘은_FAILED는_대상이_아님() {
        // given
        Job job = insertHttp(NOW, 0);
        try (JobClaim claim = store.claim(job.id()).orElseThrow()) {
            claim.apply(JobUpdate.to(JobStatus.PROCESSING));
            claim.apply(JobUpdate.to(JobStatus.FAILED).incrementRetry());
        }

        // when & then
        assertThat(store.claimEligible(NOW, 10)).isEmpty();
    }

    // ============================================================
    // claim
    // ============================================================

    @Test
    void claim_열린_claim이_있으면_두번째는_empty() {
        Job job = insertHttp(NOW);

        JobClaim first = store.claim(job.id()).orElseThrow();
        Optional<JobClaim> second = store.claim(job.id());

        assertThat(second).isEmpty();
        first.close();
        try (JobClaim third = store.claim(job.id()).orElseThrow()) {
            assertThat(third.job().id()).isEqualTo(job.id());
        }
    }

    @Test
    void claim_close는_멱등() {
        Job job = insertHttp(NOW);
        JobClaim claim = store.claim(job.id()).orElseThrow();

        claim.close();
        claim.close();

        JobClaim again = store.claim(job.id()).orElseThrow();
        assertThat(store.claim(job.id())).isEmpty();
        again.close();
    }

    @Test
    void apply_적용_결과가_저장소에_반영() {
        // given
        Job job = insertHttp(NOW);

        // when
        try (JobClaim claim = store.claim(job.id()).orElseThrow()) {
            claim.apply(JobUpdate.to(JobStatus.PROCESSING).lastAt(NOW));
            claim.apply(JobUpdate.to(JobStatus.FAILED)
                .incrementRetry()
                .runAt(NOW.plusSeconds(5))
                .response(ResponseSnapshot.of(404, "nope")));
        }

        // then
        Job stored = store.find(job.id()).orElseThrow();
        assertThat(stored.status()).isEqualTo(JobStatus.FAILED);
        assertThat(stored.retryCount()).isEqualTo(1);
        assertThat(stored.runAt()).isEqualTo(NOW.plusSeconds(5));
        assertThat(stored.lastAt()).isEqualTo(NOW);
        assertThat(stored.lastResponse().status()).isEqualTo(404);
    }

    @Test
    void apply_허용되지_않은_전이는_거부하고_상태_유지() {
        Job job = insertHttp(NOW);

        try (JobClaim claim = store.claim(job.id()).orElseThrow()) {
            assertThatThrownBy(() -> claim.apply(JobUpdate.to(JobStatus.TOO_MANY)))
                .isInstanceOf(IllegalStateException.class);
        }

        assertThat(store.find(job.id()).orElseThrow().status()).isEqualTo(JobStatus.NEW);
    }

    @Test
    void apply_닫힌_claim으로는_변경_불가() {
        Job job = insertHttp(NOW);
        JobClaim claim = store.claim(job.id()).orElseThrow();
        claim.close();

        assertThatThrownBy(() -> claim.apply(JobUpdate.to(JobStatus.PROCESSING)))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void apply_retry_count는_감소하지_않음() {
        Job job = insertHttp(NOW);
        int previous = 0;

        for (int i = 0; i < 3; i++) {
            try (JobClaim claim = store.claimEligible(NOW.plusSeconds(3600), 1).get(0)) {
                claim.apply(JobUpdate.to(JobStatus.PROCESSING));
                Job failed = claim.apply(JobUpdate.to(JobStatus.FAILED).incrementRetry());
                assertThat(failed.retryCount()).isEqualTo(previous + 1);
                previous = failed.retryCount();
            }
        }

        assertThat(store.find(job.id()).orElseThrow().retryCount()).isEqualTo(3);
    }

    // ============================================================
    // claimNextPollable
    // ============================================================

    @Test
    void claimNextPollable_owner의_가장_오래된_Job() {
        // given
        insertPoll("owner-a", NOW.minusSeconds(5));
        Job oldest = insertPoll("owner-a", NOW.minusSeconds(50));
        insertPoll("owner-b", NOW.minusSeconds(100));
        insertPoll("owner-a", NOW.plusSeconds(100));

        // when
        try (JobClaim claim = store.claimNextPollable("owner-a", NOW, job -> true).orElseThrow()) {
            // then
            assertThat(claim.job().id()).isEqualTo(oldest.id());
        }
    }

    @Test
    void claimNextPollable_거부된_Job은_건너뛰고_다음_Job() {
        Job rejected = insertPoll("owner-a", NOW.minusSeconds(50));
        Job accepted = insertPoll("owner-a", NOW.minusSeconds(5));

        try (JobClaim claim = store.claimNextPollable("owner-a", NOW,
                job -> !job.id().equals(rejected.id())).orElseThrow()) {
            assertThat(claim.job().id()).isEqualTo(accepted.id());
        }
        Optional<JobClaim> released = store.claim(rejected.id());
        assertThat(released).isPresent();
        released.get().close();
    }

    @Test
    void claimNextPollable_claim된_Job은_건너뜀() {
        Job held = insertPoll("owner-a", NOW.minusSeconds(50));
        JobClaim holding = store.claim(held.id()).orElseThrow();

        try {
            assertThat(store.claimNextPollable("owner-a", NOW, job -> true)).isEmpty();
        } finally {
            holding.close();
        }
    }

    // ============================================================
    // scanProcessing
    // ============================================================

    @Test
    void scanProcessing_기준_시각_이전에_시작한_PROCESSING만() {
        // given
        Job stale = insertHttp(NOW);
        Job fresh = insertHttp(NOW);
        insertHttp(NOW);
        try (JobClaim claim = store.claim(stale.id()).orElseThrow()) {
            claim.apply(JobUpdate.to(JobStatus.PROCESSING).lastAt(NOW.minusSeconds(600)));
        }
        try (JobClaim claim = store.claim(fresh.id()).orElseThrow()) {
            claim.apply(JobUpdate.to(JobStatus.PROCESSING).lastAt(NOW));
        }

        // when
        List<Job> found = store.scanProcessing(NOW.minusSeconds(60), 10);

        // then
        assertThat(found).extracting(Job::id).containsExactly(stale.id());
    }

    // ============================================================
    // 동시성
    // ============================================================

    @Test
    void claimEligible_동시_sweep은_Job을_나눠가짐() throws Exception {
        // given
        int jobCount = 200;
        int workers = 8;
        for (int i = 0; i < jobCount; i++) {
            insertHttp(NOW);
        }
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<JobId>>> futures = new ArrayList<>();

        // when
        for (int w = 0; w < workers; w++) {
            futures.add(executor.submit(() -> {
                start.await();
                List<JobId> mine = new ArrayList<>();
                List<JobClaim> claims;
                while (!(claims = store.claimEligible(NOW, 7)).isEmpty()) {
                    for (JobClaim claim : claims) {
                        try (claim) {
                            claim.apply(JobUpdate.to(JobStatus.PROCESSING));
                            claim.apply(JobUpdate.to(JobStatus.COMPLETED));
                            mine.add(claim.job().id());
                        }
                    }
                }
                return mine;
            }));
        }
        start.countDown();

        List<JobId> all = Collections.synchronizedList(new ArrayList<>());
        for (Future<List<JobId>> future : futures) {
            all.addAll(future.get(30, TimeUnit.SECONDS));
        }
        executor.shutdown();

        // then
        Set<JobId> unique = new HashSet<>(all);
        assertThat(all).hasSize(jobCount);
        assertThat(unique).hasSize(jobCount);
    }

    // ============================================================
    // helpers
    // ============================================================

    protected Job insertHttp(Instant runAt) {
        return insertHttp(runAt, 10);
    }

    protected Job insertHttp(Instant runAt, int retryLimit) {
        JobSpec spec = JobSpec.builder(JobType.GET)
            .target("https://example.com/hook")
            .retryLimit(retryLimit)
            .build();
        return store.insert(new NewJob(spec, spec.headers(), runAt, NOW));
    }

    protected Job insertPoll(String owner, Instant runAt) {
        JobSpec spec = JobSpec.builder(JobType.POLL).owner(owner).build();
        return store.insert(new NewJob(spec, spec.headers(), runAt, NOW));
    }

    protected void moveTo(JobId jobId, JobStatus... path) {
        try (JobClaim claim = store.claim(jobId).orElseThrow()) {
            for (JobStatus status : path) {
                claim.apply(JobUpdate.to(status));
            }
        }
    }
}
