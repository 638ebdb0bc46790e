package com.ryuqq.jobqueue.adapter.runner;

import com.ryuqq.jobqueue.application.queue.JobQueue;
import com.ryuqq.jobqueue.application.queue.PollRequest;
import com.ryuqq.jobqueue.application.queue.PolledJob;
import com.ryuqq.jobqueue.application.runtime.EngineRuntime;
import com.ryuqq.jobqueue.core.model.FailureLogEntry;
import com.ryuqq.jobqueue.core.model.Job;
import com.ryuqq.jobqueue.core.model.JobId;
import com.ryuqq.jobqueue.core.model.JobSpec;
import com.ryuqq.jobqueue.core.outcome.ClassifierConfig;
import com.ryuqq.jobqueue.core.outcome.ResponseClassifier;
import com.ryuqq.jobqueue.core.retry.BackoffPolicy;
import com.ryuqq.jobqueue.core.signing.PayloadSigner;
import com.ryuqq.jobqueue.core.signing.SecretLookup;
import com.ryuqq.jobqueue.core.spi.AsyncHttpClient;
import com.ryuqq.jobqueue.core.spi.FailureLog;
import com.ryuqq.jobqueue.core.spi.FunctionInvocationException;
import com.ryuqq.jobqueue.core.spi.FunctionInvoker;
import com.ryuqq.jobqueue.core.spi.JobStore;
import com.ryuqq.jobqueue.core.spi.RequestLedger;
import com.ryuqq.jobqueue.core.spi.SecretResolver;
import com.ryuqq.jobqueue.core.spi.SessionTokenProvider;
import com.ryuqq.jobqueue.core.spi.SpawnAuditSink;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * JobQueue 엔진 구현체.
 *
 * <p>제출/조회/poll/ack ({@link JobQueue})와 주기 작업 ({@link EngineRuntime})을 하나의
 * 진입점으로 묶습니다. 각 기능은 전용 컴포넌트에 위임합니다.</p>
 *
 * <h3>구성 요소</h3>
 * <pre>
 * submit / submitFromTrigger → JobSubmitter
 * poll / ack                 → PollLeaseManager
 * sweep                      → ClaimSweeper   (JobDispatcher, OutcomeApplier)
 * resolve                    → ResultResolver (ResponseClassifier, OutcomeApplier)
 * reap                       → StaleProcessingReaper
 * </pre>
 *
 * <h3>사용 예시</h3>
 * <pre>
 * EngineJobQueue engine = EngineJobQueue.builder()
 *     .store(new InMemoryJobStore())
 *     .failureLog(new InMemoryFailureLog())
 *     .requestLedger(new InMemoryRequestLedger())
 *     .httpClient(new JdkAsyncHttpClient())
 *     .secretResolver(vault)
 *     .build();
 *
 * new TickScheduler(engine, new TickConfig()).start();
 * </pre>
 *
 * @author JobQueue Team
 * @since 1.0.0
 */
public final class EngineJobQueue implements JobQueue, EngineRuntime {

    private final JobStore store;
    private final FailureLog failureLog;
    private final JobSubmitter submitter;
    private final PollLeaseManager pollLeaseManager;
    private final ClaimSweeper claimSweeper;
    private final ResultResolver resultResolver;
    private final StaleProcessingReaper staleProcessingReaper;

    private EngineJobQueue(Builder builder) {
        this.store = builder.store;
        this.failureLog = builder.failureLog;

        SecretLookup secretLookup = new SecretLookup(builder.secretResolver);
        ResponseClassifier classifier = new ResponseClassifier(builder.classifierConfig, new BackoffPolicy());

        this.submitter = new JobSubmitter(store, new PayloadSigner(secretLookup), builder.spawnAuditSink, builder.clock);
        OutcomeApplier applier = new OutcomeApplier(failureLog, new RedirectSpawner(submitter));
        JobDispatcher dispatcher = new JobDispatcher(
            builder.httpClient,
            builder.functionInvoker,
            builder.requestLedger,
            new AuthorizationResolver(builder.sessionTokenProvider),
            builder.sweeperConfig
        );

        this.claimSweeper = new ClaimSweeper(store, dispatcher, applier, classifier, builder.sweeperConfig, builder.clock);
        this.resultResolver = new ResultResolver(
            store, builder.requestLedger, builder.httpClient, classifier, applier, builder.resolverConfig, builder.clock);
        this.staleProcessingReaper = new StaleProcessingReaper(
            store, builder.requestLedger, classifier, applier, builder.staleReaperConfig, builder.clock);
        this.pollLeaseManager = new PollLeaseManager(store, secretLookup, builder.pollLeaseConfig, builder.clock);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Job submit(JobSpec spec) {
        return submitter.submit(spec);
    }

    @Override
    public Job submitFromTrigger(JobSpec spec, String source) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source cannot be null or blank");
        }
        return submitter.submit(spec, source);
    }

    @Override
    public Optional<Job> find(JobId jobId) {
        return store.find(jobId);
    }

    @Override
    public List<FailureLogEntry> failures(JobId jobId) {
        return failureLog.findByJob(jobId);
    }

    @Override
    public Optional<PolledJob> poll(PollRequest request) {
        return pollLeaseManager.poll(request);
    }

    @Override
    public boolean ack(JobId jobId, String hmac) {
        return pollLeaseManager.ack(jobId, hmac);
    }

    @Override
    public int sweep() {
        return claimSweeper.sweep();
    }

    @Override
    public int resolve() {
        return resultResolver.resolve();
    }

    @Override
    public int reap() {
        return staleProcessingReaper.reap();
    }

    /**
     * EngineJobQueue 빌더.
     *
     * <p>store, failureLog, requestLedger, httpClient는 필수입니다. 나머지는 기본값을 사용합니다:</p>
     * <ul>
     *   <li>functionInvoker: 모든 호출 실패 (FUNC Job 미사용 시)</li>
     *   <li>secretResolver: vault 없음</li>
     *   <li>sessionTokenProvider: 세션 없음</li>
     *   <li>spawnAuditSink: 기록 안 함</li>
     *   <li>clock: UTC 시스템 시계</li>
     *   <li>설정: 각 config의 기본 생성자</li>
     * </ul>
     */
    public static final class Builder {

        private JobStore store;
        private FailureLog failureLog;
        private RequestLedger requestLedger;
        private AsyncHttpClient httpClient;
        private FunctionInvoker functionInvoker = (schema, name, namedArgs) -> {
            throw new FunctionInvocationException("No function invoker configured for " + schema + "." + name);
        };
        private SecretResolver secretResolver = name -> Optional.empty();
        private SessionTokenProvider sessionTokenProvider = SessionTokenProvider.none();
        private SpawnAuditSink spawnAuditSink = SpawnAuditSink.noop();
        private Clock clock = Clock.systemUTC();
        private SweeperConfig sweeperConfig = new SweeperConfig();
        private ResolverConfig resolverConfig = new ResolverConfig();
        private PollLeaseConfig pollLeaseConfig = new PollLeaseConfig();
        private StaleReaperConfig staleReaperConfig = new StaleReaperConfig();
        private ClassifierConfig classifierConfig = new ClassifierConfig();

        private Builder() {
        }

        public Builder store(JobStore store) {
            this.store = store;
            return this;
        }

        public Builder failureLog(FailureLog failureLog) {
            this.failureLog = failureLog;
            return this;
        }

        public Builder requestLedger(RequestLedger requestLedger) {
            this.requestLedger = requestLedger;
            return this;
        }

        public Builder httpClient(AsyncHttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder functionInvoker(FunctionInvoker functionInvoker) {
            this.functionInvoker = functionInvoker;
            return this;
        }

        public Builder secretResolver(SecretResolver secretResolver) {
            this.secretResolver = secretResolver;
            return this;
        }

        public Builder sessionTokenProvider(SessionTokenProvider sessionTokenProvider) {
            this.sessionTokenProvider = sessionTokenProvider;
            return this;
        }

        public Builder spawnAuditSink(SpawnAuditSink spawnAuditSink) {
            this.spawnAuditSink = spawnAuditSink;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sweeperConfig(SweeperConfig sweeperConfig) {
            this.sweeperConfig = sweeperConfig;
            return this;
        }

        public Builder resolverConfig(ResolverConfig resolverConfig) {
            this.resolverConfig = resolverConfig;
            return this;
        }

        public Builder pollLeaseConfig(PollLeaseConfig pollLeaseConfig) {
            this.pollLeaseConfig = pollLeaseConfig;
            return this;
        }

        public Builder staleReaperConfig(StaleReaperConfig staleReaperConfig) {
            this.staleReaperConfig = staleReaperConfig;
            return this;
        }

        public Builder classifierConfig(ClassifierConfig classifierConfig) {
            this.classifierConfig = classifierConfig;
            return this;
        }

        /**
         * 엔진 생성.
         *
         * @return EngineJobQueue
         * @throws IllegalArgumentException 필수 구성 요소가 없는 경우
         */
        public EngineJobQueue build() {
            if (store == null) {
                throw new IllegalArgumentException("store cannot be null");
            }
            if (failureLog == null) {
                throw new IllegalArgumentException("failureLog cannot be null");
            }
            if (requestLedger == null) {
                throw new IllegalArgumentException("requestLedger cannot be null");
            }
            if (httpClient == null) {
                throw new IllegalArgumentException("httpClient cannot be null");
            }
            return new EngineJobQueue(this);
        }
    }
}
