package com.ryuqq.aiorchestrator.adapter.runner;

import com.ryuqq.aiorchestrator.application.orchestrator.ModelOrchestrator;
import com.ryuqq.aiorchestrator.core.contract.QueryRequest;
import com.ryuqq.aiorchestrator.core.contract.QueryResponse;
import com.ryuqq.aiorchestrator.core.contract.Timing;
import com.ryuqq.aiorchestrator.core.exception.AdapterException;
import com.ryuqq.aiorchestrator.core.exception.BackendUnavailableException;
import com.ryuqq.aiorchestrator.core.exception.NoAuthorizedModelException;
import com.ryuqq.aiorchestrator.core.exception.OrchestrationException;
import com.ryuqq.aiorchestrator.core.exception.SchemaValidationException;
import com.ryuqq.aiorchestrator.core.model.ModelDescriptor;
import com.ryuqq.aiorchestrator.core.model.ModelId;
import com.ryuqq.aiorchestrator.core.model.TaskType;
import com.ryuqq.aiorchestrator.core.outcome.Fail;
import com.ryuqq.aiorchestrator.core.outcome.Ok;
import com.ryuqq.aiorchestrator.core.outcome.Outcome;
import com.ryuqq.aiorchestrator.core.permission.TierChecker;
import com.ryuqq.aiorchestrator.core.result.ResultPayload;
import com.ryuqq.aiorchestrator.core.schema.SchemaValidator;
import com.ryuqq.aiorchestrator.core.spi.BackendAdapter;
import com.ryuqq.aiorchestrator.core.spi.InteractionLog;
import com.ryuqq.aiorchestrator.core.spi.InteractionRecord;
import com.ryuqq.aiorchestrator.core.spi.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ModelOrchestrator 구현체.
 *
 * <p>요청 검증, 모델 선택, 어댑터 위임, 결과 검증, 실패 처리를 수행합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>SchemaValidator.validateRequest</li>
 *   <li>명시적 선택: lookup → 권한 → UNAVAILABLE 검사 (대체 없음)</li>
 *   <li>자동 선택: 작업 유형 결정 → ModelSelector</li>
 *   <li>어댑터 호출: 전용 스레드 풀에서 실행, 남은 타임아웃까지 대기</li>
 *   <li>결과 검증 후 QueryResponse 생성</li>
 *   <li>모든 호출(성공/실패)을 InteractionLog에 기록</li>
 * </ol>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>TRANSIENT (타임아웃, 연결 실패, 5xx): FailureTracker 기록, 자동 선택이면 실패 모델을 제외하고 1회 재선택</li>
 *   <li>PERMANENT: BackendUnavailableException, 재시도 및 상태 변화 없음</li>
 *   <li>MALFORMED_RESPONSE 또는 결과 검증 실패: SchemaValidationException, 재시도 없음</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>호출 간 공유되는 가변 상태 없음 (호출 상태는 스택에만 존재)</li>
 *   <li>선택된 descriptor는 값으로 보관되어 이후 레지스트리 변경에 영향받지 않음</li>
 *   <li>타임아웃 시 백엔드 작업은 cancel(true)로 best-effort 취소되고, 호출자는 즉시 반환</li>
 *   <li>스레드 풀 포화로 시작조차 못 한 호출은 모델 실패로 기록하지 않음 (BackendUnavailableException)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultModelOrchestrator implements ModelOrchestrator, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DefaultModelOrchestrator.class);

    private static final int MAX_AUTO_ATTEMPTS = 2;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ModelSelector selector;
    private final BackendRouter router;
    private final FailureTracker failureTracker;
    private final InteractionLog interactionLog;
    private final OrchestratorConfig config;
    private final ExecutorService dispatchExecutor;

    /**
     * 생성자 (기본 설정, 기록하지 않는 InteractionLog).
     *
     * @param registry 모델 레지스트리
     * @param adapters 백엔드 어댑터 목록
     */
    public DefaultModelOrchestrator(ModelRegistry registry, Collection<? extends BackendAdapter> adapters) {
        this(registry, adapters, InteractionLog.noop(), new OrchestratorConfig());
    }

    /**
     * 생성자.
     *
     * @param registry 모델 레지스트리
     * @param adapters 백엔드 어댑터 목록 (종류마다 최대 하나)
     * @param interactionLog 사용 기록
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultModelOrchestrator(ModelRegistry registry, Collection<? extends BackendAdapter> adapters,
                                    InteractionLog interactionLog, OrchestratorConfig config) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (interactionLog == null) {
            throw new IllegalArgumentException("interactionLog cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.router = new BackendRouter(adapters);
        this.selector = new ModelSelector(registry, new TierChecker(), config.selectionPolicy());
        this.failureTracker = new FailureTracker(registry, config.failureThreshold());
        this.interactionLog = interactionLog;
        this.config = config;
        this.dispatchExecutor = Executors.newFixedThreadPool(config.dispatchConcurrency(), new DispatchThreadFactory());
    }

    @Override
    public QueryResponse query(QueryRequest request) {
        Instant startedAt = Instant.now();
        long startNanos = System.nanoTime();
        CallTrace trace = new CallTrace();
        try {
            QueryResponse response = execute(request, startedAt, startNanos, trace);
            recordInteraction(request, startedAt, startNanos, response.modelId(), null);
            return response;
        } catch (OrchestrationException e) {
            recordInteraction(request, startedAt, startNanos, trace.lastModel, e);
            throw e;
        }
    }

    @Override
    public Outcome submit(QueryRequest request) {
        try {
            return new Ok(query(request));
        } catch (OrchestrationException e) {
            return Fail.from(e);
        }
    }

    /**
     * 연속 실패 정보 (모니터링/테스트용).
     */
    public FailureTracker failureTracker() {
        return failureTracker;
    }

    public BackendRouter router() {
        return router;
    }

    /**
     * 호출 스레드 풀 종료.
     *
     * <p>진행 중인 호출이 끝날 때까지 최대 30초 대기한 뒤 강제 종료합니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        dispatchExecutor.shutdown();
        if (!dispatchExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            dispatchExecutor.shutdownNow();
        }
    }

    @Override
    public void close() {
        dispatchExecutor.shutdownNow();
    }

    private QueryResponse execute(QueryRequest request, Instant startedAt, long startNanos, CallTrace trace) {
        SchemaValidator.validateRequest(request);
        Duration timeout = request.callTimeout().orElse(config.defaultTimeout());
        long deadlineNanos = startNanos + timeout.toNanos();

        if (request.isExplicitSelection()) {
            return executeExplicit(request, startedAt, deadlineNanos, trace);
        }
        return executeAuto(request, startedAt, deadlineNanos, trace);
    }

    private QueryResponse executeExplicit(QueryRequest request, Instant startedAt, long deadlineNanos,
                                          CallTrace trace) {
        trace.lastModel = request.modelId();
        ModelDescriptor descriptor = selector.selectExplicit(request.modelId(), request.callerTier());
        trace.lastModel = descriptor.id();
        try {
            return invoke(descriptor, request, startedAt, deadlineNanos, 1, List.of());
        } catch (AdapterException e) {
            throw mapNonRetryable(descriptor, e);
        }
    }

    private QueryResponse executeAuto(QueryRequest request, Instant startedAt, long deadlineNanos,
                                      CallTrace trace) {
        TaskType taskType = TaskTypeResolver.resolve(request);
        Set<ModelId> excluded = new HashSet<>();
        List<ModelId> failedOver = new ArrayList<>();
        AdapterException lastFailure = null;

        for (int attempt = 1; attempt <= MAX_AUTO_ATTEMPTS; attempt++) {
            ModelDescriptor descriptor;
            try {
                descriptor = selector.selectAuto(taskType, request.callerTier(), excluded);
            } catch (NoAuthorizedModelException e) {
                if (lastFailure == null) {
                    throw e;
                }
                throw new BackendUnavailableException(trace.lastModel,
                    "Model " + trace.lastModel.getValue() + " failed and no alternative model is available: "
                        + lastFailure.getMessage(), lastFailure);
            }
            trace.lastModel = descriptor.id();

            try {
                return invoke(descriptor, request, startedAt, deadlineNanos, attempt, failedOver);
            } catch (AdapterException e) {
                if (!e.isTransient()) {
                    throw mapNonRetryable(descriptor, e);
                }
                lastFailure = e;
                excluded.add(descriptor.id());
                failedOver.add(descriptor.id());
                if (deadlineNanos - System.nanoTime() <= 0) {
                    break;
                }
                if (attempt < MAX_AUTO_ATTEMPTS) {
                    log.info("Retrying task '{}' without {} after transient failure",
                        taskType.getValue(), descriptor.id().getValue());
                }
            }
        }

        throw new BackendUnavailableException(trace.lastModel,
            "Model " + trace.lastModel.getValue() + " unavailable: " + lastFailure.getMessage(), lastFailure);
    }

    /**
     * 어댑터 호출 및 결과 검증.
     *
     * <p>일시적 실패는 FailureTracker에 기록한 뒤 그대로 던집니다.
     * 재시도 여부는 호출자가 결정합니다.</p>
     */
    private QueryResponse invoke(ModelDescriptor descriptor, QueryRequest request, Instant startedAt,
                                 long deadlineNanos, int attempt, List<ModelId> failedOver) throws AdapterException {
        BackendAdapter adapter = router.route(descriptor);
        ResultPayload payload;
        try {
            payload = dispatch(adapter, descriptor, request, deadlineNanos);
        } catch (AdapterException e) {
            if (e.isTransient()) {
                int failures = failureTracker.recordTransientFailure(descriptor.id());
                log.warn("Transient failure from {} (attempt {}, consecutive {}): {}",
                    descriptor.id().getValue(), attempt, failures, e.getMessage());
            }
            throw e;
        }

        Duration elapsed = Duration.between(startedAt, Instant.now());
        QueryResponse response = new QueryResponse(descriptor.id(), checkPayload(payload, descriptor),
            new Timing(startedAt, elapsed.isNegative() ? Duration.ZERO : elapsed, attempt), failedOver);
        SchemaValidator.validateResponse(response, descriptor);
        failureTracker.recordSuccess(descriptor.id());
        log.debug("Query served by {} in {} ms (attempt {})",
            descriptor.id().getValue(), elapsed.toMillis(), attempt);
        return response;
    }

    private ResultPayload checkPayload(ResultPayload payload, ModelDescriptor descriptor) {
        if (payload == null) {
            throw new SchemaValidationException("payload",
                "model " + descriptor.id().getValue() + " returned no result");
        }
        return payload;
    }

    private ResultPayload dispatch(BackendAdapter adapter, ModelDescriptor descriptor, QueryRequest request,
                                   long deadlineNanos) throws AdapterException {
        long remainingNanos = deadlineNanos - System.nanoTime();
        if (remainingNanos <= 0) {
            throw AdapterException.transientFailure("timeout budget exhausted before dispatch", null);
        }

        AtomicBoolean started = new AtomicBoolean();
        Future<ResultPayload> future;
        try {
            future = dispatchExecutor.submit(() -> {
                started.set(true);
                return adapter.invoke(descriptor, request);
            });
        } catch (RejectedExecutionException e) {
            throw new BackendUnavailableException(descriptor.id(), "Orchestrator is shut down", e);
        }

        try {
            return future.get(remainingNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            if (!started.get()) {
                // queued behind other calls; the model was never reached
                log.warn("Dispatch pool saturated: call for {} did not start within {} ms",
                    descriptor.id().getValue(), TimeUnit.NANOSECONDS.toMillis(remainingNanos));
                throw new BackendUnavailableException(descriptor.id(),
                    "Dispatch capacity exhausted: call for " + descriptor.id().getValue() + " did not start within "
                        + TimeUnit.NANOSECONDS.toMillis(remainingNanos) + " ms", e);
            }
            throw AdapterException.transientFailure(
                "timed out after " + TimeUnit.NANOSECONDS.toMillis(remainingNanos) + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException(descriptor.id(), "Query interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AdapterException) {
                throw (AdapterException) cause;
            }
            log.error("Adapter for {} leaked an unexpected exception", descriptor.backendKind().wireName(), cause);
            throw AdapterException.permanentFailure("unexpected adapter error: " + cause, cause);
        }
    }

    private OrchestrationException mapNonRetryable(ModelDescriptor descriptor, AdapterException e) {
        switch (e.failure()) {
            case MALFORMED_RESPONSE:
                return new SchemaValidationException("payload",
                    "model " + descriptor.id().getValue() + " returned a malformed response: " + e.getMessage());
            case PERMANENT:
                log.warn("Permanent failure from {}: {}", descriptor.id().getValue(), e.getMessage());
                return new BackendUnavailableException(descriptor.id(),
                    "Model " + descriptor.id().getValue() + " rejected the request: " + e.getMessage(), e);
            case TRANSIENT:
            default:
                return new BackendUnavailableException(descriptor.id(),
                    "Model " + descriptor.id().getValue() + " unavailable: " + e.getMessage(), e);
        }
    }

    private void recordInteraction(QueryRequest request, Instant startedAt, long startNanos, ModelId modelId,
                                   OrchestrationException failure) {
        try {
            interactionLog.record(new InteractionRecord(
                startedAt,
                modelId,
                request == null ? null : request.callerTier(),
                request == null || request.input() == null ? 0 : request.input().length(),
                failure == null,
                failure == null ? null : failure.kind(),
                Duration.ofNanos(System.nanoTime() - startNanos)
            ));
        } catch (RuntimeException e) {
            log.warn("Failed to record interaction", e);
        }
    }

    /**
     * 호출 단위 추적 정보 (마지막으로 선택된 모델).
     */
    private static final class CallTrace {
        ModelId lastModel;
    }

    /**
     * 데몬 스레드 팩토리 (model-dispatch-N).
     */
    private static final class DispatchThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "model-dispatch-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
