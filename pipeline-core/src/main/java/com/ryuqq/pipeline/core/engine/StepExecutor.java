package com.ryuqq.pipeline.core.engine;

import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.context.RunContext;
import com.ryuqq.pipeline.core.error.CancelledException;
import com.ryuqq.pipeline.core.error.ContractViolationException;
import com.ryuqq.pipeline.core.error.StepExecutionException;
import com.ryuqq.pipeline.core.error.WorkflowException;
import com.ryuqq.pipeline.core.progress.ProgressLog;
import com.ryuqq.pipeline.core.progress.StepKey;
import com.ryuqq.pipeline.core.schema.Invalid;
import com.ryuqq.pipeline.core.schema.Schema;
import com.ryuqq.pipeline.core.schema.Valid;
import com.ryuqq.pipeline.core.schema.Validation;
import com.ryuqq.pipeline.core.step.Step;
import com.ryuqq.pipeline.core.tracing.Span;
import com.ryuqq.pipeline.core.tracing.SpanStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Step 실행기.
 *
 * <p>Step 하나를 검증, 재시도, 진행 이벤트, Span과 함께 실행합니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * 1. START 이벤트, 자식 Span(step.id) 시작
 * 2. 입력 검증 (실패 시 CONTRACT_VIOLATION, 재시도 없음)
 * 3. 최대 retries + 1회 시도
 *    - 매 시도 전 취소 확인
 *    - 실패 시 PROGRESS {retrying, attempt, delayMs, error} 후 backoff 대기
 * 4. 성공: 출력 검증 → Span OK → COMPLETE {durationMs, attempts}
 * 5. 실패: Span ERROR → ERROR 이벤트 → 예외 전파
 *    취소: Span CANCELLED → CANCELLED 이벤트 → CancelledException 전파
 *    Error: Span ERROR → ERROR 이벤트 → 원래 Error 그대로 전파
 * </pre>
 *
 * <p>START가 입력 검증보다 먼저 기록되므로, 입력 Schema 위반은 해당 Step의
 * START → ERROR(CONTRACT_VIOLATION) 이벤트 쌍으로 나타납니다.</p>
 *
 * <p>backoff 대기는 {@value #BACKOFF_SLICE_MS}ms 단위로 나누어 자며, 조각 사이마다 취소를 확인합니다.</p>
 *
 * <p><strong>재시도 제외:</strong> {@link ContractViolationException},
 * {@link CancelledException}, {@code CollaboratorUnavailableException}
 * (재시도 불가능한 {@link com.ryuqq.pipeline.core.error.ErrorKind}).</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    static final long BACKOFF_SLICE_MS = 100;

    private final RetryBackoff backoff;
    private final Sleeper sleeper;

    /**
     * 생성자.
     *
     * @param config 엔진 설정
     * @param sleeper 재시도 대기 구현
     */
    public StepExecutor(EngineConfig config, Sleeper sleeper) {
        this(new RetryBackoff(config), sleeper);
    }

    /**
     * 생성자.
     *
     * @param backoff 재시도 간격 계산기
     * @param sleeper 재시도 대기 구현
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public StepExecutor(RetryBackoff backoff, Sleeper sleeper) {
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    /**
     * Step 실행.
     *
     * @param step 실행할 Step
     * @param input 입력 (입력 Schema로 검증됨)
     * @param run 실행 단위 상태
     * @param parent 부모 Span
     * @param <I> 입력 타입
     * @param <O> 출력 타입
     * @return 검증된 출력
     * @throws WorkflowException Step 실패, Schema 위반, 취소 시
     */
    public <I, O> O execute(Step<I, O> step, Object input, RunContext run, Span parent) {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        ProgressLog progress = run.progressLog();
        StepKey key = progress.open(step.id());

        Span span = parent.startChild(step.id());
        span.setAttribute("step.id", step.id());
        span.setAttribute("step.occurrence", key.occurrence());
        span.setAttribute("step.retries", step.retries());

        Map<String, Object> startPayload = new LinkedHashMap<>();
        startPayload.put("description", step.description());
        startPayload.put("retries", step.retries());
        progress.start(key, startPayload);
        log.debug("Step started: {} (run={})", key, run.runId());

        long startedNanos = System.nanoTime();
        int attempts = 0;
        try {
            I validInput = validate(step.inputSchema(), input, step.id(), "input");
            while (true) {
                attempts++;
                throwIfCancelled(run, key);

                Exception failure;
                try {
                    O output = step.execute(validInput, new ExecutionContext(run, key, span));
                    O validOutput = validate(step.outputSchema(), output, step.id(), "output");
                    closeLeakedChildren(span, key);

                    long durationMs = (System.nanoTime() - startedNanos) / 1_000_000;
                    span.setAttribute("step.attempts", attempts);
                    span.end(SpanStatus.OK);
                    Map<String, Object> completePayload = new LinkedHashMap<>();
                    completePayload.put("durationMs", durationMs);
                    completePayload.put("attempts", attempts);
                    progress.complete(key, completePayload);
                    log.debug("Step completed: {} in {}ms after {} attempt(s)", key, durationMs, attempts);
                    return validOutput;
                } catch (WorkflowException e) {
                    if (!e.kind().isRetryable()) {
                        throw e;
                    }
                    failure = e;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw cancelled(run, key, "interrupted");
                } catch (Exception e) {
                    failure = e;
                }

                if (attempts > step.retries()) {
                    throw new StepExecutionException(step.id(), attempts, failure);
                }
                awaitRetry(key, attempts, failure, run);
            }
        } catch (CancelledException e) {
            e.bindStep(step.id());
            close(span, SpanStatus.CANCELLED, e, attempts);
            if (!progress.isTerminated(key)) {
                progress.cancel(key, Map.of("reason", String.valueOf(e.getMessage())));
            }
            log.info("Step cancelled: {} (run={})", key, run.runId());
            throw e;
        } catch (WorkflowException e) {
            e.bindStep(step.id());
            close(span, SpanStatus.ERROR, e, attempts);
            if (!progress.isTerminated(key)) {
                progress.fail(key, errorPayload(e, attempts));
            }
            log.warn("Step failed: {} [{}] after {} attempt(s): {}", key, e.kind(), attempts, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            StepExecutionException wrapped = new StepExecutionException(step.id(), Math.max(attempts, 1), e);
            close(span, SpanStatus.ERROR, wrapped, attempts);
            if (!progress.isTerminated(key)) {
                progress.fail(key, errorPayload(wrapped, attempts));
            }
            log.error("Step {} failed unexpectedly (run={})", key, run.runId(), e);
            throw wrapped;
        } catch (Error e) {
            StepExecutionException wrapped = new StepExecutionException(step.id(), Math.max(attempts, 1), e);
            close(span, SpanStatus.ERROR, e, attempts);
            if (!progress.isTerminated(key)) {
                progress.fail(key, errorPayload(wrapped, attempts));
            }
            log.error("Step {} aborted by {} (run={})", key, e.getClass().getSimpleName(), run.runId(), e);
            throw e;
        }
    }

    private void awaitRetry(StepKey key, int attempt, Exception failure, RunContext run) {
        long delayMs = backoff.delayMs(attempt);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("retrying", true);
        payload.put("attempt", attempt);
        payload.put("delayMs", delayMs);
        payload.put("error", describe(failure));
        run.progressLog().progress(key, payload);
        log.warn("Step {} attempt {} failed, retrying in {}ms: {}", key, attempt, delayMs, describe(failure));

        long remaining = delayMs;
        while (remaining > 0) {
            throwIfCancelled(run, key);
            long slice = Math.min(remaining, BACKOFF_SLICE_MS);
            try {
                sleeper.sleep(slice);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw cancelled(run, key, "interrupted during retry backoff");
            }
            remaining -= slice;
        }
    }

    private static <T> T validate(Schema<T> schema, Object value, String stepId, String boundary) {
        Validation<T> validation = schema.validate(value);
        if (validation instanceof Invalid<T> invalid) {
            throw new ContractViolationException(stepId, boundary, schema.name(), invalid.violations());
        }
        return ((Valid<T>) validation).value();
    }

    private static void throwIfCancelled(RunContext run, StepKey key) {
        if (run.isCancelled()) {
            throw cancelled(run, key, "cancellation requested");
        }
    }

    private static CancelledException cancelled(RunContext run, StepKey key, String reason) {
        CancelledException cancelled = new CancelledException(
            "run '" + run.runId() + "' cancelled at step '" + key.stepId() + "': " + reason
        );
        cancelled.bindStep(key.stepId());
        return cancelled;
    }

    private static void closeLeakedChildren(Span span, StepKey key) {
        int leaked = span.endOpenDescendants(SpanStatus.ERROR);
        if (leaked > 0) {
            log.warn("Step {} left {} span(s) open; closed as ERROR", key, leaked);
        }
    }

    private static void close(Span span, SpanStatus status, Throwable cause, int attempts) {
        if (span.isEnded()) {
            return;
        }
        span.endOpenDescendants(status);
        span.setAttribute("step.attempts", attempts);
        span.recordException(cause);
        span.end(status);
    }

    private static Map<String, Object> errorPayload(WorkflowException e, int attempts) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("kind", e.kind().name());
        payload.put("error", describe(e));
        payload.put("attempts", attempts);
        return payload;
    }

    private static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        return message == null ? throwable.getClass().getSimpleName() : message;
    }
}
