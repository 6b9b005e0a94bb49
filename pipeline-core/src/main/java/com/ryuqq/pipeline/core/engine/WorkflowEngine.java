package com.ryuqq.pipeline.core.engine;

import com.ryuqq.pipeline.core.composition.BranchCase;
import com.ryuqq.pipeline.core.composition.BranchStage;
import com.ryuqq.pipeline.core.composition.ExhaustionPolicy;
import com.ryuqq.pipeline.core.composition.LoopStage;
import com.ryuqq.pipeline.core.composition.SequenceStage;
import com.ryuqq.pipeline.core.composition.Stage;
import com.ryuqq.pipeline.core.composition.StepStage;
import com.ryuqq.pipeline.core.context.RunContext;
import com.ryuqq.pipeline.core.error.ContractViolationException;
import com.ryuqq.pipeline.core.error.ErrorKind;
import com.ryuqq.pipeline.core.error.LoopExceededException;
import com.ryuqq.pipeline.core.error.WorkflowException;
import com.ryuqq.pipeline.core.outcome.Failed;
import com.ryuqq.pipeline.core.outcome.LoopReport;
import com.ryuqq.pipeline.core.outcome.RunReport;
import com.ryuqq.pipeline.core.outcome.Succeeded;
import com.ryuqq.pipeline.core.outcome.WorkflowFailure;
import com.ryuqq.pipeline.core.outcome.WorkflowResult;
import com.ryuqq.pipeline.core.progress.ProgressEvent;
import com.ryuqq.pipeline.core.progress.ProgressKind;
import com.ryuqq.pipeline.core.progress.ProgressLog;
import com.ryuqq.pipeline.core.schema.Invalid;
import com.ryuqq.pipeline.core.schema.Schema;
import com.ryuqq.pipeline.core.schema.Valid;
import com.ryuqq.pipeline.core.schema.Validation;
import com.ryuqq.pipeline.core.spi.CapabilityRegistry;
import com.ryuqq.pipeline.core.step.Step;
import com.ryuqq.pipeline.core.tracing.Span;
import com.ryuqq.pipeline.core.tracing.SpanStatus;
import com.ryuqq.pipeline.core.workflow.Workflow;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Workflow 실행 엔진.
 *
 * <p>커밋된 {@link Workflow}를 실행 한 건 단위로 해석합니다. 실행마다 새로운
 * {@link ProgressLog}, 루트 Span, 루프 요약 목록을 만들며 실행 간에 상태를 공유하지 않으므로,
 * 하나의 엔진 인스턴스를 여러 스레드에서 동시에 사용할 수 있습니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * 1. Workflow 입력 Schema 검증
 * 2. 루트 SequenceStage 해석 (StepStage / SequenceStage / BranchStage / LoopStage)
 * 3. Workflow 출력 Schema 검증
 * 4. 루트 Span 종료 → Succeeded 또는 Failed 반환 (RunReport 포함)
 * </pre>
 *
 * <p>Step 실패는 호출자에게 던지지 않고 {@link Failed}로 반환합니다. Step 본문에서 던진
 * {@link Error}도 Span과 진행 이벤트를 닫은 뒤 {@link Failed}로 반환합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final EngineConfig config;
    private final StepExecutor executor;
    private final CapabilityRegistry capabilities;
    private final Clock clock;
    private final Tracer tracer;

    /**
     * 기본 설정, 협력자 없이 생성.
     */
    public WorkflowEngine() {
        this(new EngineConfig(), CapabilityRegistry.EMPTY);
    }

    /**
     * 생성자.
     *
     * @param config 엔진 설정
     * @param capabilities 협력자 레지스트리
     */
    public WorkflowEngine(EngineConfig config, CapabilityRegistry capabilities) {
        this(config, capabilities, Sleeper.SYSTEM, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param config 엔진 설정
     * @param capabilities 협력자 레지스트리
     * @param sleeper 재시도 대기 구현
     * @param clock 이벤트/Span 시각용 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public WorkflowEngine(EngineConfig config, CapabilityRegistry capabilities, Sleeper sleeper, Clock clock) {
        this(config, capabilities, sleeper, clock, Tracer.NOOP);
    }

    /**
     * Micrometer Tracer로 Span을 내보내는 엔진 생성.
     *
     * @param config 엔진 설정
     * @param capabilities 협력자 레지스트리
     * @param tracer Step/Branch/Loop/Generator/Tool Span을 내보낼 Tracer
     */
    public WorkflowEngine(EngineConfig config, CapabilityRegistry capabilities, Tracer tracer) {
        this(config, capabilities, Sleeper.SYSTEM, Clock.systemUTC(), tracer);
    }

    /**
     * 생성자.
     *
     * @param config 엔진 설정
     * @param capabilities 협력자 레지스트리
     * @param sleeper 재시도 대기 구현
     * @param clock 이벤트/Span 시각용 시계
     * @param tracer Span을 내보낼 Micrometer Tracer
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public WorkflowEngine(EngineConfig config, CapabilityRegistry capabilities, Sleeper sleeper, Clock clock,
                          Tracer tracer) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (capabilities == null) {
            throw new IllegalArgumentException("capabilities cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (tracer == null) {
            throw new IllegalArgumentException("tracer cannot be null");
        }
        this.config = config;
        this.executor = new StepExecutor(config, sleeper);
        this.capabilities = capabilities;
        this.clock = clock;
        this.tracer = tracer;
    }

    /**
     * Workflow 실행.
     *
     * @param workflow 실행할 Workflow
     * @param input 입력 (Workflow 입력 Schema로 검증됨)
     * @param options 실행 옵션
     * @param <I> 입력 타입
     * @param <O> 출력 타입
     * @return 실행 결과 (실패도 예외가 아닌 {@link Failed}로 반환)
     * @throws IllegalArgumentException workflow 또는 options가 null인 경우
     */
    public <I, O> WorkflowResult<O> execute(Workflow<I, O> workflow, Object input, RunOptions options) {
        if (workflow == null) {
            throw new IllegalArgumentException("workflow cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }

        String runId = options.runId() != null ? options.runId() : UUID.randomUUID().toString();
        ProgressLog progressLog = new ProgressLog(options.listener(), clock);
        RunContext run = new RunContext(runId, workflow.id(), progressLog, options.scope(), capabilities,
            options.cancellation(), tracer);
        Span root = Span.root("workflow:" + workflow.id(), run.tracer(), clock);
        root.setAttribute("workflow.id", workflow.id());
        root.setAttribute("run.id", runId);
        root.setAttribute("tenant.id", options.scope().tenantId());
        List<LoopReport> loops = new ArrayList<>();
        long startedNanos = System.nanoTime();

        log.info("Workflow run started: {} (run={})", workflow.id(), runId);
        try {
            I validInput = validate(workflow.inputSchema(), input, workflow.id(), "workflow input");
            Object output = runStage(workflow.root(), validInput, run, root, loops);
            O validOutput = validate(workflow.outputSchema(), output, workflow.id(), "workflow output");
            root.end(SpanStatus.OK);
            RunReport report = report(run, root, loops, startedNanos);
            log.info("Workflow run completed: {} (run={}) in {}ms",
                workflow.id(), runId, report.duration().toMillis());
            return new Succeeded<>(validOutput, report);
        } catch (WorkflowException e) {
            closeOnFailure(root, e);
            RunReport report = report(run, root, loops, startedNanos);
            log.warn("Workflow run failed: {} (run={}) at step {} [{}]: {}",
                workflow.id(), runId, e.stepId(), e.kind(), e.getMessage());
            return new Failed<>(WorkflowFailure.of(e), report);
        } catch (RuntimeException e) {
            closeOnFailure(root, e);
            RunReport report = report(run, root, loops, startedNanos);
            log.error("Workflow run {} (run={}) failed unexpectedly", workflow.id(), runId, e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return new Failed<>(
                new WorkflowFailure(null, ErrorKind.TRANSIENT_EXECUTION_FAILURE, message, e), report);
        } catch (Error e) {
            closeOnFailure(root, e);
            RunReport report = report(run, root, loops, startedNanos);
            String failedStep = lastFailedStep(progressLog);
            log.error("Workflow run {} (run={}) aborted by {} at step {}",
                workflow.id(), runId, e.getClass().getSimpleName(), failedStep, e);
            String message = e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage());
            return new Failed<>(
                new WorkflowFailure(failedStep, ErrorKind.TRANSIENT_EXECUTION_FAILURE, message, e), report);
        }
    }

    private static String lastFailedStep(ProgressLog progressLog) {
        List<ProgressEvent> events = progressLog.events();
        for (int i = events.size() - 1; i >= 0; i--) {
            if (events.get(i).kind() == ProgressKind.ERROR) {
                return events.get(i).stepId();
            }
        }
        return null;
    }

    private Object runStage(Stage stage, Object value, RunContext run, Span parent, List<LoopReport> loops) {
        if (stage instanceof StepStage stepStage) {
            return executor.execute(stepStage.step(), value, run, parent);
        }
        if (stage instanceof SequenceStage sequence) {
            Object current = value;
            for (Stage child : sequence.stages()) {
                current = runStage(child, current, run, parent, loops);
            }
            return current;
        }
        if (stage instanceof BranchStage branch) {
            return runBranch(branch, value, run, parent);
        }
        if (stage instanceof LoopStage loop) {
            return runLoop(loop, value, run, parent, loops);
        }
        throw new IllegalStateException("Unsupported stage: " + stage);
    }

    private Object runBranch(BranchStage branch, Object value, RunContext run, Span parent) {
        Span span = parent.startChild("branch:" + branch.name());
        span.setAttribute("branch.cases", branch.cases().size());
        try {
            String selectedName = null;
            Step<?, ?> selected = null;
            for (BranchCase branchCase : branch.cases()) {
                if (test(branchCase.predicate(), value, branch.name(), branchCase.name())) {
                    selectedName = branchCase.name();
                    selected = branchCase.step();
                    break;
                }
            }
            if (selected == null && branch.otherwiseStep().isPresent()) {
                selectedName = BranchStage.OTHERWISE;
                selected = branch.otherwiseStep().get();
            }
            if (selected == null) {
                throw ContractViolationException.configuration(branch.name(),
                    "no case of branch '" + branch.name() + "' matched and no otherwise step is configured");
            }

            span.setAttribute("branch.selected", selectedName);
            log.debug("Branch {} selected case {} (run={})", branch.name(), selectedName, run.runId());
            Object output = executor.execute(selected, value, run, span);
            span.end(SpanStatus.OK);
            return output;
        } catch (RuntimeException | Error e) {
            closeOnFailure(span, e);
            throw e;
        }
    }

    private Object runLoop(LoopStage loop, Object value, RunContext run, Span parent, List<LoopReport> loops) {
        Span span = parent.startChild("loop:" + loop.name());
        span.setAttribute("loop.maxIterations", loop.maxIterations());
        try {
            if (loop.maxIterations() > config.maxLoopIterations()) {
                throw ContractViolationException.configuration(loop.name(),
                    "loop '" + loop.name() + "' declares maxIterations " + loop.maxIterations()
                        + " above the engine limit " + config.maxLoopIterations());
            }

            Object current = value;
            int iterations = 0;
            boolean continueLoop;
            do {
                current = executor.execute(loop.body(), current, run, span);
                iterations++;
                span.setAttribute("loop.iterations", iterations);
                continueLoop = test(loop.continueWhile(), current, loop.name(), "continueWhile");
            } while (continueLoop && iterations < loop.maxIterations());

            boolean exhausted = continueLoop;
            span.setAttribute("loop.exhausted", exhausted);
            loops.add(new LoopReport(loop.name(), iterations, exhausted));

            if (exhausted) {
                log.warn("Loop {} reached maxIterations {} without converging (run={}, policy={})",
                    loop.name(), iterations, run.runId(), loop.policy());
                if (loop.policy() == ExhaustionPolicy.FAIL) {
                    throw new LoopExceededException(loop.name(), iterations);
                }
            }
            span.end(SpanStatus.OK);
            return current;
        } catch (RuntimeException | Error e) {
            closeOnFailure(span, e);
            throw e;
        }
    }

    private static boolean test(Predicate<Object> predicate, Object value, String stageName, String predicateName) {
        try {
            return predicate.test(value);
        } catch (RuntimeException e) {
            throw ContractViolationException.configuration(stageName,
                "predicate '" + predicateName + "' of '" + stageName + "' failed: " + e);
        }
    }

    private static <T> T validate(Schema<T> schema, Object value, String workflowId, String boundary) {
        Validation<T> validation = schema.validate(value);
        if (validation instanceof Invalid<T> invalid) {
            throw new ContractViolationException(workflowId, boundary, schema.name(), invalid.violations());
        }
        return ((Valid<T>) validation).value();
    }

    private static void closeOnFailure(Span span, Throwable e) {
        if (span.isEnded()) {
            return;
        }
        SpanStatus status = statusOf(e);
        span.endOpenDescendants(status);
        span.recordException(e);
        span.end(status);
    }

    private static SpanStatus statusOf(Throwable e) {
        if (e instanceof WorkflowException workflowException && workflowException.kind() == ErrorKind.CANCELLED) {
            return SpanStatus.CANCELLED;
        }
        return SpanStatus.ERROR;
    }

    private static RunReport report(RunContext run, Span root, List<LoopReport> loops, long startedNanos) {
        Duration duration = Duration.ofNanos(System.nanoTime() - startedNanos);
        return new RunReport(run.runId(), run.workflowId(), run.progressLog().events(), root, loops, duration);
    }
}
