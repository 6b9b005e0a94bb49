package com.ryuqq.pipeline.core.engine;

import com.ryuqq.pipeline.core.composition.Branch;
import com.ryuqq.pipeline.core.composition.ExhaustionPolicy;
import com.ryuqq.pipeline.core.context.CancellationToken;
import com.ryuqq.pipeline.core.error.ErrorKind;
import com.ryuqq.pipeline.core.outcome.Failed;
import com.ryuqq.pipeline.core.outcome.LoopReport;
import com.ryuqq.pipeline.core.outcome.Succeeded;
import com.ryuqq.pipeline.core.outcome.WorkflowResult;
import com.ryuqq.pipeline.core.progress.ProgressEvent;
import com.ryuqq.pipeline.core.progress.ProgressKind;
import com.ryuqq.pipeline.core.schema.Schemas;
import com.ryuqq.pipeline.core.spi.CapabilityRegistry;
import com.ryuqq.pipeline.core.spi.ProgressSink;
import com.ryuqq.pipeline.core.step.Step;
import com.ryuqq.pipeline.core.step.Steps;
import com.ryuqq.pipeline.core.tracing.Span;
import com.ryuqq.pipeline.core.tracing.SpanStatus;
import com.ryuqq.pipeline.core.workflow.Workflow;
import io.micrometer.tracing.test.simple.SimpleSpan;
import io.micrometer.tracing.test.simple.SimpleTracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WorkflowEngine 유닛 테스트.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class WorkflowEngineTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    private WorkflowEngine engine;

    @BeforeEach
    void setUp() {
        engine = new WorkflowEngine(EngineConfig.noDelay(), CapabilityRegistry.EMPTY, millis -> { }, FIXED_CLOCK);
    }

    private static Step<Integer, Integer> add(String id, int amount) {
        return Steps.define(id)
            .input(Schemas.integer("value"))
            .output(Schemas.integer("value"))
            .handle((value, ctx) -> value + amount);
    }

    // ============================================================
    // 1. Sequence
    // ============================================================

    @Test
    void execute_순차_Step은_이전_출력을_다음_입력으로_전달() {
        // given
        Workflow<Integer, Integer> workflow = Workflow.builder("arithmetic", Schemas.integer("value"))
            .then(add("add-one", 1))
            .then(add("add-ten", 10))
            .commit(Schemas.integer("value"));

        // when
        WorkflowResult<Integer> result = engine.execute(workflow, 5, RunOptions.defaults().withRunId("run-seq"));

        // then
        assertThat(result.isSucceeded()).isTrue();
        assertThat(result.valueOrThrow()).isEqualTo(16);
        assertThat(result.report().runId()).isEqualTo("run-seq");
        assertThat(result.report().events()).extracting(ProgressEvent::stepId)
            .containsExactly("add-one", "add-one", "add-ten", "add-ten");

        Span root = result.report().rootSpan();
        assertThat(root.name()).isEqualTo("workflow:arithmetic");
        assertThat(root.status()).isEqualTo(SpanStatus.OK);
        assertThat(root.attribute("run.id")).isEqualTo("run-seq");
        assertThat(root.children()).extracting(Span::name).containsExactly("add-one", "add-ten");
    }

    @Test
    void execute_runId가_없으면_생성() {
        // given
        Workflow<Integer, Integer> workflow = Workflow.builder("single", Schemas.integer("value"))
            .then(add("add-one", 1))
            .commit(Schemas.integer("value"));

        // when
        WorkflowResult<Integer> result = engine.execute(workflow, 1, RunOptions.defaults());

        // then
        assertThat(result.report().runId()).isNotBlank();
        assertThat(result.report().workflowId()).isEqualTo("single");
    }

    @Test
    void execute_null_인자는_예외() {
        assertThatThrownBy(() -> engine.execute(null, 1, RunOptions.defaults()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("workflow cannot be null");
    }

    // ============================================================
    // 2. Branch
    // ============================================================

    @Test
    void execute_분기는_첫번째로_일치한_case만_실행() {
        // given
        AtomicInteger convertCalls = new AtomicInteger();
        Step<String, String> convert = Steps.define("convert")
            .input(Schemas.string("format"))
            .output(Schemas.string("result"))
            .handle((format, ctx) -> {
                convertCalls.incrementAndGet();
                return "converted";
            });
        Step<String, String> passThrough = Steps.define("pass-through")
            .input(Schemas.string("format"))
            .output(Schemas.string("result"))
            .handle((format, ctx) -> "passed");

        Workflow<String, String> workflow = Workflow.builder("formats", Schemas.string("format"))
            .branch(Branch.<String, String>named("by-format")
                .when("binary", format -> format.equals("pdf") || format.equals("html"), convert)
                .when("textual", format -> format.equals("text") || format.equals("markdown"), passThrough))
            .commit(Schemas.string("result"));

        // when
        WorkflowResult<String> result = engine.execute(workflow, "markdown", RunOptions.defaults());

        // then
        assertThat(result.valueOrThrow()).isEqualTo("passed");
        assertThat(convertCalls.get()).isZero();
        assertThat(result.report().eventsFor("convert")).isEmpty();

        Span branch = result.report().rootSpan().find("branch:by-format").orElseThrow();
        assertThat(branch.attribute("branch.selected")).isEqualTo("textual");
        assertThat(branch.children()).extracting(Span::name).containsExactly("pass-through");
    }

    @Test
    void execute_일치하는_case가_없으면_otherwise_실행() {
        // given
        Workflow<String, String> workflow = Workflow.builder("fallback", Schemas.string("format"))
            .branch(Branch.<String, String>named("by-format")
                .when("pdf", "pdf"::equals, echo("pdf-step"))
                .otherwise(echo("default-step")))
            .commit(Schemas.string("result"));

        // when
        WorkflowResult<String> result = engine.execute(workflow, "docx", RunOptions.defaults());

        // then
        assertThat(result.isSucceeded()).isTrue();
        assertThat(result.report().rootSpan().find("branch:by-format").orElseThrow().attribute("branch.selected"))
            .isEqualTo("otherwise");
        assertThat(result.report().eventsFor("default-step")).hasSize(2);
    }

    @Test
    void execute_일치하는_case와_otherwise가_없으면_CONTRACT_VIOLATION() {
        // given
        Workflow<String, String> workflow = Workflow.builder("strict-branch", Schemas.string("format"))
            .branch(Branch.<String, String>named("by-format").when("pdf", "pdf"::equals, echo("pdf-step")))
            .commit(Schemas.string("result"));

        // when
        WorkflowResult<String> result = engine.execute(workflow, "docx", RunOptions.defaults());

        // then
        assertThat(result).isInstanceOf(Failed.class);
        Failed<String> failed = (Failed<String>) result;
        assertThat(failed.failure().kind()).isEqualTo(ErrorKind.CONTRACT_VIOLATION);
        assertThat(failed.failure().stepId()).isEqualTo("by-format");
        assertThat(failed.report().rootSpan().find("branch:by-format").orElseThrow().status())
            .isEqualTo(SpanStatus.ERROR);
        assertThat(failed.report().rootSpan().status()).isEqualTo(SpanStatus.ERROR);
    }

    @Test
    void execute_분기_조건_예외는_CONTRACT_VIOLATION() {
        // given
        Workflow<String, String> workflow = Workflow.builder("broken-predicate", Schemas.string("format"))
            .branch(Branch.<String, String>named("by-format")
                .when("explodes", format -> {
                    throw new IllegalStateException("boom");
                }, echo("never")))
            .commit(Schemas.string("result"));

        // when
        WorkflowResult<String> result = engine.execute(workflow, "pdf", RunOptions.defaults());

        // then
        assertThat(((Failed<String>) result).failure().kind()).isEqualTo(ErrorKind.CONTRACT_VIOLATION);
        assertThat(((Failed<String>) result).failure().message()).contains("boom");
    }

    private static Step<String, String> echo(String id) {
        return Steps.define(id)
            .input(Schemas.string("in"))
            .output(Schemas.string("out"))
            .handle((text, ctx) -> text);
    }

    // ============================================================
    // 3. Loop
    // ============================================================

    @Test
    void execute_루프는_조건이_거짓이_될때까지_반복() {
        // given
        Workflow<Integer, Integer> workflow = Workflow.builder("converge", Schemas.integer("value"))
            .repeatUntil(add("increment", 1), value -> value < 3, 10)
            .commit(Schemas.integer("value"));

        // when
        WorkflowResult<Integer> result = engine.execute(workflow, 0, RunOptions.defaults());

        // then
        assertThat(result.valueOrThrow()).isEqualTo(3);
        LoopReport loop = result.report().loop("increment").orElseThrow();
        assertThat(loop.iterations()).isEqualTo(3);
        assertThat(loop.converged()).isTrue();
        assertThat(result.report().hasExhaustedLoop()).isFalse();

        assertThat(result.report().eventsFor("increment")).extracting(ProgressEvent::occurrence)
            .containsExactly(1, 1, 2, 2, 3, 3);
        Span loopSpan = result.report().rootSpan().find("loop:increment").orElseThrow();
        assertThat(loopSpan.attribute("loop.iterations")).isEqualTo(3);
        assertThat(loopSpan.attribute("loop.exhausted")).isEqualTo(false);
        assertThat(loopSpan.children()).hasSize(3);
    }

    @Test
    void execute_루프_본문은_조건과_무관하게_최소_1회_실행() {
        // given
        Workflow<Integer, Integer> workflow = Workflow.builder("once", Schemas.integer("value"))
            .repeatUntil(add("increment", 1), value -> false, 5)
            .commit(Schemas.integer("value"));

        // when
        WorkflowResult<Integer> result = engine.execute(workflow, 100, RunOptions.defaults());

        // then
        assertThat(result.valueOrThrow()).isEqualTo(101);
        assertThat(result.report().loop("increment").orElseThrow().iterations()).isEqualTo(1);
    }

    @Test
    void execute_최대_반복_도달시_FLAG_정책은_성공과_함께_소진_표시() {
        // given
        Workflow<Integer, Integer> workflow = Workflow.builder("never-converges", Schemas.integer("value"))
            .repeatUntil(add("increment", 1), value -> true, 4)
            .commit(Schemas.integer("value"));

        // when
        WorkflowResult<Integer> result = engine.execute(workflow, 0, RunOptions.defaults());

        // then
        assertThat(result.isSucceeded()).isTrue();
        assertThat(result.valueOrThrow()).isEqualTo(4);
        LoopReport loop = result.report().loop("increment").orElseThrow();
        assertThat(loop.iterations()).isEqualTo(4);
        assertThat(loop.exhausted()).isTrue();
        assertThat(result.report().hasExhaustedLoop()).isTrue();
    }

    @Test
    void execute_최대_반복_도달시_FAIL_정책은_LOOP_EXCEEDED() {
        // given
        Workflow<Integer, Integer> workflow = Workflow.builder("strict-loop", Schemas.integer("value"))
            .repeatUntil(add("increment", 1), value -> true, 3, ExhaustionPolicy.FAIL)
            .commit(Schemas.integer("value"));

        // when
        WorkflowResult<Integer> result = engine.execute(workflow, 0, RunOptions.defaults());

        // then
        assertThat(result.isFailed()).isTrue();
        Failed<Integer> failed = (Failed<Integer>) result;
        assertThat(failed.failure().kind()).isEqualTo(ErrorKind.LOOP_EXCEEDED);
        assertThat(failed.report().loop("increment").orElseThrow().iterations()).isEqualTo(3);
        assertThat(failed.report().rootSpan().find("loop:increment").orElseThrow().status())
            .isEqualTo(SpanStatus.ERROR);
        assertThatThrownBy(result::valueOrThrow).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void execute_엔진_한도를_넘는_maxIterations는_CONTRACT_VIOLATION() {
        // given
        WorkflowEngine limited = new WorkflowEngine(EngineConfig.noDelay().withMaxLoopIterations(5),
            CapabilityRegistry.EMPTY);
        Workflow<Integer, Integer> workflow = Workflow.builder("too-long", Schemas.integer("value"))
            .repeatUntil(add("increment", 1), value -> value < 3, 50)
            .commit(Schemas.integer("value"));

        // when
        WorkflowResult<Integer> result = limited.execute(workflow, 0, RunOptions.defaults());

        // then
        Failed<Integer> failed = (Failed<Integer>) result;
        assertThat(failed.failure().kind()).isEqualTo(ErrorKind.CONTRACT_VIOLATION);
        assertThat(failed.report().eventsFor("increment")).isEmpty();
    }

    // ============================================================
    // 4. 실패/취소
    // ============================================================

    @Test
    void execute_입력_Schema_위반은_Step_실행_없이_실패() {
        // given
        Workflow<String, String> workflow = Workflow.builder("validated", Schemas.string("topic").nonBlank())
            .then(echo("echo"))
            .commit(Schemas.string("out"));

        // when
        WorkflowResult<String> result = engine.execute(workflow, "", RunOptions.defaults());

        // then
        Failed<String> failed = (Failed<String>) result;
        assertThat(failed.failure().kind()).isEqualTo(ErrorKind.CONTRACT_VIOLATION);
        assertThat(failed.failure().stepId()).isEqualTo("validated");
        assertThat(failed.report().events()).isEmpty();
        assertThat(failed.report().rootSpan().status()).isEqualTo(SpanStatus.ERROR);
    }

    @Test
    void execute_Step_실패_이후_Step은_실행되지_않음() {
        // given
        Step<Integer, Integer> failing = Steps.define("failing")
            .input(Schemas.integer("value"))
            .output(Schemas.integer("value"))
            .handle((value, ctx) -> {
                throw new IllegalStateException("no capacity");
            });
        Workflow<Integer, Integer> workflow = Workflow.builder("halts", Schemas.integer("value"))
            .then(failing)
            .then(add("after", 1))
            .commit(Schemas.integer("value"));

        // when
        WorkflowResult<Integer> result = engine.execute(workflow, 0, RunOptions.defaults());

        // then
        Failed<Integer> failed = (Failed<Integer>) result;
        assertThat(failed.failure().stepId()).isEqualTo("failing");
        assertThat(failed.failure().kind()).isEqualTo(ErrorKind.TRANSIENT_EXECUTION_FAILURE);
        assertThat(failed.failure().isRetryable()).isTrue();
        assertThat(failed.report().eventsFor("after")).isEmpty();
        assertThat(failed.report().eventsOf(ProgressKind.ERROR)).hasSize(1);
    }

    @Test
    void execute_실행_중_취소되면_다음_Step에서_CANCELLED() {
        // given
        CancellationToken token = new CancellationToken();
        Step<Integer, Integer> cancelling = Steps.define("cancelling")
            .input(Schemas.integer("value"))
            .output(Schemas.integer("value"))
            .handle((value, ctx) -> {
                token.cancel("user navigated away");
                return value;
            });
        Workflow<Integer, Integer> workflow = Workflow.builder("cancellable", Schemas.integer("value"))
            .then(cancelling)
            .then(add("next", 1))
            .commit(Schemas.integer("value"));

        // when
        WorkflowResult<Integer> result = engine.execute(workflow, 0, RunOptions.defaults().withCancellation(token));

        // then
        Failed<Integer> failed = (Failed<Integer>) result;
        assertThat(failed.failure().kind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(failed.failure().stepId()).isEqualTo("next");
        assertThat(failed.report().eventsFor("next")).extracting(ProgressEvent::kind)
            .containsExactly(ProgressKind.START, ProgressKind.CANCELLED);
        assertThat(failed.report().rootSpan().status()).isEqualTo(SpanStatus.CANCELLED);
    }

    @Test
    void execute_소비자_예외는_실행에_영향을_주지_않음() {
        // given
        List<ProgressEvent> received = new ArrayList<>();
        ProgressSink flaky = event -> {
            received.add(event);
            throw new IllegalStateException("listener down");
        };
        Workflow<Integer, Integer> workflow = Workflow.builder("resilient", Schemas.integer("value"))
            .then(add("add-one", 1))
            .commit(Schemas.integer("value"));

        // when
        WorkflowResult<Integer> result = engine.execute(workflow, 1, RunOptions.defaults().withListener(flaky));

        // then
        assertThat(result).isInstanceOf(Succeeded.class);
        assertThat(received).hasSize(2);
        assertThat(received.get(0).timestamp()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
    }

    @Test
    void execute_모든_Span은_종료_상태() {
        // given
        Workflow<Integer, Integer> workflow = Workflow.builder("spans", Schemas.integer("value"))
            .then(add("first", 1))
            .repeatUntil(add("loop-body", 1), value -> value < 4, 5)
            .commit(Schemas.integer("value"));

        // when
        WorkflowResult<Integer> result = engine.execute(workflow, 0, RunOptions.defaults());

        // then
        assertThat(result.report().rootSpan().flatten()).allSatisfy(span -> assertThat(span.isEnded()).isTrue());
    }

    @Test
    void execute_Step이_Error를_던지면_Failed로_반환하고_Span을_모두_닫음() {
        // given
        Step<Integer, Integer> boom = Steps.define("boom")
            .input(Schemas.integer("value"))
            .output(Schemas.integer("value"))
            .handle((value, ctx) -> {
                throw new StackOverflowError("recursion too deep");
            });
        Workflow<Integer, Integer> workflow = Workflow.builder("overflow", Schemas.integer("value"))
            .then(add("first", 1))
            .repeatUntil(boom, value -> true, 3)
            .commit(Schemas.integer("value"));

        // when
        WorkflowResult<Integer> result = engine.execute(workflow, 0, RunOptions.defaults());

        // then
        assertThat(result).isInstanceOf(Failed.class);
        Failed<Integer> failed = (Failed<Integer>) result;
        assertThat(failed.failure().stepId()).isEqualTo("boom");
        assertThat(failed.failure().kind()).isEqualTo(ErrorKind.TRANSIENT_EXECUTION_FAILURE);
        assertThat(failed.failure().cause()).isInstanceOf(StackOverflowError.class);
        assertThat(result.report().eventsFor("boom")).extracting(ProgressEvent::kind)
            .containsExactly(ProgressKind.START, ProgressKind.ERROR);

        Span root = result.report().rootSpan();
        assertThat(root.status()).isEqualTo(SpanStatus.ERROR);
        assertThat(root.flatten()).allSatisfy(span -> assertThat(span.isEnded()).isTrue());
        assertThat(root.flatten()).filteredOn(span -> span.name().startsWith("loop:"))
            .singleElement()
            .satisfies(loop -> assertThat(loop.status()).isEqualTo(SpanStatus.ERROR));
    }

    @Test
    void execute_Tracer를_주입하면_모든_Span을_Micrometer로_내보냄() {
        // given
        SimpleTracer tracer = new SimpleTracer();
        WorkflowEngine tracedEngine = new WorkflowEngine(
            EngineConfig.noDelay(), CapabilityRegistry.EMPTY, millis -> { }, FIXED_CLOCK, tracer);
        Workflow<Integer, Integer> workflow = Workflow.builder("traced", Schemas.integer("value"))
            .then(add("first", 1))
            .branch(Branch.<Integer, Integer>named("route")
                .when("small", value -> value < 10, add("small", 1))
                .otherwise(add("large", 100)))
            .commit(Schemas.integer("value"));

        // when
        WorkflowResult<Integer> result = tracedEngine.execute(workflow, 1, RunOptions.defaults().withRunId("run-t"));

        // then
        assertThat(result.valueOrThrow()).isEqualTo(3);
        assertThat(tracer.getSpans()).extracting(SimpleSpan::getName)
            .containsExactlyInAnyOrder("workflow:traced", "first", "branch:route", "small");
        SimpleSpan exportedRoot = tracer.getSpans().stream()
            .filter(span -> span.getName().equals("workflow:traced"))
            .findFirst().orElseThrow();
        assertThat(exportedRoot.getTags())
            .containsEntry("run.id", "run-t")
            .containsEntry("pipeline.status", "OK");
    }
}
