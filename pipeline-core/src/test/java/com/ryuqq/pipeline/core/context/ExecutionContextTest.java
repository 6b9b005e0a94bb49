package com.ryuqq.pipeline.core.context;

import com.ryuqq.pipeline.core.capability.Generation;
import com.ryuqq.pipeline.core.capability.GenerationStream;
import com.ryuqq.pipeline.core.capability.Generator;
import com.ryuqq.pipeline.core.capability.Tool;
import com.ryuqq.pipeline.core.error.CancelledException;
import com.ryuqq.pipeline.core.error.CollaboratorUnavailableException;
import com.ryuqq.pipeline.core.error.ContractViolationException;
import com.ryuqq.pipeline.core.progress.ProgressEvent;
import com.ryuqq.pipeline.core.progress.ProgressKind;
import com.ryuqq.pipeline.core.progress.ProgressLog;
import com.ryuqq.pipeline.core.progress.StepKey;
import com.ryuqq.pipeline.core.schema.Schema;
import com.ryuqq.pipeline.core.schema.Schemas;
import com.ryuqq.pipeline.core.spi.CapabilityRegistry;
import com.ryuqq.pipeline.core.spi.ProgressSink;
import com.ryuqq.pipeline.core.tracing.Span;
import com.ryuqq.pipeline.core.tracing.SpanStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ExecutionContext 유닛 테스트.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class ExecutionContextTest {

    private final Map<String, Generator> generators = new HashMap<>();
    private final Map<String, Tool<?, ?>> tools = new HashMap<>();

    private ProgressLog progressLog;
    private CancellationToken token;
    private Span stepSpan;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        CapabilityRegistry registry = new CapabilityRegistry() {
            @Override
            public Optional<Generator> generator(String id) {
                return Optional.ofNullable(generators.get(id));
            }

            @Override
            public Optional<Tool<?, ?>> tool(String id) {
                return Optional.ofNullable(tools.get(id));
            }
        };
        progressLog = new ProgressLog(ProgressSink.NONE);
        token = new CancellationToken();
        RunContext run = new RunContext("run-1", "wf", progressLog,
            RequestScope.of("tenant-a", UserTier.PRO), registry, token);
        StepKey key = progressLog.open("step");
        progressLog.start(key, Map.of());
        stepSpan = Span.root("workflow:wf").startChild("step");
        context = new ExecutionContext(run, key, stepSpan);
    }

    // ========== 기본 정보 ==========

    @Test
    void accessors_실행_정보를_노출() {
        assertThat(context.runId()).isEqualTo("run-1");
        assertThat(context.workflowId()).isEqualTo("wf");
        assertThat(context.stepId()).isEqualTo("step");
        assertThat(context.occurrence()).isEqualTo(1);
        assertThat(context.scope().tenantId()).isEqualTo("tenant-a");
        assertThat(context.scope().tier()).isEqualTo(UserTier.PRO);
    }

    @Test
    void progress_percent와_message를_PROGRESS_이벤트로_기록() {
        // when
        context.progress(40, "loading", Map.of("bytes", 1024));

        // then
        ProgressEvent event = progressLog.events().get(1);
        assertThat(event.kind()).isEqualTo(ProgressKind.PROGRESS);
        assertThat(event.payload()).containsEntry("percent", 40)
            .containsEntry("message", "loading")
            .containsEntry("bytes", 1024);
    }

    @Test
    void progress_범위를_벗어난_percent는_예외() {
        assertThatThrownBy(() -> context.progress(101, "too much"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("101");
    }

    // ========== Generator ==========

    @Test
    void generate_자식_Span을_열고_닫음() {
        // given
        Generator generator = new FixedGenerator("writer", List.of("hello ", "world"));

        // when
        Generation<String> generation = context.generate(generator, "say hi");

        // then
        assertThat(generation.text()).isEqualTo("hello world");
        Span child = stepSpan.find("generator:writer").orElseThrow();
        assertThat(child.status()).isEqualTo(SpanStatus.OK);
        assertThat(child.attribute("prompt.length")).isEqualTo(6);
        assertThat(child.attribute("output.length")).isEqualTo(11);
    }

    @Test
    void generate_구조화_출력이_Schema를_위반하면_CONTRACT_VIOLATION() {
        // given
        Generator generator = new FixedGenerator("scorer", List.of("150"));

        // when & then
        assertThatThrownBy(() -> context.generate(generator, "score it", Schemas.integer("score").range(0, 100)))
            .isInstanceOf(ContractViolationException.class)
            .hasMessageContaining("generator 'scorer' output");
        assertThat(stepSpan.find("generator:scorer").orElseThrow().status()).isEqualTo(SpanStatus.ERROR);
    }

    @Test
    void generate_Generator가_취소로_중단하면_CANCELLED_Span() {
        // given
        Generator generator = new FixedGenerator("writer", List.of("unused")) {
            @Override
            public Generation<String> generate(String prompt) {
                throw new CancelledException("writer stopped");
            }
        };

        // when & then
        assertThatThrownBy(() -> context.generate(generator, "say hi")).isInstanceOf(CancelledException.class);
        Span child = stepSpan.find("generator:writer").orElseThrow();
        assertThat(child.status()).isEqualTo(SpanStatus.CANCELLED);
        assertThat(child.exception()).containsInstanceOf(CancelledException.class);
    }

    @Test
    void generate_구조화_출력_중_취소되면_CANCELLED_Span() {
        // given
        Generator generator = new FixedGenerator("scorer", List.of("70")) {
            @Override
            public <T> Generation<T> generate(String prompt, Schema<T> schema) {
                throw new CancelledException("scorer stopped");
            }
        };

        // when & then
        assertThatThrownBy(() -> context.generate(generator, "score it", Schemas.integer("score")))
            .isInstanceOf(CancelledException.class);
        assertThat(stepSpan.find("generator:scorer").orElseThrow().status()).isEqualTo(SpanStatus.CANCELLED);
    }

    @Test
    void stream_청크마다_PROGRESS_이벤트를_기록() {
        // given
        Generator generator = new FixedGenerator("writer", List.of("a", "b", "c"));

        // when
        String text = context.stream(generator, "write");

        // then
        assertThat(text).isEqualTo("abc");
        List<ProgressEvent> chunks = progressLog.events().subList(1, progressLog.events().size());
        assertThat(chunks).hasSize(3);
        assertThat(chunks).extracting(event -> event.attribute("chunkIndex")).containsExactly(0, 1, 2);
        assertThat(chunks).extracting(event -> event.attribute("chunk")).containsExactly("a", "b", "c");
        assertThat(stepSpan.find("generator:writer").orElseThrow().attribute("stream.chunks")).isEqualTo(3);
    }

    @Test
    void stream_도중_취소되면_CANCELLED_Span과_CancelledException() {
        // given
        Generator generator = new FixedGenerator("writer", List.of("a", "b", "c")) {
            @Override
            public GenerationStream stream(String prompt) {
                return consumer -> {
                    consumer.accept("a");
                    token.cancel("stop");
                    consumer.accept("b");
                };
            }
        };

        // when & then
        assertThatThrownBy(() -> context.stream(generator, "write"))
            .isInstanceOfSatisfying(CancelledException.class, e -> assertThat(e.stepId()).isEqualTo("step"));
        assertThat(stepSpan.find("generator:writer").orElseThrow().status()).isEqualTo(SpanStatus.CANCELLED);
        assertThat(progressLog.events()).hasSize(2);
    }

    // ========== Tool ==========

    @Test
    void invokeTool_등록된_Tool의_입출력을_검증하고_실행() throws Exception {
        // given
        tools.put("word-count", new WordCountTool());

        // when
        Integer count = context.invokeTool("word-count", "one two three", Integer.class);

        // then
        assertThat(count).isEqualTo(3);
        Span child = stepSpan.find("tool:word-count").orElseThrow();
        assertThat(child.status()).isEqualTo(SpanStatus.OK);
    }

    @Test
    void invokeTool_입력_위반은_Tool_실행_전에_CONTRACT_VIOLATION() {
        // given
        tools.put("word-count", new WordCountTool());

        // when & then
        assertThatThrownBy(() -> context.invokeTool("word-count", "   ", Integer.class))
            .isInstanceOf(ContractViolationException.class)
            .hasMessageContaining("tool 'word-count' input");
        assertThat(stepSpan.find("tool:word-count")).isEmpty();
    }

    @Test
    void invokeTool_미등록_Tool은_COLLABORATOR_UNAVAILABLE() {
        assertThatThrownBy(() -> context.invokeTool("missing", "x", String.class))
            .isInstanceOfSatisfying(CollaboratorUnavailableException.class,
                e -> assertThat(e.collaboratorId()).isEqualTo("missing"));
    }

    @Test
    void invokeTool_출력_타입_불일치는_CONTRACT_VIOLATION() {
        // given
        tools.put("word-count", new WordCountTool());

        // when & then
        assertThatThrownBy(() -> context.invokeTool("word-count", "a b", String.class))
            .isInstanceOf(ContractViolationException.class)
            .hasMessageContaining("Integer");
    }

    @Test
    void throwIfCancelled_취소_요청시_예외() {
        // given
        token.cancel();

        // when & then
        assertThat(context.isCancelled()).isTrue();
        assertThatThrownBy(() -> context.throwIfCancelled()).isInstanceOf(CancelledException.class);
    }

    private static class FixedGenerator implements Generator {

        private final String id;
        private final List<String> chunks;

        FixedGenerator(String id, List<String> chunks) {
            this.id = id;
            this.chunks = chunks;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public Generation<String> generate(String prompt) {
            return Generation.text(String.join("", chunks));
        }

        @Override
        public <T> Generation<T> generate(String prompt, Schema<T> schema) {
            String text = String.join("", chunks);
            @SuppressWarnings("unchecked")
            T parsed = (T) Integer.valueOf(text);
            return new Generation<>(text, parsed);
        }

        @Override
        public GenerationStream stream(String prompt) {
            return GenerationStream.of(chunks);
        }
    }

    private static class WordCountTool implements Tool<String, Integer> {

        @Override
        public String id() {
            return "word-count";
        }

        @Override
        public Schema<String> inputSchema() {
            return Schemas.string("text").nonBlank();
        }

        @Override
        public Schema<Integer> outputSchema() {
            return Schemas.integer("count").min(0);
        }

        @Override
        public Integer execute(String input, ExecutionContext context) {
            return input.trim().split("\\s+").length;
        }
    }
}
