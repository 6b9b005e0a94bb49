package com.ryuqq.pipeline.core.context;

import com.ryuqq.pipeline.core.capability.Generation;
import com.ryuqq.pipeline.core.capability.GenerationStream;
import com.ryuqq.pipeline.core.capability.Generator;
import com.ryuqq.pipeline.core.capability.Tool;
import com.ryuqq.pipeline.core.error.CancelledException;
import com.ryuqq.pipeline.core.error.CollaboratorUnavailableException;
import com.ryuqq.pipeline.core.error.ContractViolationException;
import com.ryuqq.pipeline.core.progress.StepKey;
import com.ryuqq.pipeline.core.schema.Invalid;
import com.ryuqq.pipeline.core.schema.Schema;
import com.ryuqq.pipeline.core.schema.Valid;
import com.ryuqq.pipeline.core.schema.Validation;
import com.ryuqq.pipeline.core.spi.CapabilityRegistry;
import com.ryuqq.pipeline.core.tracing.Span;
import com.ryuqq.pipeline.core.tracing.SpanStatus;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Step 호출 한 건의 실행 컨텍스트.
 *
 * <p>Step 실행기가 시도마다 생성하여 {@code Step.execute(...)}에 전달합니다.
 * 실행 단위 상태({@link RunContext})와 현재 Step의 Span, 진행 이벤트 키를 묶습니다.</p>
 *
 * <p><strong>협력자 호출 규칙:</strong></p>
 * <ul>
 *   <li>{@link #generate}, {@link #stream}, {@link #invokeTool}은 자식 Span을 열고 반드시 닫음</li>
 *   <li>호출 전후로 취소 여부를 확인</li>
 *   <li>Tool 입출력과 구조화 생성 결과는 Schema로 검증 (위반 시 {@link ContractViolationException})</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class ExecutionContext {

    private final RunContext run;
    private final StepKey stepKey;
    private final Span span;

    /**
     * 생성자.
     *
     * @param run 실행 단위 상태
     * @param stepKey 현재 Step 실행 키
     * @param span 현재 Step의 Span
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ExecutionContext(RunContext run, StepKey stepKey, Span span) {
        if (run == null) {
            throw new IllegalArgumentException("run cannot be null");
        }
        if (stepKey == null) {
            throw new IllegalArgumentException("stepKey cannot be null");
        }
        if (span == null) {
            throw new IllegalArgumentException("span cannot be null");
        }
        this.run = run;
        this.stepKey = stepKey;
        this.span = span;
    }

    public String runId() {
        return run.runId();
    }

    public String workflowId() {
        return run.workflowId();
    }

    public String stepId() {
        return stepKey.stepId();
    }

    public int occurrence() {
        return stepKey.occurrence();
    }

    public StepKey stepKey() {
        return stepKey;
    }

    public RequestScope scope() {
        return run.scope();
    }

    public CapabilityRegistry capabilities() {
        return run.capabilities();
    }

    /**
     * 현재 Step의 Span (자식 Span을 열 때 사용).
     *
     * @return Span
     */
    public Span span() {
        return span;
    }

    public Optional<Generator> generator(String generatorId) {
        return run.capabilities().generator(generatorId);
    }

    public Optional<Tool<?, ?>> tool(String toolId) {
        return run.capabilities().tool(toolId);
    }

    // ========================================
    // Progress
    // ========================================

    /**
     * 진행 상황 보고.
     *
     * @param percent 진행률 (0 ~ 100)
     * @param message 메시지
     */
    public void progress(int percent, String message) {
        progress(percent, message, Map.of());
    }

    /**
     * 추가 속성과 함께 진행 상황 보고.
     *
     * @param percent 진행률 (0 ~ 100)
     * @param message 메시지
     * @param attributes 추가 속성
     * @throws IllegalArgumentException percent가 범위를 벗어난 경우
     */
    public void progress(int percent, String message, Map<String, Object> attributes) {
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("percent must be between 0 and 100 (current: " + percent + ")");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("percent", percent);
        payload.put("message", message);
        if (attributes != null) {
            payload.putAll(attributes);
        }
        run.progressLog().progress(stepKey, payload);
    }

    // ========================================
    // Cancellation
    // ========================================

    public boolean isCancelled() {
        return run.isCancelled();
    }

    /**
     * 취소 요청이 있으면 예외 발생.
     *
     * @throws CancelledException 취소가 요청된 경우
     */
    public void throwIfCancelled() {
        if (run.isCancelled()) {
            CancelledException cancelled = new CancelledException(
                "run '" + run.runId() + "' cancelled during step '" + stepKey.stepId() + "'"
            );
            cancelled.bindStep(stepKey.stepId());
            throw cancelled;
        }
    }

    // ========================================
    // Collaborators
    // ========================================

    /**
     * 텍스트 생성.
     *
     * @param generator Generator
     * @param prompt 프롬프트
     * @return 생성 결과
     */
    public Generation<String> generate(Generator generator, String prompt) {
        requireGenerator(generator);
        throwIfCancelled();
        Span child = span.startChild("generator:" + generator.id());
        child.setAttribute("generator.id", generator.id());
        child.setAttribute("prompt.length", prompt == null ? 0 : prompt.length());
        Generation<String> generation;
        try {
            generation = generator.generate(prompt);
        } catch (CancelledException e) {
            child.recordException(e);
            child.end(SpanStatus.CANCELLED);
            throw e;
        } catch (RuntimeException e) {
            child.endWithError(e);
            throw e;
        }
        child.setAttribute("output.length", generation.text().length());
        child.end(SpanStatus.OK);
        throwIfCancelled();
        return generation;
    }

    /**
     * 구조화 결과 생성.
     *
     * @param generator Generator
     * @param prompt 프롬프트
     * @param schema 결과 Schema
     * @param <T> 결과 타입
     * @return 검증된 결과
     * @throws ContractViolationException 결과가 Schema를 위반한 경우
     */
    public <T> Generation<T> generate(Generator generator, String prompt, Schema<T> schema) {
        requireGenerator(generator);
        if (schema == null) {
            throw new IllegalArgumentException("schema cannot be null");
        }
        throwIfCancelled();
        Span child = span.startChild("generator:" + generator.id());
        child.setAttribute("generator.id", generator.id());
        child.setAttribute("schema", schema.name());
        Generation<T> generation;
        try {
            Generation<T> raw = generator.generate(prompt, schema);
            T object = validated(schema, raw.object(), "generator '" + generator.id() + "' output");
            generation = new Generation<>(raw.text(), object);
        } catch (CancelledException e) {
            child.recordException(e);
            child.end(SpanStatus.CANCELLED);
            throw e;
        } catch (RuntimeException e) {
            child.endWithError(e);
            throw e;
        }
        child.end(SpanStatus.OK);
        throwIfCancelled();
        return generation;
    }

    /**
     * 스트리밍 생성.
     *
     * <p>각 텍스트 조각은 PROGRESS 이벤트({@code streaming, chunkIndex, chunk})로 전달되며,
     * 조각마다 취소 여부를 확인합니다.</p>
     *
     * @param generator Generator
     * @param prompt 프롬프트
     * @return 이어 붙인 전체 텍스트
     */
    public String stream(Generator generator, String prompt) {
        requireGenerator(generator);
        throwIfCancelled();
        Span child = span.startChild("generator:" + generator.id());
        child.setAttribute("generator.id", generator.id());
        child.setAttribute("streaming", true);
        StringBuilder text = new StringBuilder();
        int[] chunkCount = {0};
        try {
            GenerationStream stream = generator.stream(prompt);
            stream.forEach(chunk -> {
                throwIfCancelled();
                text.append(chunk);
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("streaming", true);
                payload.put("chunkIndex", chunkCount[0]++);
                payload.put("chunk", chunk);
                run.progressLog().progress(stepKey, payload);
            });
        } catch (CancelledException e) {
            child.recordException(e);
            child.end(SpanStatus.CANCELLED);
            throw e;
        } catch (RuntimeException e) {
            child.endWithError(e);
            throw e;
        }
        child.setAttribute("stream.chunks", chunkCount[0]);
        child.end(SpanStatus.OK);
        throwIfCancelled();
        return text.toString();
    }

    /**
     * 등록된 Tool 호출.
     *
     * @param toolId Tool ID
     * @param input 입력 (Tool 입력 Schema로 검증됨)
     * @param outputType 기대 출력 타입
     * @param <O> 출력 타입
     * @return 검증된 출력
     * @throws CollaboratorUnavailableException Tool이 등록되지 않은 경우
     * @throws Exception Tool 실행 실패 시
     */
    public <O> O invokeTool(String toolId, Object input, Class<O> outputType) throws Exception {
        if (outputType == null) {
            throw new IllegalArgumentException("outputType cannot be null");
        }
        Tool<?, ?> tool = tool(toolId).orElseThrow(() ->
            new CollaboratorUnavailableException(toolId, "tool '" + toolId + "' is not registered")
        );
        Object output = invokeTool(tool, input);
        if (output != null && !outputType.isInstance(output)) {
            throw ContractViolationException.configuration(stepKey.stepId(),
                "tool '" + toolId + "' returned " + output.getClass().getSimpleName()
                    + " but " + outputType.getSimpleName() + " was expected");
        }
        return outputType.cast(output);
    }

    /**
     * Tool 호출.
     *
     * @param tool Tool
     * @param input 입력 (Tool 입력 Schema로 검증됨)
     * @param <I> 입력 타입
     * @param <O> 출력 타입
     * @return 검증된 출력
     * @throws ContractViolationException 입력 또는 출력이 Schema를 위반한 경우
     * @throws Exception Tool 실행 실패 시
     */
    public <I, O> O invokeTool(Tool<I, O> tool, Object input) throws Exception {
        if (tool == null) {
            throw new IllegalArgumentException("tool cannot be null");
        }
        I validInput = validated(tool.inputSchema(), input, "tool '" + tool.id() + "' input");
        throwIfCancelled();
        Span child = span.startChild("tool:" + tool.id());
        child.setAttribute("tool.id", tool.id());
        O output;
        try {
            O raw = tool.execute(validInput, this);
            output = validated(tool.outputSchema(), raw, "tool '" + tool.id() + "' output");
        } catch (CancelledException e) {
            child.recordException(e);
            child.end(SpanStatus.CANCELLED);
            throw e;
        } catch (Exception e) {
            child.endOpenDescendants(SpanStatus.ERROR);
            child.endWithError(e);
            throw e;
        }
        child.endOpenDescendants(SpanStatus.ERROR);
        child.end(SpanStatus.OK);
        throwIfCancelled();
        return output;
    }

    private <T> T validated(Schema<T> schema, Object value, String boundary) {
        Validation<T> validation = schema.validate(value);
        if (validation instanceof Invalid<T> invalid) {
            throw new ContractViolationException(stepKey.stepId(), boundary, schema.name(), invalid.violations());
        }
        return ((Valid<T>) validation).value();
    }

    private static void requireGenerator(Generator generator) {
        if (generator == null) {
            throw new IllegalArgumentException("generator cannot be null");
        }
    }

    @Override
    public String toString() {
        return "ExecutionContext{runId='" + run.runId() + "', step=" + stepKey + "}";
    }
}
