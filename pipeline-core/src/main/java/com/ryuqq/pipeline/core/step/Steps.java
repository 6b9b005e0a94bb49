package com.ryuqq.pipeline.core.step;

import com.ryuqq.pipeline.core.schema.Schema;

/**
 * 람다 본문 Step을 만드는 빌더 진입점.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Step&lt;String, Integer&gt; length = Steps.define("measure")
 *     .description("텍스트 길이 측정")
 *     .retries(2)
 *     .input(Schemas.string("text"))
 *     .output(Schemas.integer("length").min(0))
 *     .handle((text, ctx) -&gt; text.length());
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class Steps {

    // Utility class - prevent instantiation
    private Steps() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Step 정의 시작.
     *
     * @param id Step ID
     * @return Definition
     * @throws IllegalArgumentException id가 비어 있는 경우
     */
    public static Definition define(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        return new Definition(id);
    }

    /**
     * 입력 Schema가 정해지기 전 단계.
     */
    public static final class Definition {

        private final String id;
        private String description;
        private int retries;

        private Definition(String id) {
            this.id = id;
        }

        public Definition description(String description) {
            this.description = description;
            return this;
        }

        public Definition retries(int retries) {
            if (retries < 0) {
                throw new IllegalArgumentException("retries must be non-negative (current: " + retries + ")");
            }
            this.retries = retries;
            return this;
        }

        public <I> WithInput<I> input(Schema<I> inputSchema) {
            if (inputSchema == null) {
                throw new IllegalArgumentException("inputSchema cannot be null");
            }
            return new WithInput<>(this, inputSchema);
        }
    }

    /**
     * 입력 Schema가 정해진 단계.
     *
     * @param <I> 입력 타입
     */
    public static final class WithInput<I> {

        private final Definition definition;
        private final Schema<I> inputSchema;

        private WithInput(Definition definition, Schema<I> inputSchema) {
            this.definition = definition;
            this.inputSchema = inputSchema;
        }

        public <O> Builder<I, O> output(Schema<O> outputSchema) {
            if (outputSchema == null) {
                throw new IllegalArgumentException("outputSchema cannot be null");
            }
            return new Builder<>(definition, inputSchema, outputSchema);
        }
    }

    /**
     * 입출력 Schema가 정해진 단계.
     *
     * @param <I> 입력 타입
     * @param <O> 출력 타입
     */
    public static final class Builder<I, O> {

        private final Definition definition;
        private final Schema<I> inputSchema;
        private final Schema<O> outputSchema;

        private Builder(Definition definition, Schema<I> inputSchema, Schema<O> outputSchema) {
            this.definition = definition;
            this.inputSchema = inputSchema;
            this.outputSchema = outputSchema;
        }

        public Builder<I, O> description(String description) {
            definition.description(description);
            return this;
        }

        public Builder<I, O> retries(int retries) {
            definition.retries(retries);
            return this;
        }

        /**
         * 본문을 지정하여 Step 생성.
         *
         * @param body Step 본문
         * @return Step
         */
        public Step<I, O> handle(StepFunction<I, O> body) {
            return new DefinedStep<>(definition.id, definition.description, inputSchema, outputSchema,
                definition.retries, body);
        }
    }
}
