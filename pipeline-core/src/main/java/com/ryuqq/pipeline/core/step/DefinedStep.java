package com.ryuqq.pipeline.core.step;

import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.schema.Schema;

/**
 * {@link Steps#define(String)}로 만든 Step.
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
final class DefinedStep<I, O> implements Step<I, O> {

    private final String id;
    private final String description;
    private final Schema<I> inputSchema;
    private final Schema<O> outputSchema;
    private final int retries;
    private final StepFunction<I, O> body;

    DefinedStep(String id, String description, Schema<I> inputSchema, Schema<O> outputSchema,
                int retries, StepFunction<I, O> body) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (inputSchema == null) {
            throw new IllegalArgumentException("inputSchema cannot be null");
        }
        if (outputSchema == null) {
            throw new IllegalArgumentException("outputSchema cannot be null");
        }
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be non-negative (current: " + retries + ")");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        this.id = id;
        this.description = description == null || description.isBlank() ? id : description;
        this.inputSchema = inputSchema;
        this.outputSchema = outputSchema;
        this.retries = retries;
        this.body = body;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public Schema<I> inputSchema() {
        return inputSchema;
    }

    @Override
    public Schema<O> outputSchema() {
        return outputSchema;
    }

    @Override
    public int retries() {
        return retries;
    }

    @Override
    public O execute(I input, ExecutionContext context) throws Exception {
        return body.apply(input, context);
    }

    @Override
    public String toString() {
        return "Step{id='" + id + "', retries=" + retries + "}";
    }
}
