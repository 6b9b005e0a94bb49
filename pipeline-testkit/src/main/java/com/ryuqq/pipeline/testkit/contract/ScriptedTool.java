package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.core.capability.Tool;
import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.schema.Schema;
import com.ryuqq.pipeline.core.step.StepFunction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tool double backed by a function, recording every validated input it receives.
 *
 * <p>The function has the same shape as a step body, so it may throw to simulate
 * collaborator failures or observe the calling step's context.</p>
 *
 * @param <I> input type
 * @param <O> output type
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class ScriptedTool<I, O> implements Tool<I, O> {

    private final String id;
    private final Schema<I> inputSchema;
    private final Schema<O> outputSchema;
    private final StepFunction<I, O> behavior;
    private final List<I> inputs = Collections.synchronizedList(new ArrayList<>());

    /**
     * Constructor.
     *
     * @param id the tool id
     * @param inputSchema input contract
     * @param outputSchema output contract
     * @param behavior function producing the output
     * @throws IllegalArgumentException if any argument is null or the id is blank
     */
    public ScriptedTool(String id, Schema<I> inputSchema, Schema<O> outputSchema, StepFunction<I, O> behavior) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (inputSchema == null) {
            throw new IllegalArgumentException("inputSchema cannot be null");
        }
        if (outputSchema == null) {
            throw new IllegalArgumentException("outputSchema cannot be null");
        }
        if (behavior == null) {
            throw new IllegalArgumentException("behavior cannot be null");
        }
        this.id = id;
        this.inputSchema = inputSchema;
        this.outputSchema = outputSchema;
        this.behavior = behavior;
    }

    @Override
    public String id() {
        return id;
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
    public O execute(I input, ExecutionContext context) throws Exception {
        inputs.add(input);
        return behavior.apply(input, context);
    }

    public List<I> inputs() {
        synchronized (inputs) {
            return List.copyOf(inputs);
        }
    }

    public int callCount() {
        return inputs.size();
    }
}
