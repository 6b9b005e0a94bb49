package com.ryuqq.pipeline.core.composition;

import com.ryuqq.pipeline.core.step.Step;

/**
 * Step 하나를 실행하는 단계.
 *
 * @param step 실행할 Step
 * @author Pipeline Team
 * @since 1.0.0
 */
public record StepStage(Step<?, ?> step) implements Stage {

    public StepStage {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
    }

    @Override
    public String name() {
        return step.id();
    }
}
