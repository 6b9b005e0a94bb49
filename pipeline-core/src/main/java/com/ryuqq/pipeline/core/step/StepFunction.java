package com.ryuqq.pipeline.core.step;

import com.ryuqq.pipeline.core.context.ExecutionContext;

/**
 * 람다로 작성하는 Step 본문.
 *
 * @param <I> 입력 타입
 * @param <O> 출력 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StepFunction<I, O> {

    O apply(I input, ExecutionContext context) throws Exception;
}
