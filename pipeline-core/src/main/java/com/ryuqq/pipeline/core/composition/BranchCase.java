package com.ryuqq.pipeline.core.composition;

import com.ryuqq.pipeline.core.step.Step;

import java.util.function.Predicate;

/**
 * 분기 후보 하나.
 *
 * @param name 분기 이름 ({@code branch.selected} 속성 값)
 * @param predicate 선택 조건
 * @param step 선택 시 실행할 Step
 * @author Pipeline Team
 * @since 1.0.0
 */
public record BranchCase(String name, Predicate<Object> predicate, Step<?, ?> step) {

    public BranchCase {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
    }
}
