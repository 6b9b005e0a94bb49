package com.ryuqq.pipeline.core.composition;

import com.ryuqq.pipeline.core.step.Step;

import java.util.List;
import java.util.function.Predicate;

/**
 * 구성 단계 팩토리.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class Stages {

    // Utility class - prevent instantiation
    private Stages() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static StepStage step(Step<?, ?> step) {
        return new StepStage(step);
    }

    public static SequenceStage sequence(String name, List<Stage> stages) {
        return new SequenceStage(name, stages);
    }

    public static SequenceStage sequence(String name, Stage... stages) {
        return new SequenceStage(name, List.of(stages));
    }

    public static BranchStage branch(Branch<?, ?> branch) {
        if (branch == null) {
            throw new IllegalArgumentException("branch cannot be null");
        }
        return branch.toStage();
    }

    /**
     * 수렴 루프 생성 ({@link ExhaustionPolicy#FLAG}).
     *
     * @param body 반복 본문
     * @param continueWhile 계속 조건
     * @param maxIterations 최대 반복 횟수
     * @param <T> 본문 입출력 타입
     * @return LoopStage
     */
    public static <T> LoopStage repeatUntil(Step<T, T> body, Predicate<? super T> continueWhile, int maxIterations) {
        return repeatUntil(body, continueWhile, maxIterations, ExhaustionPolicy.FLAG);
    }

    /**
     * 수렴 루프 생성.
     *
     * @param body 반복 본문
     * @param continueWhile 계속 조건
     * @param maxIterations 최대 반복 횟수
     * @param policy 최대 반복 도달 시 처리 방식
     * @param <T> 본문 입출력 타입
     * @return LoopStage
     */
    public static <T> LoopStage repeatUntil(Step<T, T> body, Predicate<? super T> continueWhile,
                                            int maxIterations, ExhaustionPolicy policy) {
        return new LoopStage(body, Branch.<T>erase(continueWhile), maxIterations, policy);
    }
}
