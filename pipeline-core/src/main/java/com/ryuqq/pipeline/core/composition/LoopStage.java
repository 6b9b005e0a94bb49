package com.ryuqq.pipeline.core.composition;

import com.ryuqq.pipeline.core.step.Step;

import java.util.function.Predicate;

/**
 * do-while 수렴 루프 단계.
 *
 * <p>본문은 최소 1회 실행되며, 각 출력은 다음 반복의 입력이 됩니다.
 * {@code continueWhile(output)}이 false가 되거나 본문이 maxIterations회 실행되면 종료합니다.</p>
 *
 * @param body 반복 본문 (입력 타입과 출력 타입이 같아야 함)
 * @param continueWhile 계속 조건
 * @param maxIterations 최대 반복 횟수 (1 이상)
 * @param policy 최대 반복 도달 시 처리 방식
 * @author Pipeline Team
 * @since 1.0.0
 */
public record LoopStage(
    Step<?, ?> body,
    Predicate<Object> continueWhile,
    int maxIterations,
    ExhaustionPolicy policy
) implements Stage {

    public LoopStage {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        if (continueWhile == null) {
            throw new IllegalArgumentException("continueWhile cannot be null");
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive (current: " + maxIterations + ")");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
    }

    @Override
    public String name() {
        return body.id();
    }
}
