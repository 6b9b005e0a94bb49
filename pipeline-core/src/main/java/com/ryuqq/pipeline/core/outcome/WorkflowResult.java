package com.ryuqq.pipeline.core.outcome;

/**
 * Workflow 실행 결과.
 *
 * <p>두 가지 결과 중 하나입니다:</p>
 * <ul>
 *   <li>{@link Succeeded}: 최종 출력이 출력 Schema를 통과함</li>
 *   <li>{@link Failed}: 어떤 Step 또는 경계에서 실패함</li>
 * </ul>
 *
 * <p>엔진은 Step 실패를 호출자에게 던지지 않고 {@link Failed}로 반환합니다.
 * 두 경우 모두 {@link RunReport}를 포함합니다.</p>
 *
 * @param <O> 출력 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
public sealed interface WorkflowResult<O> permits Succeeded, Failed {

    /**
     * 실행 관측 기록.
     *
     * @return RunReport
     */
    RunReport report();

    /**
     * 성공 여부.
     *
     * @return 성공이면 true
     */
    default boolean isSucceeded() {
        return this instanceof Succeeded;
    }

    /**
     * 실패 여부.
     *
     * @return 실패면 true
     */
    default boolean isFailed() {
        return this instanceof Failed;
    }

    /**
     * 출력 값 조회.
     *
     * @return 출력 값
     * @throws IllegalStateException 실패한 결과인 경우
     */
    default O valueOrThrow() {
        if (this instanceof Succeeded<O> succeeded) {
            return succeeded.value();
        }
        Failed<O> failed = (Failed<O>) this;
        throw new IllegalStateException("workflow failed: " + failed.failure().message(), failed.failure().cause());
    }
}
