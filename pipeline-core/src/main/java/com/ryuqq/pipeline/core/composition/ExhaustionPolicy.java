package com.ryuqq.pipeline.core.composition;

/**
 * repeatUntil 루프가 maxIterations에 도달했을 때의 처리 방식.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum ExhaustionPolicy {

    /**
     * 마지막 출력으로 계속 진행하되, 실행 보고서에 {@code exhausted=true}로 표시.
     */
    FLAG,

    /**
     * {@link com.ryuqq.pipeline.core.error.LoopExceededException}으로 실행 실패.
     */
    FAIL
}
