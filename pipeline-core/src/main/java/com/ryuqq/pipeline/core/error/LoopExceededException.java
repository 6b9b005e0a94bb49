package com.ryuqq.pipeline.core.error;

/**
 * repeatUntil 루프가 수렴하지 못하고 maxIterations에 도달.
 *
 * <p>{@code ExhaustionPolicy.FAIL}로 구성된 루프에서만 발생합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class LoopExceededException extends WorkflowException {

    private final int iterations;

    public LoopExceededException(String loopName, int iterations) {
        super(ErrorKind.LOOP_EXCEEDED, loopName,
            "loop '" + loopName + "' reached maxIterations (" + iterations + ") without converging", null);
        this.iterations = iterations;
    }

    public int iterations() {
        return iterations;
    }
}
