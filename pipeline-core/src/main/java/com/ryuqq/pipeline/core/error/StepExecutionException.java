package com.ryuqq.pipeline.core.error;

/**
 * 재시도를 모두 소진한 Step 실행 실패.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class StepExecutionException extends WorkflowException {

    private final int attempts;

    /**
     * 생성자.
     *
     * @param stepId 실패한 Step ID
     * @param attempts 총 시도 횟수 (1 이상)
     * @param cause 마지막 시도의 원인 예외
     */
    public StepExecutionException(String stepId, int attempts, Throwable cause) {
        super(ErrorKind.TRANSIENT_EXECUTION_FAILURE, stepId,
            "step '" + stepId + "' failed after " + attempts + " attempt(s): "
                + (cause == null ? "unknown error" : cause.getMessage()),
            cause);
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
