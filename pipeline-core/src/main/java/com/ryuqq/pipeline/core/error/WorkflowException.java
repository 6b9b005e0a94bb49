package com.ryuqq.pipeline.core.error;

/**
 * Workflow 실행 오류의 최상위 타입.
 *
 * <p>모든 하위 예외는 {@link ErrorKind}와 실패한 Step ID를 가집니다.
 * Step 코드가 던진 예외는 Step ID를 모르므로, Step 실행기가 {@link #bindStep(String)}으로
 * 한 번만 바인딩합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public abstract class WorkflowException extends RuntimeException {

    private final ErrorKind kind;
    private String stepId;

    protected WorkflowException(ErrorKind kind, String stepId, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
        this.stepId = stepId;
    }

    /**
     * 오류 분류 조회.
     *
     * @return ErrorKind
     */
    public ErrorKind kind() {
        return kind;
    }

    /**
     * 실패한 Step ID 조회.
     *
     * @return Step ID (아직 바인딩되지 않았으면 null)
     */
    public String stepId() {
        return stepId;
    }

    /**
     * 실패 Step ID 바인딩 (이미 바인딩된 경우 유지).
     *
     * @param stepId Step ID
     * @return this
     */
    public WorkflowException bindStep(String stepId) {
        if (this.stepId == null) {
            this.stepId = stepId;
        }
        return this;
    }
}
