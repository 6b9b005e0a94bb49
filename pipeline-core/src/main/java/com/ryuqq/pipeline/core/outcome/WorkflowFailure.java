package com.ryuqq.pipeline.core.outcome;

import com.ryuqq.pipeline.core.error.ErrorKind;
import com.ryuqq.pipeline.core.error.WorkflowException;

/**
 * 실패 정보.
 *
 * @param stepId 실패한 Step ID (Workflow 입출력 경계 실패면 Workflow ID, 원인 불명이면 null)
 * @param kind 오류 분류
 * @param message 오류 메시지
 * @param cause 원인 예외
 * @author Pipeline Team
 * @since 1.0.0
 */
public record WorkflowFailure(
    String stepId,
    ErrorKind kind,
    String message,
    Throwable cause
) {

    public WorkflowFailure {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // stepId, cause는 null 허용
    }

    /**
     * 예외로부터 실패 정보 생성.
     *
     * @param exception Workflow 예외
     * @return WorkflowFailure
     */
    public static WorkflowFailure of(WorkflowException exception) {
        if (exception == null) {
            throw new IllegalArgumentException("exception cannot be null");
        }
        String message = exception.getMessage() == null ? exception.kind().name() : exception.getMessage();
        return new WorkflowFailure(exception.stepId(), exception.kind(), message, exception);
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
