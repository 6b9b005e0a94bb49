package com.ryuqq.pipeline.core.error;

/**
 * Generator 또는 Tool이 설정되지 않았거나 접근할 수 없음.
 *
 * <p>대부분의 Step은 기본값으로 대체(degrade)하지만, 대체할 수 없는 Step은 이 예외를 던집니다.
 * 협력자 부재는 재시도로 해결되지 않으므로 재시도하지 않습니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class CollaboratorUnavailableException extends WorkflowException {

    private final String collaboratorId;

    public CollaboratorUnavailableException(String collaboratorId, String message) {
        super(ErrorKind.COLLABORATOR_UNAVAILABLE, null, message, null);
        this.collaboratorId = collaboratorId;
    }

    public String collaboratorId() {
        return collaboratorId;
    }
}
