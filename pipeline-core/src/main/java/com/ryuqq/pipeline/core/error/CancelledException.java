package com.ryuqq.pipeline.core.error;

/**
 * 협조적 취소가 감지됨.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class CancelledException extends WorkflowException {

    public CancelledException(String message) {
        super(ErrorKind.CANCELLED, null, message, null);
    }
}
