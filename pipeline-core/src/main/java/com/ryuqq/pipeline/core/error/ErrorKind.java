package com.ryuqq.pipeline.core.error;

/**
 * Workflow 실행 오류 분류.
 *
 * <ul>
 *   <li>CONTRACT_VIOLATION: 입력/출력 Schema 검증 실패 (재시도 불가, 실행 전체 실패)</li>
 *   <li>TRANSIENT_EXECUTION_FAILURE: Step 실행 중 예외 (재시도 후 에스컬레이션)</li>
 *   <li>COLLABORATOR_UNAVAILABLE: Generator/Tool 미설정 또는 접근 불가</li>
 *   <li>LOOP_EXCEEDED: repeatUntil 루프가 maxIterations에 도달</li>
 *   <li>CANCELLED: 협조적 취소 감지</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum ErrorKind {

    CONTRACT_VIOLATION,

    TRANSIENT_EXECUTION_FAILURE,

    COLLABORATOR_UNAVAILABLE,

    LOOP_EXCEEDED,

    CANCELLED;

    /**
     * Step 실행기에서 재시도 가능한 오류인지 확인.
     *
     * @return TRANSIENT_EXECUTION_FAILURE인 경우 true
     */
    public boolean isRetryable() {
        return this == TRANSIENT_EXECUTION_FAILURE;
    }
}
