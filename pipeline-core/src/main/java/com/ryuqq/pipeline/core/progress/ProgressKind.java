package com.ryuqq.pipeline.core.progress;

/**
 * 진행 이벤트 종류.
 *
 * <p><strong>Step 실행 단위별 이벤트 순서:</strong></p>
 * <pre>
 * START
 *   │
 *   ▼
 * PROGRESS (0회 이상)
 *   │
 *   ├─► COMPLETE  (성공)
 *   ├─► ERROR     (실패)
 *   └─► CANCELLED (취소)
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum ProgressKind {

    /**
     * Step 시작.
     */
    START,

    /**
     * 중간 진행 상황.
     */
    PROGRESS,

    /**
     * Step 성공 (종료).
     */
    COMPLETE,

    /**
     * Step 실패 (종료).
     */
    ERROR,

    /**
     * Step 취소 (종료).
     */
    CANCELLED;

    /**
     * 종료 이벤트인지 확인.
     *
     * @return COMPLETE, ERROR, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR || this == CANCELLED;
    }
}
