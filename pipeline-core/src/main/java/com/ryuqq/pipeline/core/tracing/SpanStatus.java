package com.ryuqq.pipeline.core.tracing;

/**
 * Span 종료 상태.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum SpanStatus {

    /**
     * 아직 종료되지 않음.
     */
    UNSET,

    /**
     * 정상 종료.
     */
    OK,

    /**
     * 오류로 종료.
     */
    ERROR,

    /**
     * 취소로 종료.
     */
    CANCELLED
}
