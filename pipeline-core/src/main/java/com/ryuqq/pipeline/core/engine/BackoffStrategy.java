package com.ryuqq.pipeline.core.engine;

/**
 * 재시도 간격 전략.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum BackoffStrategy {

    /**
     * 매 재시도마다 baseDelay만큼 대기.
     */
    FIXED,

    /**
     * baseDelay * 2^(attempt-1) + jitter, maxDelay로 제한.
     */
    EXPONENTIAL
}
