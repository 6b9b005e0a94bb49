package com.ryuqq.pipeline.core.engine;

import java.util.function.DoubleSupplier;

/**
 * Step 재시도 간격 계산기.
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * FIXED:       delay = baseDelay
 * EXPONENTIAL: delay = min(baseDelay * 2^(attempt-1) + jitter, maxDelay)
 *              jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (EXPONENTIAL, baseDelay=200ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempt=1: 200ms + jitter(0-20ms)</li>
 *   <li>attempt=2: 400ms + jitter(0-40ms)</li>
 *   <li>attempt=3: 800ms + jitter(0-80ms)</li>
 * </ul>
 *
 * <p>baseDelay 0은 허용되며, 이 경우 재시도 사이에 대기하지 않습니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class RetryBackoff {

    private final BackoffStrategy strategy;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 엔진 설정으로 생성.
     *
     * @param config 엔진 설정
     */
    public RetryBackoff(EngineConfig config) {
        this(config.backoffStrategy(), config.baseDelayMs(), config.maxDelayMs(), config.jitterFactor(), Math::random);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param strategy 간격 전략
     * @param baseDelayMs 기본 지연 시간 (밀리초, 0 이상)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @param random [0, 1) 난수 공급자
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryBackoff(BackoffStrategy strategy, long baseDelayMs, long maxDelayMs, double jitterFactor,
                        DoubleSupplier random) {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be non-negative (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.strategy = strategy;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 재시도 전 대기 시간 계산.
     *
     * @param attempt 방금 실패한 시도 번호 (1부터 시작)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        if (strategy == BackoffStrategy.FIXED) {
            return baseDelayMs;
        }

        // overflow 방지: shift 상한 30
        int shift = Math.min(attempt - 1, 30);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);
        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public BackoffStrategy getStrategy() {
        return strategy;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
