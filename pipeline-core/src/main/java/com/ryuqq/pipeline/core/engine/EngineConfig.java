package com.ryuqq.pipeline.core.engine;

/**
 * Workflow 엔진 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>backoffStrategy: 재시도 간격 전략 (기본 EXPONENTIAL)</li>
 *   <li>baseDelayMs: 재시도 기본 지연 (기본 200ms, 0이면 대기 없음)</li>
 *   <li>maxDelayMs: 재시도 최대 지연 (기본 5000ms)</li>
 *   <li>jitterFactor: Jitter 비율 (기본 0.1)</li>
 *   <li>maxLoopIterations: 루프 단계가 선언할 수 있는 maxIterations 상한 (기본 100)</li>
 * </ul>
 *
 * @param backoffStrategy 재시도 간격 전략
 * @param baseDelayMs 재시도 기본 지연 (밀리초, 0 이상)
 * @param maxDelayMs 재시도 최대 지연 (밀리초, baseDelayMs 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 * @param maxLoopIterations 루프 반복 상한 (1 이상)
 * @author Pipeline Team
 * @since 1.0.0
 */
public record EngineConfig(
    BackoffStrategy backoffStrategy,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor,
    int maxLoopIterations
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: EXPONENTIAL, baseDelayMs=200, maxDelayMs=5000, jitterFactor=0.1, maxLoopIterations=100</p>
     */
    public EngineConfig() {
        this(BackoffStrategy.EXPONENTIAL, 200, 5000, 0.1, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EngineConfig {
        if (backoffStrategy == null) {
            throw new IllegalArgumentException("backoffStrategy cannot be null");
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
        if (maxLoopIterations <= 0) {
            throw new IllegalArgumentException(
                "maxLoopIterations must be positive (current: " + maxLoopIterations + ")"
            );
        }
    }

    /**
     * 재시도 사이에 대기하지 않는 설정 (테스트용).
     *
     * @return 지연 0, FIXED 전략 설정
     */
    public static EngineConfig noDelay() {
        return new EngineConfig(BackoffStrategy.FIXED, 0, 0, 0.0, 100);
    }

    /**
     * backoffStrategy만 변경한 새 인스턴스 생성.
     */
    public EngineConfig withBackoffStrategy(BackoffStrategy backoffStrategy) {
        return new EngineConfig(backoffStrategy, baseDelayMs, maxDelayMs, jitterFactor, maxLoopIterations);
    }

    /**
     * baseDelayMs만 변경한 새 인스턴스 생성.
     */
    public EngineConfig withBaseDelayMs(long baseDelayMs) {
        return new EngineConfig(backoffStrategy, baseDelayMs, maxDelayMs, jitterFactor, maxLoopIterations);
    }

    /**
     * maxDelayMs만 변경한 새 인스턴스 생성.
     */
    public EngineConfig withMaxDelayMs(long maxDelayMs) {
        return new EngineConfig(backoffStrategy, baseDelayMs, maxDelayMs, jitterFactor, maxLoopIterations);
    }

    /**
     * jitterFactor만 변경한 새 인스턴스 생성.
     */
    public EngineConfig withJitterFactor(double jitterFactor) {
        return new EngineConfig(backoffStrategy, baseDelayMs, maxDelayMs, jitterFactor, maxLoopIterations);
    }

    /**
     * maxLoopIterations만 변경한 새 인스턴스 생성.
     */
    public EngineConfig withMaxLoopIterations(int maxLoopIterations) {
        return new EngineConfig(backoffStrategy, baseDelayMs, maxDelayMs, jitterFactor, maxLoopIterations);
    }
}
