package com.ryuqq.pipeline.adapter.runner;

/**
 * AsyncWorkflowRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시 실행 스레드 수 (기본 4)</li>
 *   <li>progressCapacity: 실행별 진행 채널 버퍼 크기 (기본 256)</li>
 *   <li>progressOfferTimeoutMs: START/종료 이벤트의 버퍼 대기 한도 (기본 1000ms)</li>
 *   <li>shutdownTimeoutMs: 종료 시 진행 중 실행 대기 시간 (기본 30000ms)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>느린 소비자: progressCapacity 증가 (PROGRESS 이벤트 유실 감소)</li>
 *   <li>Generator 호출 위주: concurrency 증가 (실행 대부분이 I/O 대기)</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 * @param concurrency 동시 실행 스레드 수 (1 이상이어야 함)
 * @param progressCapacity 진행 채널 버퍼 크기 (1 이상이어야 함)
 * @param progressOfferTimeoutMs 버퍼 대기 한도 (밀리초, 0 이상이어야 함)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record RunnerConfig(
    int concurrency,
    int progressCapacity,
    long progressOfferTimeoutMs,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=4, progressCapacity=256, progressOfferTimeoutMs=1000ms,
     * shutdownTimeoutMs=30000ms</p>
     */
    public RunnerConfig() {
        this(4, 256, 1_000, 30_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RunnerConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (progressCapacity <= 0) {
            throw new IllegalArgumentException(
                "progressCapacity must be positive (current: " + progressCapacity + ")"
            );
        }
        if (progressOfferTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "progressOfferTimeoutMs must be non-negative (current: " + progressOfferTimeoutMs + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withConcurrency(int concurrency) {
        return new RunnerConfig(concurrency, progressCapacity, progressOfferTimeoutMs, shutdownTimeoutMs);
    }

    /**
     * progressCapacity만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withProgressCapacity(int progressCapacity) {
        return new RunnerConfig(concurrency, progressCapacity, progressOfferTimeoutMs, shutdownTimeoutMs);
    }

    /**
     * progressOfferTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withProgressOfferTimeoutMs(long progressOfferTimeoutMs) {
        return new RunnerConfig(concurrency, progressCapacity, progressOfferTimeoutMs, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public RunnerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new RunnerConfig(concurrency, progressCapacity, progressOfferTimeoutMs, shutdownTimeoutMs);
    }
}
