package com.ryuqq.pipeline.core.engine;

/**
 * 재시도 대기 추상화 (테스트에서 대체).
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * {@link Thread#sleep(long)}을 사용하는 기본 구현.
     */
    Sleeper SYSTEM = Thread::sleep;

    /**
     * 지정 시간 대기.
     *
     * @param millis 대기 시간 (밀리초, 0이면 즉시 반환)
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    void sleep(long millis) throws InterruptedException;
}
