package com.ryuqq.pipeline.core.context;

/**
 * 협조적 취소 신호 (읽기 전용).
 *
 * <p>엔진은 매 시도 전, Generator/Tool 호출 전후에 이 신호를 확인합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CancellationSignal {

    /**
     * 절대 취소되지 않는 신호.
     */
    CancellationSignal NONE = () -> false;

    /**
     * 취소 요청 여부.
     *
     * @return 취소가 요청되었으면 true
     */
    boolean isCancelled();
}
