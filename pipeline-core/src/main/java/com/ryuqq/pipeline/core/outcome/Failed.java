package com.ryuqq.pipeline.core.outcome;

/**
 * 실패 결과.
 *
 * @param failure 실패 정보
 * @param report 실행 관측 기록 (실패 시점까지의 이벤트와 닫힌 Span 트리)
 * @param <O> 출력 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
public record Failed<O>(WorkflowFailure failure, RunReport report) implements WorkflowResult<O> {

    public Failed {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        if (report == null) {
            throw new IllegalArgumentException("report cannot be null");
        }
    }
}
