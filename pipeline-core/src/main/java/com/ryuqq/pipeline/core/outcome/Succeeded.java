package com.ryuqq.pipeline.core.outcome;

/**
 * 성공 결과.
 *
 * @param value 검증된 최종 출력
 * @param report 실행 관측 기록
 * @param <O> 출력 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
public record Succeeded<O>(O value, RunReport report) implements WorkflowResult<O> {

    public Succeeded {
        if (report == null) {
            throw new IllegalArgumentException("report cannot be null");
        }
        // value는 null 허용 (출력 Schema가 optional인 경우)
    }
}
