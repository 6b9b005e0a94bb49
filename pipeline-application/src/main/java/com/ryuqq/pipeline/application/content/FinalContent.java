package com.ryuqq.pipeline.application.content;

import java.util.List;

/**
 * 콘텐츠 리뷰 Workflow 출력.
 *
 * @param content 최종 콘텐츠
 * @param score 최종 점수
 * @param iterations 리뷰 횟수
 * @param feedback 마지막 피드백
 * @param status APPROVED 또는 LOOP_EXCEEDED
 * @param metadata 메타데이터
 * @author Pipeline Team
 * @since 1.0.0
 */
public record FinalContent(
    String content,
    int score,
    int iterations,
    List<String> feedback,
    ContentStatus status,
    ContentMetadata metadata
) {

    public FinalContent {
        feedback = feedback == null ? List.of() : List.copyOf(feedback);
    }

    public boolean isApproved() {
        return status == ContentStatus.APPROVED;
    }
}
