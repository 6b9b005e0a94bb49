package com.ryuqq.pipeline.application.content;

import java.time.Instant;
import java.util.List;

/**
 * 최종 콘텐츠 메타데이터.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public record ContentMetadata(
    String topic,
    ContentType contentType,
    String targetAudience,
    int wordCount,
    int qualityThreshold,
    List<Integer> scoreHistory,
    Instant generatedAt
) {

    public ContentMetadata {
        scoreHistory = scoreHistory == null ? List.of() : List.copyOf(scoreHistory);
    }
}
