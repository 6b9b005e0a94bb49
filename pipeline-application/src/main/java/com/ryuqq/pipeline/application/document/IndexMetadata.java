package com.ryuqq.pipeline.application.document;

import java.time.Instant;
import java.util.List;

/**
 * 색인 결과 메타데이터.
 *
 * @param title 문서 제목 (없으면 null)
 * @param sourceUrl URL 출처 (없으면 null)
 * @param processedAt 처리 시각
 * @param vectorIds 벡터 ID
 * @author Pipeline Team
 * @since 1.0.0
 */
public record IndexMetadata(String title, String sourceUrl, Instant processedAt, List<String> vectorIds) {

    public IndexMetadata {
        vectorIds = vectorIds == null ? List.of() : List.copyOf(vectorIds);
    }
}
