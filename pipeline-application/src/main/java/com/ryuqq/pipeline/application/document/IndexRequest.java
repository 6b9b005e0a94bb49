package com.ryuqq.pipeline.application.document;

import com.ryuqq.pipeline.core.chunking.Chunk;

import java.util.List;

/**
 * vector-index Tool 입력.
 *
 * @param documentId 문서 ID
 * @param indexName 인덱스 이름
 * @param chunks 색인할 청크
 * @author Pipeline Team
 * @since 1.0.0
 */
public record IndexRequest(String documentId, String indexName, List<Chunk> chunks) {

    public IndexRequest {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }
}
