package com.ryuqq.pipeline.application.document;

import com.ryuqq.pipeline.core.chunking.Chunk;

import java.util.List;

/**
 * chunk-document 출력.
 *
 * @param document 분할 대상 문서
 * @param chunks 청크 목록
 * @param averageChunkSize 평균 청크 길이
 * @author Pipeline Team
 * @since 1.0.0
 */
public record ChunkedDocument(MarkdownDocument document, List<Chunk> chunks, int averageChunkSize) {

    public ChunkedDocument {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }

    public int totalChunks() {
        return chunks.size();
    }
}
