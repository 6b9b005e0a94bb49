package com.ryuqq.pipeline.core.chunking;

import java.util.List;

/**
 * 분할 결과 요약.
 *
 * @param chunks 청크 목록 (순번 순)
 * @param totalChunks 청크 수
 * @param averageChunkSize 평균 청크 길이 (반올림, 청크가 없으면 0)
 * @author Pipeline Team
 * @since 1.0.0
 */
public record ChunkingResult(List<Chunk> chunks, int totalChunks, int averageChunkSize) {

    public ChunkingResult {
        if (chunks == null) {
            throw new IllegalArgumentException("chunks cannot be null");
        }
        chunks = List.copyOf(chunks);
        if (totalChunks != chunks.size()) {
            throw new IllegalArgumentException(
                "totalChunks must equal chunks.size() (total: " + totalChunks + ", size: " + chunks.size() + ")"
            );
        }
    }

    /**
     * 청크 목록으로 결과 생성.
     *
     * @param chunks 청크 목록
     * @return ChunkingResult
     */
    public static ChunkingResult of(List<Chunk> chunks) {
        if (chunks == null) {
            throw new IllegalArgumentException("chunks cannot be null");
        }
        int average = chunks.isEmpty()
            ? 0
            : (int) Math.round(chunks.stream().mapToInt(Chunk::length).average().orElse(0));
        return new ChunkingResult(chunks, chunks.size(), average);
    }
}
