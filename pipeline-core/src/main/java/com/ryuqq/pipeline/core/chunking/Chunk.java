package com.ryuqq.pipeline.core.chunking;

/**
 * 분할된 텍스트 조각.
 *
 * @param id 청크 ID ({@code chunk-<n>})
 * @param content 내용 (비어 있지 않음)
 * @param chunkIndex 0부터 연속인 순번
 * @param startOffset 원문 시작 위치 (추적하지 않으면 -1)
 * @param endOffset 원문 끝 위치, 배타적 (추적하지 않으면 -1)
 * @author Pipeline Team
 * @since 1.0.0
 */
public record Chunk(String id, String content, int chunkIndex, int startOffset, int endOffset) {

    /**
     * 위치를 추적하지 않을 때의 값.
     */
    public static final int UNTRACKED = -1;

    public Chunk {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (content == null || content.isEmpty()) {
            throw new IllegalArgumentException("content cannot be null or empty");
        }
        if (chunkIndex < 0) {
            throw new IllegalArgumentException("chunkIndex must be non-negative (current: " + chunkIndex + ")");
        }
        if (startOffset < UNTRACKED || endOffset < UNTRACKED) {
            throw new IllegalArgumentException(
                "offsets must be >= -1 (start: " + startOffset + ", end: " + endOffset + ")"
            );
        }
        if (startOffset != UNTRACKED && endOffset != UNTRACKED && endOffset < startOffset) {
            throw new IllegalArgumentException(
                "endOffset must be >= startOffset (start: " + startOffset + ", end: " + endOffset + ")"
            );
        }
    }

    /**
     * 순번과 내용으로 청크 생성 (ID 자동 부여).
     *
     * @param chunkIndex 순번
     * @param content 내용
     * @param startOffset 원문 시작 위치
     * @param endOffset 원문 끝 위치
     * @return Chunk
     */
    public static Chunk of(int chunkIndex, String content, int startOffset, int endOffset) {
        return new Chunk("chunk-" + chunkIndex, content, chunkIndex, startOffset, endOffset);
    }

    public boolean hasOffsets() {
        return startOffset != UNTRACKED && endOffset != UNTRACKED;
    }

    public int length() {
        return content.length();
    }
}
