package com.ryuqq.pipeline.core.chunking;

/**
 * 텍스트 분할 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>strategy: 분할 전략 (기본 RECURSIVE)</li>
 *   <li>size: 목표 청크 크기 (문자 수, 기본 512)</li>
 *   <li>overlap: 인접 청크 중복 문자 수 (기본 50, size 미만)</li>
 * </ul>
 *
 * @param strategy 분할 전략
 * @param size 목표 청크 크기 (양수)
 * @param overlap 중복 문자 수 (0 이상, size 미만)
 * @author Pipeline Team
 * @since 1.0.0
 */
public record ChunkingOptions(ChunkStrategy strategy, int size, int overlap) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: strategy=RECURSIVE, size=512, overlap=50</p>
     */
    public ChunkingOptions() {
        this(ChunkStrategy.RECURSIVE, 512, 50);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ChunkingOptions {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive (current: " + size + ")");
        }
        if (overlap < 0 || overlap >= size) {
            throw new IllegalArgumentException(
                "overlap must be >= 0 and < size (size: " + size + ", overlap: " + overlap + ")"
            );
        }
    }

    /**
     * strategy만 변경한 새 인스턴스 생성.
     */
    public ChunkingOptions withStrategy(ChunkStrategy strategy) {
        return new ChunkingOptions(strategy, size, overlap);
    }

    /**
     * size만 변경한 새 인스턴스 생성.
     */
    public ChunkingOptions withSize(int size) {
        return new ChunkingOptions(strategy, size, overlap);
    }

    /**
     * overlap만 변경한 새 인스턴스 생성.
     */
    public ChunkingOptions withOverlap(int overlap) {
        return new ChunkingOptions(strategy, size, overlap);
    }
}
