package com.ryuqq.pipeline.core.chunking;

import java.util.Locale;

/**
 * 텍스트 분할 전략.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public enum ChunkStrategy {

    /**
     * 고정 크기 창, {@code size - overlap}씩 이동.
     */
    FIXED_WINDOW,

    /**
     * 빈 줄 기준 문단 누적, 이전 청크 끝부분으로 다음 청크 시작.
     */
    PARAGRAPH,

    /**
     * PARAGRAPH와 같되, size보다 긴 문단은 문장으로, 긴 문장은 고정 창으로 다시 분할.
     */
    RECURSIVE,

    /**
     * 문장 누적, 중복 없이 원문 구간 그대로.
     */
    SENTENCE;

    /**
     * 이름으로 전략 조회 (대소문자, '-' 구분 무시).
     *
     * @param name 전략 이름 (예: "fixed-window", "recursive")
     * @return ChunkStrategy
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    public static ChunkStrategy from(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ChunkStrategy strategy : values()) {
            if (strategy.name().equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown chunk strategy: " + name);
    }
}
