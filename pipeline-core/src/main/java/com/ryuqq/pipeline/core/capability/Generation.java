package com.ryuqq.pipeline.core.capability;

/**
 * Generator 호출 결과.
 *
 * @param text 생성된 원문 텍스트
 * @param object 구조화된 결과 (텍스트 생성이면 text와 동일)
 * @param <T> 구조화 결과 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
public record Generation<T>(String text, T object) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException text가 null인 경우
     */
    public Generation {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        // object는 null 허용 (Schema가 optional인 경우)
    }

    /**
     * 텍스트 결과 생성.
     *
     * @param text 생성된 텍스트
     * @return Generation
     */
    public static Generation<String> text(String text) {
        return new Generation<>(text, text);
    }
}
