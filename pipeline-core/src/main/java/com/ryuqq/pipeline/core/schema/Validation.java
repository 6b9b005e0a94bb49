package com.ryuqq.pipeline.core.schema;

import java.util.List;

/**
 * Schema 검증 결과.
 *
 * <p>두 가지 결과 중 하나입니다:</p>
 * <ul>
 *   <li>{@link Valid}: 검증 통과 (값 포함)</li>
 *   <li>{@link Invalid}: 검증 실패 (위반 목록 포함)</li>
 * </ul>
 *
 * @param <T> 값 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
public sealed interface Validation<T> permits Valid, Invalid {

    /**
     * 검증 통과 결과 생성.
     *
     * @param value 검증된 값
     * @param <T> 값 타입
     * @return Valid
     */
    static <T> Validation<T> valid(T value) {
        return new Valid<>(value);
    }

    /**
     * 단일 위반으로 실패 결과 생성.
     *
     * @param path 위반 경로 (루트는 빈 문자열)
     * @param message 위반 메시지
     * @param <T> 값 타입
     * @return Invalid
     */
    static <T> Validation<T> invalid(String path, String message) {
        return new Invalid<>(List.of(new Violation(path, message)));
    }

    /**
     * 위반 목록으로 실패 결과 생성.
     *
     * @param violations 위반 목록 (1개 이상)
     * @param <T> 값 타입
     * @return Invalid
     */
    static <T> Validation<T> invalid(List<Violation> violations) {
        return new Invalid<>(violations);
    }

    /**
     * 검증 통과 여부.
     *
     * @return 통과하면 true
     */
    default boolean isValid() {
        return this instanceof Valid;
    }

    /**
     * 위반 목록 조회.
     *
     * @return 위반 목록 (통과한 경우 빈 목록)
     */
    List<Violation> violations();
}
