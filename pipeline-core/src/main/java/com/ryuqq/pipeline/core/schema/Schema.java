package com.ryuqq.pipeline.core.schema;

/**
 * 값의 구조를 기술하는 Schema Contract.
 *
 * <p>Step 경계(입력/출력), Tool 호출 경계, Workflow 입출력에서 값을 검증하는 데 사용됩니다.
 * 검증 실패는 재시도 대상이 아닌 설정 오류로 취급됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Schema&lt;String&gt; topic = Schemas.string("topic").nonBlank();
 * Validation&lt;String&gt; result = topic.validate(input);
 * if (!result.isValid()) {
 *     // result.violations() 확인
 * }
 * </pre>
 *
 * @param <T> 검증을 통과한 값의 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
public interface Schema<T> {

    /**
     * Schema 이름 (오류 메시지와 로그에 사용).
     *
     * @return Schema 이름
     */
    String name();

    /**
     * 값 검증.
     *
     * <p>검증을 통과하면 {@link Valid}에 (기본값이 적용되었을 수 있는) 값을 담아 반환하고,
     * 실패하면 {@link Invalid}에 위반 목록을 담아 반환합니다. 이 메서드는 예외를 던지지 않습니다.</p>
     *
     * @param value 검증할 값 (null 가능)
     * @return 검증 결과
     */
    Validation<T> validate(Object value);

    /**
     * null을 허용하는 Schema 생성.
     *
     * @return null이면 통과, 아니면 이 Schema로 검증하는 Schema
     */
    default Schema<T> optional() {
        return new OptionalSchema<>(this);
    }

    /**
     * null 입력 시 기본값을 사용하는 Schema 생성.
     *
     * @param defaultValue 기본값 (이 Schema를 통과해야 함)
     * @return 기본값이 적용되는 Schema
     * @throws IllegalArgumentException 기본값이 이 Schema를 통과하지 못하는 경우
     */
    default Schema<T> withDefault(T defaultValue) {
        return new DefaultingSchema<>(this, defaultValue);
    }
}
