package com.ryuqq.pipeline.core.schema;

/**
 * null 입력을 기본값으로 대체하는 Schema 래퍼.
 *
 * <p>기본값은 생성 시점에 원본 Schema로 검증됩니다. 잘못된 기본값은 설정 오류입니다.</p>
 *
 * @param <T> 값 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
final class DefaultingSchema<T> implements Schema<T> {

    private final Schema<T> delegate;
    private final T defaultValue;

    DefaultingSchema(Schema<T> delegate, T defaultValue) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        Validation<T> check = delegate.validate(defaultValue);
        if (!check.isValid()) {
            throw new IllegalArgumentException(
                "defaultValue does not satisfy schema " + delegate.name() + " (current: " + defaultValue + ")");
        }
        this.delegate = delegate;
        this.defaultValue = defaultValue;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public Validation<T> validate(Object value) {
        if (value == null) {
            return Validation.valid(defaultValue);
        }
        return delegate.validate(value);
    }
}
