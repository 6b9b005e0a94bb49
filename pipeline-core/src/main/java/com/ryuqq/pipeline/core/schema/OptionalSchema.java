package com.ryuqq.pipeline.core.schema;

/**
 * null을 허용하는 Schema 래퍼.
 *
 * @param <T> 값 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
final class OptionalSchema<T> implements Schema<T> {

    private final Schema<T> delegate;

    OptionalSchema(Schema<T> delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    @Override
    public String name() {
        return delegate.name() + "?";
    }

    @Override
    public Validation<T> validate(Object value) {
        if (value == null) {
            return Validation.valid(null);
        }
        return delegate.validate(value);
    }
}
