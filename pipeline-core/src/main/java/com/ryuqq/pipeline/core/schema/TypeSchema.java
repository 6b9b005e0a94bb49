package com.ryuqq.pipeline.core.schema;

/**
 * 타입 검사만 수행하는 Schema.
 *
 * @param <T> 값 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class TypeSchema<T> implements Schema<T> {

    private final String name;
    private final Class<T> type;

    TypeSchema(String name, Class<T> type) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        this.name = name;
        this.type = type;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Validation<T> validate(Object value) {
        if (value == null) {
            return Validation.invalid("", "must not be null");
        }
        if (!type.isInstance(value)) {
            return Validation.invalid("", "expected " + type.getSimpleName()
                + " but was " + value.getClass().getSimpleName());
        }
        return Validation.valid(type.cast(value));
    }
}
