package com.ryuqq.pipeline.core.schema;

import java.util.Arrays;
import java.util.Locale;

/**
 * 열거형 Schema.
 *
 * <p>열거 상수 자체 또는 상수 이름 문자열(대소문자, 하이픈 무시)을 허용하며,
 * 문자열은 상수로 변환되어 반환됩니다.</p>
 *
 * @param <E> 열거형 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class EnumSchema<E extends Enum<E>> implements Schema<E> {

    private final String name;
    private final Class<E> type;

    EnumSchema(String name, Class<E> type) {
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
    public Validation<E> validate(Object value) {
        if (value == null) {
            return Validation.invalid("", "must not be null");
        }
        if (type.isInstance(value)) {
            return Validation.valid(type.cast(value));
        }
        if (value instanceof String) {
            String normalized = ((String) value).trim().replace('-', '_').toUpperCase(Locale.ROOT);
            for (E constant : type.getEnumConstants()) {
                if (constant.name().equals(normalized)) {
                    return Validation.valid(constant);
                }
            }
        }
        return Validation.invalid("", "must be one of " + Arrays.toString(type.getEnumConstants())
            + " (current: " + value + ")");
    }
}
