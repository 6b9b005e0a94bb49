package com.ryuqq.pipeline.core.schema;

/**
 * Schema 팩토리.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class Schemas {

    // Utility class - prevent instantiation
    private Schemas() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static StringSchema string(String name) {
        return new StringSchema(name);
    }

    public static IntegerSchema integer(String name) {
        return new IntegerSchema(name);
    }

    public static TypeSchema<Boolean> bool(String name) {
        return new TypeSchema<>(name, Boolean.class);
    }

    /**
     * 타입 검사만 수행하는 Schema.
     *
     * @param name Schema 이름
     * @param type 허용 타입
     * @param <T> 값 타입
     * @return TypeSchema
     */
    public static <T> TypeSchema<T> type(String name, Class<T> type) {
        return new TypeSchema<>(name, type);
    }

    public static <E extends Enum<E>> EnumSchema<E> enumOf(String name, Class<E> type) {
        return new EnumSchema<>(name, type);
    }

    public static <E> ListSchema<E> listOf(String name, Schema<E> element) {
        return new ListSchema<>(name, element);
    }

    public static <T> ObjectSchema.Builder<T> object(String name, Class<T> type) {
        return ObjectSchema.builder(name, type);
    }
}
