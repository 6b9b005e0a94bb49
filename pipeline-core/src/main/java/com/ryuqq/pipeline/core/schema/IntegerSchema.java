package com.ryuqq.pipeline.core.schema;

/**
 * 정수 Schema.
 *
 * <p>{@link Integer}만 허용합니다. 범위 제약은 양 끝을 포함합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class IntegerSchema implements Schema<Integer> {

    private final String name;
    private final int min;
    private final int max;

    IntegerSchema(String name) {
        this(name, Integer.MIN_VALUE, Integer.MAX_VALUE);
    }

    private IntegerSchema(String name, int min, int max) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (max < min) {
            throw new IllegalArgumentException("max must be >= min (min: " + min + ", max: " + max + ")");
        }
        this.name = name;
        this.min = min;
        this.max = max;
    }

    /**
     * 최소값 제약.
     *
     * @param min 최소값 (포함)
     * @return 새 IntegerSchema
     */
    public IntegerSchema min(int min) {
        return new IntegerSchema(name, min, max);
    }

    /**
     * 최대값 제약.
     *
     * @param max 최대값 (포함)
     * @return 새 IntegerSchema
     */
    public IntegerSchema max(int max) {
        return new IntegerSchema(name, min, max);
    }

    /**
     * 범위 제약.
     *
     * @param min 최소값 (포함)
     * @param max 최대값 (포함)
     * @return 새 IntegerSchema
     */
    public IntegerSchema range(int min, int max) {
        return new IntegerSchema(name, min, max);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Validation<Integer> validate(Object value) {
        if (value == null) {
            return Validation.invalid("", "must not be null");
        }
        if (!(value instanceof Integer)) {
            return Validation.invalid("", "expected integer but was " + value.getClass().getSimpleName());
        }
        int number = (Integer) value;
        if (number < min || number > max) {
            return Validation.invalid("", "must be between " + min + " and " + max + " (current: " + number + ")");
        }
        return Validation.valid(number);
    }
}
