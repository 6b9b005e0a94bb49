package com.ryuqq.pipeline.core.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 목록 Schema.
 *
 * <p>각 원소를 원소 Schema로 검증하며, 위반 경로에는 {@code [index]}가 붙습니다.</p>
 *
 * @param <E> 원소 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class ListSchema<E> implements Schema<List<E>> {

    private final String name;
    private final Schema<E> element;
    private final int minSize;
    private final int maxSize;

    ListSchema(String name, Schema<E> element) {
        this(name, element, 0, Integer.MAX_VALUE);
    }

    private ListSchema(String name, Schema<E> element, int minSize, int maxSize) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (element == null) {
            throw new IllegalArgumentException("element cannot be null");
        }
        if (minSize < 0 || maxSize < minSize) {
            throw new IllegalArgumentException(
                "size bounds invalid (min: " + minSize + ", max: " + maxSize + ")");
        }
        this.name = name;
        this.element = element;
        this.minSize = minSize;
        this.maxSize = maxSize;
    }

    /**
     * 최소 원소 수 제약.
     *
     * @param minSize 최소 원소 수
     * @return 새 ListSchema
     */
    public ListSchema<E> minSize(int minSize) {
        return new ListSchema<>(name, element, minSize, maxSize);
    }

    /**
     * 최대 원소 수 제약.
     *
     * @param maxSize 최대 원소 수
     * @return 새 ListSchema
     */
    public ListSchema<E> maxSize(int maxSize) {
        return new ListSchema<>(name, element, minSize, maxSize);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Validation<List<E>> validate(Object value) {
        if (value == null) {
            return Validation.invalid("", "must not be null");
        }
        if (!(value instanceof List)) {
            return Validation.invalid("", "expected list but was " + value.getClass().getSimpleName());
        }
        List<?> items = (List<?>) value;
        List<Violation> violations = new ArrayList<>();
        if (items.size() < minSize) {
            violations.add(new Violation("", "size must be >= " + minSize + " (current: " + items.size() + ")"));
        }
        if (items.size() > maxSize) {
            violations.add(new Violation("", "size must be <= " + maxSize + " (current: " + items.size() + ")"));
        }
        List<E> accepted = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            Validation<E> result = element.validate(items.get(i));
            if (result instanceof Valid) {
                accepted.add(((Valid<E>) result).value());
            } else {
                for (Violation violation : result.violations()) {
                    violations.add(violation.under("[" + i + "]"));
                }
            }
        }
        if (!violations.isEmpty()) {
            return Validation.invalid(violations);
        }
        return Validation.valid(Collections.unmodifiableList(accepted));
    }
}
