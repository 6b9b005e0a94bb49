package com.ryuqq.pipeline.core.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 문자열 Schema.
 *
 * <p>불변 객체이며, 제약 조건 메서드는 새 인스턴스를 반환합니다.</p>
 *
 * <pre>
 * Schema&lt;String&gt; indexName = Schemas.string("indexName").nonBlank().maxLength(64);
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class StringSchema implements Schema<String> {

    private final String name;
    private final boolean nonBlank;
    private final int minLength;
    private final int maxLength;
    private final Pattern pattern;
    private final Set<String> allowed;

    StringSchema(String name) {
        this(name, false, 0, Integer.MAX_VALUE, null, null);
    }

    private StringSchema(String name, boolean nonBlank, int minLength, int maxLength,
                         Pattern pattern, Set<String> allowed) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
        this.nonBlank = nonBlank;
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.pattern = pattern;
        this.allowed = allowed;
    }

    /**
     * 공백 문자열을 허용하지 않는 Schema.
     *
     * @return 새 StringSchema
     */
    public StringSchema nonBlank() {
        return new StringSchema(name, true, minLength, maxLength, pattern, allowed);
    }

    /**
     * 최소 길이 제약.
     *
     * @param minLength 최소 길이 (0 이상)
     * @return 새 StringSchema
     */
    public StringSchema minLength(int minLength) {
        if (minLength < 0) {
            throw new IllegalArgumentException("minLength must be non-negative (current: " + minLength + ")");
        }
        return new StringSchema(name, nonBlank, minLength, maxLength, pattern, allowed);
    }

    /**
     * 최대 길이 제약.
     *
     * @param maxLength 최대 길이 (minLength 이상)
     * @return 새 StringSchema
     */
    public StringSchema maxLength(int maxLength) {
        if (maxLength < minLength) {
            throw new IllegalArgumentException(
                "maxLength must be >= minLength (min: " + minLength + ", max: " + maxLength + ")");
        }
        return new StringSchema(name, nonBlank, minLength, maxLength, pattern, allowed);
    }

    /**
     * 정규식 전체 일치 제약.
     *
     * @param regex 정규식
     * @return 새 StringSchema
     */
    public StringSchema pattern(String regex) {
        if (regex == null || regex.isEmpty()) {
            throw new IllegalArgumentException("regex cannot be null or empty");
        }
        return new StringSchema(name, nonBlank, minLength, maxLength, Pattern.compile(regex), allowed);
    }

    /**
     * 허용 값 목록 제약.
     *
     * @param values 허용 값 (1개 이상)
     * @return 새 StringSchema
     */
    public StringSchema oneOf(String... values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("values cannot be null or empty");
        }
        return new StringSchema(name, nonBlank, minLength, maxLength, pattern, Set.of(values));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Validation<String> validate(Object value) {
        if (value == null) {
            return Validation.invalid("", "must not be null");
        }
        if (!(value instanceof String)) {
            return Validation.invalid("", "expected string but was " + value.getClass().getSimpleName());
        }
        String text = (String) value;
        List<Violation> violations = new ArrayList<>();
        if (nonBlank && text.isBlank()) {
            violations.add(new Violation("", "must not be blank"));
        }
        if (text.length() < minLength) {
            violations.add(new Violation("", "length must be >= " + minLength + " (current: " + text.length() + ")"));
        }
        if (text.length() > maxLength) {
            violations.add(new Violation("", "length must be <= " + maxLength + " (current: " + text.length() + ")"));
        }
        if (pattern != null && !pattern.matcher(text).matches()) {
            violations.add(new Violation("", "must match " + pattern.pattern()));
        }
        if (allowed != null && !allowed.contains(text)) {
            violations.add(new Violation("", "must be one of " + allowed + " (current: " + text + ")"));
        }
        return violations.isEmpty() ? Validation.valid(text) : Validation.invalid(violations);
    }
}
