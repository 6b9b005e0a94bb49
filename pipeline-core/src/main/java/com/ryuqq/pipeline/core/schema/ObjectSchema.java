package com.ryuqq.pipeline.core.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 구조체(record) Schema.
 *
 * <p>필드별 Schema와 필드 간 규칙(rule)으로 값을 검증합니다.
 * 규칙은 모든 필드가 통과한 경우에만 평가됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Schema&lt;ReviewState&gt; schema = Schemas.object("ReviewState", ReviewState.class)
 *     .field("content", ReviewState::content, Schemas.string("content"))
 *     .field("iteration", ReviewState::iteration, Schemas.integer("iteration").min(0))
 *     .rule("scoreHistory", s -&gt; s.scoreHistory().size() == s.iteration(),
 *           "must hold one score per iteration")
 *     .build();
 * </pre>
 *
 * <p>record는 불변이므로 필드 Schema의 기본값은 반환 값에 반영되지 않습니다.
 * 필드 기본값은 record의 생성자에서 적용합니다.</p>
 *
 * @param <T> 구조체 타입
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class ObjectSchema<T> implements Schema<T> {

    private final String name;
    private final Class<T> type;
    private final List<Field<T>> fields;
    private final List<Rule<T>> rules;

    private ObjectSchema(Builder<T> builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.fields = List.copyOf(builder.fields);
        this.rules = List.copyOf(builder.rules);
    }

    /**
     * Builder 생성.
     *
     * @param name Schema 이름
     * @param type 구조체 타입
     * @param <T> 구조체 타입
     * @return Builder
     */
    public static <T> Builder<T> builder(String name, Class<T> type) {
        return new Builder<>(name, type);
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * 구조체 타입 조회.
     *
     * @return 구조체 타입
     */
    public Class<T> type() {
        return type;
    }

    /**
     * 선언된 필드 이름 목록.
     *
     * @return 필드 이름 (선언 순서)
     */
    public List<String> fieldNames() {
        List<String> names = new ArrayList<>(fields.size());
        for (Field<T> field : fields) {
            names.add(field.name());
        }
        return names;
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
        T object = type.cast(value);
        List<Violation> violations = new ArrayList<>();
        for (Field<T> field : fields) {
            Validation<?> result = field.schema().validate(field.accessor().apply(object));
            for (Violation violation : result.violations()) {
                violations.add(violation.under(field.name()));
            }
        }
        if (violations.isEmpty()) {
            for (Rule<T> rule : rules) {
                if (!rule.predicate().test(object)) {
                    violations.add(new Violation(rule.path(), rule.message()));
                }
            }
        }
        return violations.isEmpty() ? Validation.valid(object) : Validation.invalid(violations);
    }

    private record Field<T>(String name, Function<T, ?> accessor, Schema<?> schema) {
    }

    private record Rule<T>(String path, Predicate<T> predicate, String message) {
    }

    /**
     * ObjectSchema Builder.
     *
     * @param <T> 구조체 타입
     */
    public static final class Builder<T> {

        private final String name;
        private final Class<T> type;
        private final List<Field<T>> fields = new ArrayList<>();
        private final List<Rule<T>> rules = new ArrayList<>();

        private Builder(String name, Class<T> type) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (type == null) {
                throw new IllegalArgumentException("type cannot be null");
            }
            this.name = name;
            this.type = type;
        }

        /**
         * 필수 필드 선언.
         *
         * @param fieldName 필드 이름
         * @param accessor 필드 값 조회 함수
         * @param schema 필드 Schema
         * @return this
         */
        public Builder<T> field(String fieldName, Function<T, ?> accessor, Schema<?> schema) {
            if (fieldName == null || fieldName.isBlank()) {
                throw new IllegalArgumentException("fieldName cannot be null or blank");
            }
            if (accessor == null || schema == null) {
                throw new IllegalArgumentException("accessor and schema cannot be null (field: " + fieldName + ")");
            }
            for (Field<T> existing : fields) {
                if (existing.name().equals(fieldName)) {
                    throw new IllegalArgumentException("duplicate field: " + fieldName);
                }
            }
            fields.add(new Field<>(fieldName, accessor, schema));
            return this;
        }

        /**
         * 선택 필드 선언 (null 허용).
         *
         * @param fieldName 필드 이름
         * @param accessor 필드 값 조회 함수
         * @param schema 값이 있을 때 적용할 Schema
         * @return this
         */
        public Builder<T> optionalField(String fieldName, Function<T, ?> accessor, Schema<?> schema) {
            if (schema == null) {
                throw new IllegalArgumentException("schema cannot be null (field: " + fieldName + ")");
            }
            return field(fieldName, accessor, schema.optional());
        }

        /**
         * 필드 간 규칙 선언.
         *
         * @param path 위반 시 보고할 경로
         * @param predicate 규칙 (true면 통과)
         * @param message 위반 메시지
         * @return this
         */
        public Builder<T> rule(String path, Predicate<T> predicate, String message) {
            if (predicate == null) {
                throw new IllegalArgumentException("predicate cannot be null");
            }
            rules.add(new Rule<>(path, predicate, message));
            return this;
        }

        /**
         * ObjectSchema 생성.
         *
         * @return 불변 ObjectSchema
         */
        public ObjectSchema<T> build() {
            return new ObjectSchema<>(this);
        }
    }
}
