package com.ryuqq.pipeline.core.schema;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Schema 팩토리 테스트.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class SchemasTest {

    enum Format { PDF, HTML, MARKDOWN }

    record Research(String summary, List<String> keyPoints) {
    }

    record Request(String topic, Integer threshold, Research research) {
    }

    private static final ObjectSchema<Research> RESEARCH = Schemas.object("research", Research.class)
        .field("summary", Research::summary, Schemas.string("summary").nonBlank())
        .field("keyPoints", Research::keyPoints,
            Schemas.listOf("keyPoints", Schemas.string("keyPoint").nonBlank()).minSize(1))
        .build();

    private static final ObjectSchema<Request> REQUEST = Schemas.object("request", Request.class)
        .field("topic", Request::topic, Schemas.string("topic").nonBlank())
        .field("threshold", Request::threshold, Schemas.integer("threshold").range(0, 100))
        .field("research", Request::research, RESEARCH)
        .rule("threshold", request -> request.threshold() != 13, "threshold 13 is reserved")
        .build();

    @Test
    void string_NonBlank_RejectsBlank() {
        // When
        Validation<String> result = Schemas.string("topic").nonBlank().validate("  ");

        // Then
        assertFalse(result.isValid());
        assertEquals("must not be blank", result.violations().get(0).message());
    }

    @Test
    void string_WrongType_RejectsWithTypeMessage() {
        // When
        Validation<String> result = Schemas.string("topic").validate(42);

        // Then
        assertFalse(result.isValid());
        assertTrue(result.violations().get(0).message().contains("expected string"));
    }

    @Test
    void string_OneOf_AcceptsAllowedValue() {
        // When
        Validation<String> result = Schemas.string("format").oneOf("pdf", "html").validate("pdf");

        // Then
        assertTrue(result.isValid());
        assertEquals("pdf", ((Valid<String>) result).value());
    }

    @Test
    void integer_OutOfRange_Rejects() {
        // When
        Validation<Integer> result = Schemas.integer("score").range(0, 100).validate(101);

        // Then
        assertFalse(result.isValid());
        assertTrue(result.violations().get(0).message().contains("current: 101"));
    }

    @Test
    void enumOf_AcceptsNameIgnoringCaseAndDashes() {
        // When
        Validation<Format> result = Schemas.enumOf("format", Format.class).validate("markdown");

        // Then
        assertTrue(result.isValid());
        assertEquals(Format.MARKDOWN, ((Valid<Format>) result).value());
    }

    @Test
    void optional_AcceptsNull() {
        // When
        Validation<String> result = Schemas.string("author").nonBlank().optional().validate(null);

        // Then
        assertTrue(result.isValid());
        assertNull(((Valid<String>) result).value());
    }

    @Test
    void withDefault_ReplacesNull() {
        // When
        Validation<Integer> result = Schemas.integer("threshold").range(0, 100).withDefault(80).validate(null);

        // Then
        assertEquals(80, ((Valid<Integer>) result).value());
    }

    @Test
    void withDefault_InvalidDefault_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> Schemas.integer("threshold").range(0, 100).withDefault(200));
    }

    @Test
    void object_NestedViolation_CarriesIndexedPath() {
        // Given
        Request request = new Request("AI", 80, new Research("summary", List.of("a", "b", " ")));

        // When
        Validation<Request> result = REQUEST.validate(request);

        // Then
        assertFalse(result.isValid());
        assertEquals(1, result.violations().size());
        assertEquals("research.keyPoints[2]", result.violations().get(0).path());
    }

    @Test
    void object_CollectsEveryFieldViolation() {
        // Given
        Request request = new Request("", 120, new Research("", List.of()));

        // When
        Validation<Request> result = REQUEST.validate(request);

        // Then
        assertEquals(List.of("topic", "threshold", "research.summary", "research.keyPoints"),
            result.violations().stream().map(Violation::path).toList());
    }

    @Test
    void object_RuleRunsOnlyWhenFieldsAreValid() {
        // Given
        Request request = new Request("AI", 13, new Research("summary", List.of("a")));

        // When
        Validation<Request> result = REQUEST.validate(request);

        // Then
        assertFalse(result.isValid());
        assertEquals("threshold", result.violations().get(0).path());
        assertEquals("threshold 13 is reserved", result.violations().get(0).message());
    }

    @Test
    void object_ValidValue_ReturnsSameInstance() {
        // Given
        Request request = new Request("AI", 80, new Research("summary", List.of("a")));

        // When
        Validation<Request> result = REQUEST.validate(request);

        // Then
        assertTrue(result.isValid());
        assertSame(request, ((Valid<Request>) result).value());
        assertTrue(result.violations().isEmpty());
    }

    @Test
    void invalid_EmptyViolations_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new Invalid<String>(List.of()));
    }

    @Test
    void invalid_Summary_JoinsViolations() {
        // Given
        Invalid<String> invalid = new Invalid<>(List.of(new Violation("a", "bad"), new Violation("", "worse")));

        // When & Then
        assertEquals("a: bad; worse", invalid.summary());
    }
}
