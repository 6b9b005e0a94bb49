package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.core.tracing.Span;
import com.ryuqq.pipeline.core.tracing.SpanStatus;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Assertions over a run's span tree.
 *
 * <p>A well-formed tree has every span ended and every child nested in its parent's
 * monotonic time interval.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class TraceAssertions {

    /**
     * Asserts the tree rooted at {@code root} is closed and well nested.
     *
     * @param root the root span
     */
    public static void assertClosedTree(Span root) {
        assertTrue(root.isRoot(), "Expected a root span but got " + root);
        for (Span span : root.flatten()) {
            assertNotEquals(SpanStatus.UNSET, span.status(), "Span left open: " + span.name());
            assertTrue(span.endNanos() >= span.startNanos(), "Span ends before it starts: " + span.name());
            for (Span child : span.children()) {
                assertSame(span, child.parent().orElse(null), "Broken parent link: " + child.name());
                assertTrue(child.startNanos() >= span.startNanos(),
                    String.format("Child '%s' starts before parent '%s'", child.name(), span.name()));
                assertTrue(child.endNanos() <= span.endNanos(),
                    String.format("Child '%s' ends after parent '%s'", child.name(), span.name()));
            }
        }
    }

    /**
     * Asserts the names of the root's direct children.
     *
     * @param root the root span
     * @param names expected child names in order
     */
    public static void assertChildren(Span root, String... names) {
        List<String> actual = root.children().stream().map(Span::name).toList();
        assertEquals(List.of(names), actual, "Unexpected child spans of " + root.name());
    }

    /**
     * Asserts the status of the first span with the given name.
     *
     * @param root the root span
     * @param name span name to look up
     * @param expected expected status
     */
    public static void assertStatus(Span root, String name, SpanStatus expected) {
        Span span = root.find(name).orElseThrow(() -> new AssertionError("No span named " + name));
        assertEquals(expected, span.status(), "Unexpected status for span " + name);
    }

    // Utility class - prevent instantiation
    private TraceAssertions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
