package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.core.progress.ProgressEvent;
import com.ryuqq.pipeline.core.progress.ProgressKind;
import com.ryuqq.pipeline.core.progress.ProgressTransition;
import com.ryuqq.pipeline.core.progress.StepKey;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Assertions over a run's progress event log.
 *
 * <p><strong>Grammar checked per step occurrence:</strong></p>
 * <ul>
 *   <li>the first event is START</li>
 *   <li>any number of PROGRESS events follow</li>
 *   <li>exactly one terminal event (COMPLETE, ERROR or CANCELLED) closes it</li>
 *   <li>nothing follows the terminal event</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class ProgressAssertions {

    /**
     * Asserts the per-occurrence grammar and that sequence numbers strictly increase.
     *
     * @param events the run's events in emission order
     */
    public static void assertWellFormed(List<ProgressEvent> events) {
        Map<StepKey, ProgressKind> last = new LinkedHashMap<>();
        long previousSequence = -1;
        for (ProgressEvent event : events) {
            assertTrue(event.sequence() > previousSequence,
                String.format("Sequence must increase: %d after %d", event.sequence(), previousSequence));
            previousSequence = event.sequence();

            ProgressKind before = last.get(event.key());
            if (!ProgressTransition.isAllowed(before, event.kind())) {
                fail(String.format("Invalid progress transition for %s: %s -> %s", event.key(), before, event.kind()));
            }
            last.put(event.key(), event.kind());
        }
        last.forEach((key, kind) -> assertTrue(kind.isTerminal(),
            String.format("Step occurrence %s never reached a terminal event (last: %s)", key, kind)));
    }

    /**
     * Asserts how many occurrences of a step ran and how each ended.
     *
     * @param events the run's events
     * @param stepId the step id
     * @param expected expected terminal kind per occurrence, in order
     */
    public static void assertTerminals(List<ProgressEvent> events, String stepId, ProgressKind... expected) {
        List<ProgressKind> terminals = events.stream()
            .filter(event -> event.stepId().equals(stepId) && event.kind().isTerminal())
            .map(ProgressEvent::kind)
            .toList();
        assertEquals(List.of(expected), terminals,
            String.format("Unexpected terminal events for step '%s'", stepId));
    }

    /**
     * Asserts the order in which steps first started.
     *
     * @param events the run's events
     * @param stepIds expected step ids in order of their first START
     */
    public static void assertStartOrder(List<ProgressEvent> events, String... stepIds) {
        List<String> started = events.stream()
            .filter(event -> event.kind() == ProgressKind.START)
            .map(ProgressEvent::stepId)
            .distinct()
            .toList();
        assertEquals(List.of(stepIds), started, "Unexpected step start order");
    }

    // Utility class - prevent instantiation
    private ProgressAssertions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
