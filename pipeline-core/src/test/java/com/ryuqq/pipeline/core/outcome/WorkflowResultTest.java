package com.ryuqq.pipeline.core.outcome;

import com.ryuqq.pipeline.core.error.ErrorKind;
import com.ryuqq.pipeline.core.error.LoopExceededException;
import com.ryuqq.pipeline.core.error.StepExecutionException;
import com.ryuqq.pipeline.core.tracing.Span;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WorkflowResult, WorkflowFailure, LoopReport 유닛 테스트.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class WorkflowResultTest {

    private static RunReport report(List<LoopReport> loops) {
        return new RunReport("run-1", "wf", List.of(), Span.root("workflow:wf"), loops, Duration.ZERO);
    }

    @Test
    void succeeded_값을_반환() {
        // Given
        WorkflowResult<String> result = new Succeeded<>("done", report(List.of()));

        // When & Then
        assertTrue(result.isSucceeded());
        assertFalse(result.isFailed());
        assertEquals("done", result.valueOrThrow());
    }

    @Test
    void failed_valueOrThrow는_원인과_함께_예외() {
        // Given
        StepExecutionException cause = new StepExecutionException("fetch", 3, new IOException("timeout"));
        WorkflowResult<String> result = new Failed<>(WorkflowFailure.of(cause), report(List.of()));

        // When
        IllegalStateException exception = assertThrows(IllegalStateException.class, result::valueOrThrow);

        // Then
        assertTrue(result.isFailed());
        assertSame(cause, exception.getCause());
    }

    @Test
    void failure_of_예외의_종류와_Step을_보존() {
        // When
        WorkflowFailure failure = WorkflowFailure.of(new LoopExceededException("review", 10));

        // Then
        assertEquals("review", failure.stepId());
        assertEquals(ErrorKind.LOOP_EXCEEDED, failure.kind());
        assertFalse(failure.isRetryable());
        assertTrue(failure.message().contains("10"));
    }

    @Test
    void loopReport_converged는_exhausted의_반대() {
        assertTrue(new LoopReport("review", 3, false).converged());
        assertFalse(new LoopReport("review", 10, true).converged());
        assertThrows(IllegalArgumentException.class, () -> new LoopReport("review", 0, false));
    }

    @Test
    void runReport_소진된_루프_조회() {
        // Given
        RunReport report = report(List.of(new LoopReport("a", 2, false), new LoopReport("b", 5, true)));

        // When & Then
        assertTrue(report.hasExhaustedLoop());
        assertEquals(5, report.loop("b").orElseThrow().iterations());
        assertTrue(report.loop("missing").isEmpty());
    }
}
