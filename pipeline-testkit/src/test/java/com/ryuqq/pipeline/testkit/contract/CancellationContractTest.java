package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.core.context.CancellationToken;
import com.ryuqq.pipeline.core.engine.RunOptions;
import com.ryuqq.pipeline.core.error.ErrorKind;
import com.ryuqq.pipeline.core.outcome.WorkflowResult;
import com.ryuqq.pipeline.core.progress.ProgressKind;
import com.ryuqq.pipeline.core.schema.Schemas;
import com.ryuqq.pipeline.core.step.Steps;
import com.ryuqq.pipeline.core.tracing.SpanStatus;
import com.ryuqq.pipeline.core.workflow.Workflow;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Test: cooperative cancellation ends a run with CANCELLED, never ERROR.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Cancelled before the run: the first step is cancelled before its body runs</li>
 *   <li>Cancelled by a step: the next step observes it, later steps never start</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class CancellationContractTest extends AbstractWorkflowContractTest {

    private Workflow<String, String> threeSteps(CancellationToken token, int[] bodies) {
        return Workflow.builder("three-steps", Schemas.string("text"))
            .then(Steps.define("first")
                .input(Schemas.string("text"))
                .output(Schemas.string("text"))
                .handle((text, ctx) -> {
                    bodies[0]++;
                    token.cancel("stop after first");
                    return text + "1";
                }))
            .then(Steps.define("second")
                .input(Schemas.string("text"))
                .output(Schemas.string("text"))
                .handle((text, ctx) -> {
                    bodies[1]++;
                    return text + "2";
                }))
            .then(Steps.define("third")
                .input(Schemas.string("text"))
                .output(Schemas.string("text"))
                .handle((text, ctx) -> {
                    bodies[2]++;
                    return text + "3";
                }))
            .commit(Schemas.string("text"));
    }

    @Test
    void testCancellation_RequestedDuringFirstStep_NextStepCancelled() {
        // Given
        CancellationToken token = new CancellationToken();
        int[] bodies = new int[3];

        // When
        WorkflowResult<String> result = run(threeSteps(token, bodies), "x", RunOptions.defaults().withCancellation(token));

        // Then
        assertFailed(result, ErrorKind.CANCELLED, "second");
        assertEquals(1, bodies[0]);
        assertEquals(0, bodies[1]);
        assertEquals(0, bodies[2]);
        assertRunWellFormed(result);
        ProgressAssertions.assertTerminals(result.report().events(), "first", ProgressKind.COMPLETE);
        ProgressAssertions.assertTerminals(result.report().events(), "second", ProgressKind.CANCELLED);
        assertTrue(result.report().eventsFor("third").isEmpty());
        assertTrue(result.report().eventsOf(ProgressKind.ERROR).isEmpty());
        assertEquals(SpanStatus.CANCELLED, result.report().rootSpan().status());
    }

    @Test
    void testCancellation_RequestedBeforeRun_NoStepBodyRuns() {
        // Given
        CancellationToken token = new CancellationToken();
        token.cancel("caller gave up");
        int[] bodies = new int[3];

        // When
        WorkflowResult<String> result = run(threeSteps(token, bodies), "x", RunOptions.defaults().withCancellation(token));

        // Then
        assertFailed(result, ErrorKind.CANCELLED, "first");
        assertEquals(0, bodies[0]);
        assertRunWellFormed(result);
        ProgressAssertions.assertTerminals(result.report().events(), "first", ProgressKind.CANCELLED);
    }
}
