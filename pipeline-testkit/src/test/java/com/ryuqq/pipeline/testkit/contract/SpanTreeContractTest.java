package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.core.composition.Branch;
import com.ryuqq.pipeline.core.error.ErrorKind;
import com.ryuqq.pipeline.core.outcome.WorkflowResult;
import com.ryuqq.pipeline.core.schema.Schemas;
import com.ryuqq.pipeline.core.step.Step;
import com.ryuqq.pipeline.core.step.Steps;
import com.ryuqq.pipeline.core.tracing.Span;
import com.ryuqq.pipeline.core.tracing.SpanStatus;
import com.ryuqq.pipeline.core.workflow.Workflow;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Contract Test: span trees are closed and well nested on success and on failure.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Success through a branch and a tool call: every span OK</li>
 *   <li>Tool failure inside a branch: failing spans ERROR, tree still closed</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class SpanTreeContractTest extends AbstractWorkflowContractTest {

    private static Workflow<String, String> lookupWorkflow() {
        Step<String, String> lookup = Steps.define("lookup")
            .input(Schemas.string("key"))
            .output(Schemas.string("value"))
            .handle((key, ctx) -> ctx.invokeTool("dictionary", key, String.class));
        Step<String, String> echo = Steps.define("echo")
            .input(Schemas.string("key"))
            .output(Schemas.string("value"))
            .handle((key, ctx) -> key);

        return Workflow.builder("lookup-flow", Schemas.string("key"))
            .then(Steps.define("normalize")
                .input(Schemas.string("key"))
                .output(Schemas.string("key"))
                .handle((key, ctx) -> key.trim().toLowerCase()))
            .branch(Branch.<String, String>named("route")
                .when("word", key -> key.chars().allMatch(Character::isLetter), lookup)
                .otherwise(echo))
            .commit(Schemas.string("value"));
    }

    @Test
    void testSpanTree_Success_AllSpansClosedOk() {
        // Given
        capabilities.registerTool(new ScriptedTool<>("dictionary", Schemas.string("key"), Schemas.string("value"),
            (key, ctx) -> key.toUpperCase()));

        // When
        WorkflowResult<String> result = run(lookupWorkflow(), "  Hello ");

        // Then
        assertEquals("HELLO", result.valueOrThrow());
        assertRunWellFormed(result);
        Span root = result.report().rootSpan();
        TraceAssertions.assertChildren(root, "normalize", "branch:route");
        TraceAssertions.assertStatus(root, "workflow:lookup-flow", SpanStatus.OK);
        TraceAssertions.assertStatus(root, "tool:dictionary", SpanStatus.OK);
        Span branch = root.find("branch:route").orElseThrow();
        assertEquals("word", branch.attribute("branch.selected"));
        assertEquals("lookup", branch.children().get(0).name());
        assertTrue(root.flatten().stream().allMatch(span -> span.status() == SpanStatus.OK));
    }

    @Test
    void testSpanTree_ToolFailure_FailingPathMarkedErrorAndTreeClosed() {
        // Given: a dictionary that is down
        capabilities.registerTool(new ScriptedTool<String, String>("dictionary", Schemas.string("key"),
            Schemas.string("value"), (key, ctx) -> {
                throw new IllegalStateException("dictionary offline");
            }));

        // When
        WorkflowResult<String> result = run(lookupWorkflow(), "word");

        // Then
        assertFailed(result, ErrorKind.TRANSIENT_EXECUTION_FAILURE, "lookup");
        assertRunWellFormed(result);
        Span root = result.report().rootSpan();
        TraceAssertions.assertStatus(root, "normalize", SpanStatus.OK);
        TraceAssertions.assertStatus(root, "tool:dictionary", SpanStatus.ERROR);
        TraceAssertions.assertStatus(root, "lookup", SpanStatus.ERROR);
        TraceAssertions.assertStatus(root, "branch:route", SpanStatus.ERROR);
        assertEquals(SpanStatus.ERROR, root.status());
        assertTrue(root.find("lookup").orElseThrow().exception().isPresent());
    }

    @Test
    void testSpanTree_InputViolation_RootClosedWithError() {
        // When
        WorkflowResult<String> result = run(lookupWorkflow(), 42);

        // Then
        assertFailed(result, ErrorKind.CONTRACT_VIOLATION, "lookup-flow");
        TraceAssertions.assertClosedTree(result.report().rootSpan());
        assertTrue(result.report().events().isEmpty());
    }
}
