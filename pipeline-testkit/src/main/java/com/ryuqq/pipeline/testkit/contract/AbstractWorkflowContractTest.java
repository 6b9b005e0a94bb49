package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.adapter.inmemory.registry.InMemoryCapabilityRegistry;
import com.ryuqq.pipeline.adapter.inmemory.registry.InMemoryWorkflowCatalog;
import com.ryuqq.pipeline.adapter.runner.InlineWorkflowRunner;
import com.ryuqq.pipeline.core.engine.EngineConfig;
import com.ryuqq.pipeline.core.engine.RunOptions;
import com.ryuqq.pipeline.core.engine.WorkflowEngine;
import com.ryuqq.pipeline.core.error.ErrorKind;
import com.ryuqq.pipeline.core.outcome.Failed;
import com.ryuqq.pipeline.core.outcome.WorkflowFailure;
import com.ryuqq.pipeline.core.outcome.WorkflowResult;
import com.ryuqq.pipeline.core.progress.ProgressEvent;
import com.ryuqq.pipeline.core.workflow.Workflow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Abstract base class for workflow contract tests.
 *
 * <p>Provides a fresh engine, capability registry, workflow catalog and inline runner per test,
 * plus helpers that run a workflow and check the properties every run must satisfy.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>InMemoryCapabilityRegistry: Generators and Tools visible to steps</li>
 *   <li>InMemoryWorkflowCatalog: workflows addressable by id</li>
 *   <li>InlineWorkflowRunner: runs on the test thread with {@link EngineConfig#noDelay()}</li>
 *   <li>observedEvents: every event delivered to the run listener</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractWorkflowContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         capabilities.registerGenerator(ScriptedGenerator.named("evaluator").thenReturnObject(...));
 *         WorkflowResult&lt;FinalContent&gt; result = run(ContentReviewWorkflow.create(), request);
 *
 *         assertRunWellFormed(result);
 *     }
 * }
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public abstract class AbstractWorkflowContractTest {

    protected InMemoryCapabilityRegistry capabilities;
    protected InMemoryWorkflowCatalog catalog;
    protected WorkflowEngine engine;
    protected InlineWorkflowRunner runner;
    protected List<ProgressEvent> observedEvents;

    /**
     * Sets up test fixtures before each test.
     */
    @BeforeEach
    void setUpWorkflowFixtures() {
        capabilities = new InMemoryCapabilityRegistry();
        catalog = new InMemoryWorkflowCatalog();
        engine = new WorkflowEngine(engineConfig(), capabilities);
        runner = new InlineWorkflowRunner(catalog, engine);
        observedEvents = Collections.synchronizedList(new ArrayList<>());
    }

    /**
     * Clears all in-memory state to prevent test interference.
     */
    @AfterEach
    void tearDownWorkflowFixtures() {
        if (capabilities != null) {
            capabilities.clear();
        }
        if (catalog != null) {
            catalog.clear();
        }
    }

    /**
     * Engine configuration used by {@link #engine}. Subclasses may override.
     *
     * @return engine configuration
     */
    protected EngineConfig engineConfig() {
        return EngineConfig.noDelay();
    }

    /**
     * Registers the workflow (once) and runs it through the inline runner.
     *
     * @param workflow the workflow
     * @param input the raw input
     * @param <O> output type
     * @return the run result
     */
    protected <O> WorkflowResult<O> run(Workflow<?, O> workflow, Object input) {
        return run(workflow, input, RunOptions.defaults());
    }

    /**
     * Registers the workflow (once) and runs it with the given options.
     *
     * <p>The options' listener is replaced by one that records into {@link #observedEvents},
     * which is reset first. A different workflow already registered under the same id
     * is replaced.</p>
     *
     * @param workflow the workflow
     * @param input the raw input
     * @param options run options
     * @param <O> output type
     * @return the run result
     */
    protected <O> WorkflowResult<O> run(Workflow<?, O> workflow, Object input, RunOptions options) {
        if (catalog.find(workflow.id()).filter(registered -> registered == workflow).isEmpty()) {
            catalog.clear();
            catalog.register(workflow);
        }
        observedEvents.clear();
        return runner.run(workflow.id(), input, options.withListener(observedEvents::add));
    }

    /**
     * Asserts the progress grammar and span tree of a finished run, and that the
     * listener saw exactly the events recorded in the report.
     *
     * @param result the run result
     */
    protected void assertRunWellFormed(WorkflowResult<?> result) {
        ProgressAssertions.assertWellFormed(result.report().events());
        TraceAssertions.assertClosedTree(result.report().rootSpan());
        assertEquals(result.report().events(), observedEvents,
            "Listener events differ from the report's event log");
    }

    /**
     * Asserts the run failed with the given kind at the given step.
     *
     * @param result the run result
     * @param kind expected error kind
     * @param stepId expected failing step id
     * @return the failure for further assertions
     */
    protected WorkflowFailure assertFailed(WorkflowResult<?> result, ErrorKind kind, String stepId) {
        assertTrue(result.isFailed(), "Expected a failed run but it succeeded");
        WorkflowFailure failure = assertInstanceOf(Failed.class, result).failure();
        assertEquals(kind, failure.kind(),
            String.format("Expected %s but was %s (%s)", kind, failure.kind(), failure.message()));
        assertEquals(stepId, failure.stepId(), "Unexpected failing step");
        return failure;
    }
}
