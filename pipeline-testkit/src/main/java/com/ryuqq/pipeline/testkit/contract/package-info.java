/**
 * Test fixtures for workflow contract tests.
 *
 * <p>Scripted collaborator doubles ({@link com.ryuqq.pipeline.testkit.contract.ScriptedGenerator},
 * {@link com.ryuqq.pipeline.testkit.contract.ScriptedTool}), assertions over progress logs and
 * span trees, and {@link com.ryuqq.pipeline.testkit.contract.AbstractWorkflowContractTest},
 * the base class the contract tests extend.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.testkit.contract;
