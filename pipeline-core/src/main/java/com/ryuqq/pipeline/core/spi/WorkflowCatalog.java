package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.workflow.Workflow;

import java.util.Optional;
import java.util.Set;

/**
 * Registry SPI for committed workflows.
 *
 * <p>Runners resolve a workflow id to its definition through the catalog.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: registration and lookup may happen from different threads</li>
 *   <li>Workflow ids are unique: registering a second workflow under the same id must fail</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public interface WorkflowCatalog {

    /**
     * Registers a committed workflow.
     *
     * @param workflow workflow definition
     * @throws IllegalArgumentException if workflow is null
     * @throws IllegalStateException if a workflow with the same id is already registered
     */
    void register(Workflow<?, ?> workflow);

    /**
     * Finds a workflow by id.
     *
     * @param workflowId workflow id
     * @return workflow, or empty when unknown
     */
    Optional<Workflow<?, ?>> find(String workflowId);

    /**
     * Returns the registered workflow ids.
     *
     * @return immutable set of ids
     */
    Set<String> ids();
}
