package com.ryuqq.pipeline.adapter.inmemory.registry;

import com.ryuqq.pipeline.core.spi.WorkflowCatalog;
import com.ryuqq.pipeline.core.workflow.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link WorkflowCatalog} SPI.
 *
 * <p>Workflows are immutable once committed, so the catalog shares the registered
 * instances across concurrent runs.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class InMemoryWorkflowCatalog implements WorkflowCatalog {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkflowCatalog.class);

    private final ConcurrentHashMap<String, Workflow<?, ?>> workflows;

    /**
     * Creates an empty catalog.
     */
    public InMemoryWorkflowCatalog() {
        this.workflows = new ConcurrentHashMap<>();
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Atomic: uses {@link ConcurrentHashMap#putIfAbsent}</li>
     *   <li>Re-registering the same instance is also rejected</li>
     * </ul>
     */
    @Override
    public void register(Workflow<?, ?> workflow) {
        if (workflow == null) {
            throw new IllegalArgumentException("workflow cannot be null");
        }
        if (workflows.putIfAbsent(workflow.id(), workflow) != null) {
            throw new IllegalStateException("Workflow already registered: " + workflow.id());
        }
        log.debug("Registered workflow '{}' with steps {}", workflow.id(), workflow.stepIds());
    }

    @Override
    public Optional<Workflow<?, ?>> find(String workflowId) {
        return workflowId == null ? Optional.empty() : Optional.ofNullable(workflows.get(workflowId));
    }

    @Override
    public Set<String> ids() {
        return Set.copyOf(workflows.keySet());
    }

    /**
     * Removes every workflow. Used for test cleanup.
     */
    public void clear() {
        workflows.clear();
    }
}
