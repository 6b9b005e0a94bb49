/**
 * In-memory registry adapter package.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.adapter.inmemory.registry.InMemoryCapabilityRegistry}:
 *       generators and tools reachable from step bodies</li>
 *   <li>{@link com.ryuqq.pipeline.adapter.inmemory.registry.InMemoryWorkflowCatalog}:
 *       committed workflows by id</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Registrations are lost on process restart</li>
 *   <li>No hot reload or versioning of workflows</li>
 * </ul>
 *
 * @see com.ryuqq.pipeline.core.spi.CapabilityRegistry
 * @see com.ryuqq.pipeline.core.spi.WorkflowCatalog
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.adapter.inmemory.registry;
