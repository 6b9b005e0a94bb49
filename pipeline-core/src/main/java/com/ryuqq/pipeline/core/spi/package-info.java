/**
 * Service Provider Interfaces implemented by adapters.
 *
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.spi.CapabilityRegistry} - generator and tool lookup</li>
 *   <li>{@link com.ryuqq.pipeline.core.spi.WorkflowCatalog} - workflow registry</li>
 *   <li>{@link com.ryuqq.pipeline.core.spi.ProgressSink} - progress event consumer</li>
 *   <li>{@link com.ryuqq.pipeline.core.spi.ProgressChannel} - bounded progress side channel</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.core.spi;
