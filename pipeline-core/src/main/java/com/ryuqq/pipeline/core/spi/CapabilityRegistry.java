package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.capability.Generator;
import com.ryuqq.pipeline.core.capability.Tool;

import java.util.Optional;

/**
 * Lookup SPI for external collaborators.
 *
 * <p>Steps reach generators and tools only through this registry. Whether a collaborator
 * is present is a deployment concern, so every lookup returns {@link Optional} and steps
 * decide between a degraded default and
 * {@link com.ryuqq.pipeline.core.error.CollaboratorUnavailableException}.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: lookups happen concurrently from independent runs</li>
 *   <li>Lookups must not block</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public interface CapabilityRegistry {

    /**
     * Registry with no collaborators.
     */
    CapabilityRegistry EMPTY = new CapabilityRegistry() {
        @Override
        public Optional<Generator> generator(String id) {
            return Optional.empty();
        }

        @Override
        public Optional<Tool<?, ?>> tool(String id) {
            return Optional.empty();
        }
    };

    /**
     * Finds a generator by id.
     *
     * @param id generator id
     * @return generator, or empty when not registered
     */
    Optional<Generator> generator(String id);

    /**
     * Finds a tool by id.
     *
     * @param id tool id
     * @return tool, or empty when not registered
     */
    Optional<Tool<?, ?>> tool(String id);
}
