package com.ryuqq.pipeline.adapter.inmemory.registry;

import com.ryuqq.pipeline.core.capability.Generator;
import com.ryuqq.pipeline.core.capability.Tool;
import com.ryuqq.pipeline.core.spi.CapabilityRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link CapabilityRegistry} SPI.
 *
 * <p>Generators and tools are kept in separate {@link ConcurrentHashMap}s keyed by id,
 * so a generator and a tool may share an id.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryCapabilityRegistry registry = new InMemoryCapabilityRegistry()
 *     .registerGenerator(evaluator)
 *     .registerTool(httpFetch);
 *
 * WorkflowEngine engine = new WorkflowEngine(new EngineConfig(), registry);
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class InMemoryCapabilityRegistry implements CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCapabilityRegistry.class);

    private final ConcurrentHashMap<String, Generator> generators;
    private final ConcurrentHashMap<String, Tool<?, ?>> tools;

    /**
     * Creates an empty registry.
     */
    public InMemoryCapabilityRegistry() {
        this.generators = new ConcurrentHashMap<>();
        this.tools = new ConcurrentHashMap<>();
    }

    /**
     * Registers a generator under its id.
     *
     * @param generator generator
     * @return this registry
     * @throws IllegalArgumentException if generator or its id is null or blank
     * @throws IllegalStateException if a generator with the same id is already registered
     */
    public InMemoryCapabilityRegistry registerGenerator(Generator generator) {
        if (generator == null) {
            throw new IllegalArgumentException("generator cannot be null");
        }
        String id = requireId(generator.id(), "generator id");
        if (generators.putIfAbsent(id, generator) != null) {
            throw new IllegalStateException("Generator already registered: " + id);
        }
        log.debug("Registered generator '{}'", id);
        return this;
    }

    /**
     * Registers a tool under its id.
     *
     * @param tool tool
     * @return this registry
     * @throws IllegalArgumentException if tool or its id is null or blank
     * @throws IllegalStateException if a tool with the same id is already registered
     */
    public InMemoryCapabilityRegistry registerTool(Tool<?, ?> tool) {
        if (tool == null) {
            throw new IllegalArgumentException("tool cannot be null");
        }
        String id = requireId(tool.id(), "tool id");
        if (tools.putIfAbsent(id, tool) != null) {
            throw new IllegalStateException("Tool already registered: " + id);
        }
        log.debug("Registered tool '{}'", id);
        return this;
    }

    /**
     * Removes a generator.
     *
     * @param id generator id
     * @return true if a generator was removed
     */
    public boolean removeGenerator(String id) {
        return id != null && generators.remove(id) != null;
    }

    /**
     * Removes a tool.
     *
     * @param id tool id
     * @return true if a tool was removed
     */
    public boolean removeTool(String id) {
        return id != null && tools.remove(id) != null;
    }

    @Override
    public Optional<Generator> generator(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(generators.get(id));
    }

    @Override
    public Optional<Tool<?, ?>> tool(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(tools.get(id));
    }

    public Set<String> generatorIds() {
        return Set.copyOf(generators.keySet());
    }

    public Set<String> toolIds() {
        return Set.copyOf(tools.keySet());
    }

    /**
     * Removes every generator and tool. Used for test cleanup.
     */
    public void clear() {
        generators.clear();
        tools.clear();
    }

    private static String requireId(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
        return id;
    }
}
