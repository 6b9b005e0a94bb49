package com.ryuqq.pipeline.adapter.inmemory.registry;

import com.ryuqq.pipeline.core.schema.Schemas;
import com.ryuqq.pipeline.core.step.Steps;
import com.ryuqq.pipeline.core.workflow.Workflow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryWorkflowCatalog tests.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class InMemoryWorkflowCatalogTest {

    @Test
    @DisplayName("registered workflows are found by id")
    void findsRegisteredWorkflow() {
        // given
        InMemoryWorkflowCatalog catalog = new InMemoryWorkflowCatalog();
        Workflow<String, String> workflow = echo("echo");

        // when
        catalog.register(workflow);

        // then
        assertThat(catalog.find("echo")).containsSame(workflow);
        assertThat(catalog.find("other")).isEmpty();
        assertThat(catalog.find(null)).isEmpty();
        assertThat(catalog.ids()).containsExactly("echo");
    }

    @Test
    @DisplayName("a second workflow with the same id is rejected")
    void rejectsDuplicateId() {
        // given
        InMemoryWorkflowCatalog catalog = new InMemoryWorkflowCatalog();
        catalog.register(echo("echo"));

        // when & then
        assertThatThrownBy(() -> catalog.register(echo("echo")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Workflow already registered: echo");
        assertThatThrownBy(() -> catalog.register(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("clear removes every workflow")
    void clearRemovesAll() {
        InMemoryWorkflowCatalog catalog = new InMemoryWorkflowCatalog();
        catalog.register(echo("a"));
        catalog.register(echo("b"));

        catalog.clear();

        assertThat(catalog.ids()).isEmpty();
    }

    private static Workflow<String, String> echo(String id) {
        return Workflow.builder(id, Schemas.string("text"))
            .then(Steps.define("echo")
                .input(Schemas.string("text"))
                .output(Schemas.string("text"))
                .handle((text, ctx) -> text))
            .commit(Schemas.string("text"));
    }
}
