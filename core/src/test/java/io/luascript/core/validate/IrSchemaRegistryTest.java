package io.luascript.core.validate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.luascript.core.ir.IrDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("IrSchemaRegistry")
class IrSchemaRegistryTest {

    private final IrSchemaRegistry registry = new IrSchemaRegistry();

    @Test
    @DisplayName("the current schema version is archived and latest")
    void currentIsLatest() {
        assertThat(registry.isKnown(IrDocument.CURRENT_SCHEMA_VERSION)).isTrue();
        assertThat(IrSchemaRegistry.latest()).isEqualTo(IrDocument.CURRENT_SCHEMA_VERSION);
        assertThat(IrSchemaRegistry.major(IrSchemaRegistry.latest())).isEqualTo(IrSchemaRegistry.CURRENT_MAJOR);
    }

    @Test
    @DisplayName("archived schemas load from the classpath and compile once")
    void loads() {
        assertThat(registry.schemaDocument("1.0.0").path("type").asText()).isEqualTo("object");
        assertThat(registry.schema("1.0.0")).isPresent();
        assertThat(registry.schema("1.0.0").orElseThrow()).isSameAs(registry.schema("1.0.0").orElseThrow());
    }

    @Test
    @DisplayName("unknown versions are not resolved")
    void unknown() {
        assertThat(registry.isKnown("2.0.0")).isFalse();
        assertThat(registry.isKnown(null)).isFalse();
        assertThat(registry.schema("0.9.0")).isEmpty();
        assertThatThrownBy(() -> registry.schemaDocument("2.0.0"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("2.0.0");
    }
}
