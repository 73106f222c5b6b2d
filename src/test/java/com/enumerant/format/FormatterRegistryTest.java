package com.enumerant.format;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FormatterRegistryTest {

    @Test
    void testIdsAreSequentialFromBase() {
        var registry = new FormatterRegistry<String>("test", 500, 4);

        assertThat(registry.lookup(500)).isNull();
        var first = registry.register("a");
        var second = registry.register("b");

        assertThat(first.getId()).isEqualTo(500);
        assertThat(second.getId()).isEqualTo(501);
        assertThat(registry.lookup(501)).isEqualTo("b");
        assertThat(registry.owns(502)).isFalse();
        assertThat(registry.lookup(499)).isNull();
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void testFullRegistryRejectsRegistration() {
        var registry = new FormatterRegistry<String>("tiny", 100, 2);
        registry.register("a");
        registry.register("b");

        assertThatThrownBy(() -> registry.register("c"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("tiny");
        assertThat(registry.owns(102)).isFalse();
        assertThat(registry.lookup(101)).isEqualTo("b");
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void testInvalidConstruction() {
        assertThatThrownBy(() -> new FormatterRegistry<String>("low", 3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registryWithNullFormatter())
                .isInstanceOf(NullPointerException.class);
    }

    private static void registryWithNullFormatter() {
        new FormatterRegistry<String>("nulls", 100).register(null);
    }
}
