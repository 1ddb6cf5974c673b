package com.sommerph.zkkeyset.config;

import com.sommerph.zkkeyset.keyset.OrderByOutputs;
import com.sommerph.zkkeyset.repository.InMemoryKeySetRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeySetConfigTest {

    @Test
    void defaultsToInputOrderAndMemoryRegistry() {
        KeySetConfig config = new KeySetConfig(new KeySetProperties());

        assertThat(config.keyOrder().getName()).isEqualTo("inputs");
        assertThat(config.keySetRegistry()).isInstanceOf(InMemoryKeySetRegistry.class);
    }

    @Test
    void honoursConfiguredOrder() {
        KeySetProperties properties = new KeySetProperties();
        properties.setOrder("outputs");

        assertThat(new KeySetConfig(properties).keyOrder()).isSameAs(OrderByOutputs.INSTANCE);
    }

    @Test
    void rejectsUnknownRegistryType() {
        KeySetProperties properties = new KeySetProperties();
        properties.getRegistry().setType("json");

        assertThatThrownBy(() -> new KeySetConfig(properties).keySetRegistry())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("json");
    }

}
