package com.sommerph.zkkeyset.config;

import com.sommerph.zkkeyset.codec.KeySetJsonModule;
import com.sommerph.zkkeyset.keyset.KeyOrder;
import com.sommerph.zkkeyset.repository.InMemoryKeySetRegistry;
import com.sommerph.zkkeyset.repository.KeySetRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class KeySetConfig {

    private final KeySetProperties properties;

    public KeySetConfig(KeySetProperties properties) {
        this.properties = properties;
    }

    @Bean
    public KeyOrder keyOrder() {
        KeyOrder order = KeyOrder.forName(properties.getOrder());
        log.info("Key sets are ordered by {}", order.getName());
        return order;
    }

    // Registered with the application ObjectMapper by Spring Boot
    @Bean
    public KeySetJsonModule keySetJsonModule(KeyOrder keyOrder) {
        return new KeySetJsonModule(keyOrder);
    }

    @Bean
    public KeySetRegistry keySetRegistry() {
        return switch (properties.getRegistry().getType().toLowerCase()) {
            case "memory" -> new InMemoryKeySetRegistry();
            default -> throw new IllegalArgumentException("Unsupported key set registry type: " + properties.getRegistry().getType());
        };
    }

}
