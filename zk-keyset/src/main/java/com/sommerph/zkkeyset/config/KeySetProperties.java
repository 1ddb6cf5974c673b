package com.sommerph.zkkeyset.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "keyset")
public class KeySetProperties {

    // "inputs" or "outputs": the primary axis key sets are ordered by
    private String order = "inputs";
    private Registry registry = new Registry();

    @Data
    public static class Registry {
        private String type = "memory";
    }

}
