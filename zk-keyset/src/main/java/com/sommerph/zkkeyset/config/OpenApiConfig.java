package com.sommerph.zkkeyset.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI zkKeySetOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("zk-SNARK Key Set API")
                        .version("1.0.0")
                        .description("API for looking up the proving and verifying keys that fit a transaction of a given size."));
    }

    @Bean
    public GroupedOpenApi keySetGroup() {
        return GroupedOpenApi.builder()
                .group("keysets")
                .pathsToMatch("/api/keysets/**")
                .build();
    }

}
