package com.asoaudit.combos.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("ASO Combo Engine API")
                        .version("0.1.0")
                        .description("Keyword combination coverage, tier classification and priority scoring for App Store metadata."));
    }
}
