package com.demo.lending.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI lendingOpenAPI() {
        return new OpenAPI().info(new Info()
                .title("Pooled Lending API")
                .description("Tokens, assets, pooled loans, default ballots and the liquidation monitor")
                .version("v1"));
    }
}
