package com.riskgate.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI riskOrchestratorOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Risk Orchestrator API")
                        .description("Risk gate and multi-agent consensus in front of the exchange")
                        .version("1.0"));
    }
}
