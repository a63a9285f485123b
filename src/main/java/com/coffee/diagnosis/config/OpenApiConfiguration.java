package com.coffee.diagnosis.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfiguration {

    @Bean
    public OpenAPI coffeeDiagnosisOpenApi() {
        return new OpenAPI().info(new Info()
                .title("Coffee Leaf Diagnosis API")
                .version("v1")
                .description("Predicts coffee leaf diseases from photographs, optionally fused with reported symptoms"));
    }
}
