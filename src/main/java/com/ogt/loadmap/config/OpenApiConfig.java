package com.ogt.loadmap.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI loadmapOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Loadmap Service API")
                        .description("Desagregación espacial de la demanda eléctrica: corridas del pipeline y resultados por subregión.")
                        .version("1.0"));
    }
}
