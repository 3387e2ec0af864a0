package com.geoinsight.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI geoInsightOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("GeoInsight Analysis API")
                        .description("Asynchronous location analysis: walkability, vegetation, "
                                + "investment returns and visually similar properties")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development Server")));
    }
}
