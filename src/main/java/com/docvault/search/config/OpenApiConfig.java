package com.docvault.search.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Document Search API")
                        .version("0.1.0")
                        .description("Spring Boot WebFlux API for creating, reading, updating, deleting and searching article and user documents stored in Elasticsearch."))
                .tags(List.of(
                        new Tag().name("documents").description("Article and user documents"),
                        new Tag().name("health").description("Backend connectivity")));
    }
}
