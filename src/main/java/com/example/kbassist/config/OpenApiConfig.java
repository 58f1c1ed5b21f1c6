package com.example.kbassist.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.License;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info = @Info(
        title = "KB Assist API",
        version = "v1",
        description = "Grounded question answering, document indexing and interaction history."
    ),
    servers = {
        @Server(url = "/", description = "Default server")
    }
)
public class OpenApiConfig {

  @Bean
  public OpenAPI baseOpenAPI() {
    return new OpenAPI()
        .info(new io.swagger.v3.oas.models.info.Info()
            .title("KB Assist API")
            .version("v1")
            .description("Answers are only returned when they can be traced back to indexed fragments.")
            .license(new License().name("Apache 2.0")));
  }

  @Bean
  public GroupedOpenApi queryApi() {
    return GroupedOpenApi.builder()
        .group("query")
        .pathsToMatch("/api/v1/query", "/api/v1/interactions/**", "/api/v1/health")
        .build();
  }

  @Bean
  public GroupedOpenApi indexingApi() {
    return GroupedOpenApi.builder()
        .group("indexing")
        .pathsToMatch("/api/v1/knowledge-bases/**")
        .build();
  }
}
