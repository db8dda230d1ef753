package com.ospicorp.growthcurves.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("Growth Curves API")
            .version("v1")
            .description("LOESS smoothing, bootstrap uncertainty bands and log-phase detection "
                + "for microbial growth curves")
            .contact(new Contact().name("Growth Curves Team").email("curves-support@example.com"))
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")))
        .externalDocs(new ExternalDocumentation()
            .description("Developer Guide")
            .url("https://docs.growth-curves.dev"));
  }
}
