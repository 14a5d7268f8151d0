package com.ospicorp.anomalyapi.config;

import io.swagger.v3.oas.models.OpenAPI;
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
            .title("Anomaly Detection API")
            .version("v1")
            .description("Fits per-series detection models and classifies new values against "
                + "the latest stored version")
            .license(new License().name("MIT")))
        .servers(List.of(new Server().url("/")));
  }
}
