package com.baykanat.funnel.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/** OpenAPI / Swagger UI bean tanımı. */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI funnelAnalyticsOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Funnel Analytics API")
                        .description("""
                                Funnel and goal conversion analytics over the web-analytics event store. \
                                Computes in-order step completion per visitor, dropoffs, transition timings \
                                and first-touch referrer segmentation.\
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Burak Aykanat")
                                .email("burak.aykanat12@gmail.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
