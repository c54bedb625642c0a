package com.al.shopsync.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for auto-generated API documentation.
 * Access Swagger UI at: /swagger-ui.html
 * Access OpenAPI JSON at: /v3/api-docs
 */
@Configuration
public class OpenApiConfig {

        @Value("${spring.application.name:shop-sync}")
        private String applicationName;

        @Bean
        public OpenAPI customOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title(applicationName + " API")
                                                .version("1.0.0")
                                                .description("""
                                                                Shopware 5 to Shopify migration API.

                                                                ## Features
                                                                - **Field mapping**: map source field paths to target field paths, with per-field transformations
                                                                - **Preview**: see the mapped record for one source record before syncing
                                                                - **Sync**: create, update or upsert selected records, or all records in cancellable background jobs
                                                                - **Import/Export**: move mapping sets between installations
                                                                """)
                                                .contact(new Contact()
                                                                .name("Shop Sync Team")
                                                                .email("support@example.com")))
                                .servers(List.of(
                                                new Server()
                                                                .url("http://localhost:8080")
                                                                .description("Local Development")))
                                .tags(List.of(
                                                new Tag().name("Mapping")
                                                                .description("Mapping storage, preview, validation and import/export"),
                                                new Tag().name("Sync")
                                                                .description("Selected and full synchronization, job status"),
                                                new Tag().name("Catalog")
                                                                .description("Source records, field catalogs and connection checks")));
        }
}
