package com.library.lending.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI libraryOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Library Lending API")
                .description("REST API for a library catalog, its members and their borrowings, "
                    + "with copy counters kept consistent under concurrent checkouts and returns.")
                .version("1.0.0"));
    }
}
