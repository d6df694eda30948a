package com.parsely.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI parselyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Parsely Extraction API")
                        .description("Extracts parties, amounts and banking details from invoice text.")
                        .version("v1")
                        .contact(new Contact()
                                .name("Parsely")
                                .email("support@parsely.dev"))
                        .license(new License().name("Proprietary")));
    }
}
