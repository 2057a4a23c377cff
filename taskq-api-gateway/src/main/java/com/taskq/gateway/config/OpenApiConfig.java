package com.taskq.gateway.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI taskqOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("taskq Queue API")
                        .description("Enqueue tasks onto named priority queues, poll task status "
                                + "and read per-queue statistics.")
                        .version("1.0.0")
                        .contact(new Contact().name("taskq maintainers")));
    }
}
