package com.example.checkout.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI checkoutServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Checkout Service API")
                        .description("""
                                Checkout orchestration for the simulated e-commerce backend.

                                ## Flow

                                `price + shipping quote → currency conversion → payment → fraud check → shipment`

                                Confirmation e-mail, cart cleanup and the accounting event run in the background
                                and never delay the response.

                                ## Outcomes

                                | Status | HTTP |
                                |---|---|
                                | Completed / CompletedWithWarnings | 200 |
                                | PaymentFailed | 402 |
                                | Rejected | 409 |
                                | Rejected (deadline_exceeded) | 504 |
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Checkout Team")
                                .email("checkout-service@example.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local Development")
                ));
    }
}
