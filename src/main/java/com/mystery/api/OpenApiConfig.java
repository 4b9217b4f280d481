package com.mystery.api;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Swagger/OpenAPI description
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Mansion Mystery API")
                .version("1.0.0")
                .description("""
                    API for the mansion murder mystery: interrogate five suspects and name the killer.

                    ## Features:
                    - Start a game on a freshly drawn case or the stored sample case
                    - Question suspects whose willingness to talk follows their Trust
                    - Facts sheet, investigation log and contradiction analysis
                    - Gossip that spreads between suspects after every answer
                    - Accusation with the full solution
                    """)
                .contact(new Contact()
                    .name("Mansion Mystery")
                    .email("support@mansion-mystery.local"))
                .license(new License()
                    .name("MIT")
                    .url("https://opensource.org/licenses/MIT")))
            .servers(List.of(
                new Server()
                    .url("http://localhost:8080")
                    .description("Local server")
            ));
    }
}
