package com.siteledger.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI siteLedgerOpenAPI() {
        Server localServer = new Server();
        localServer.setUrl("http://localhost:8080/api");
        localServer.setDescription("Local Development Server");

        Contact contact = new Contact();
        contact.setName("Site Ledger Team");
        contact.setEmail("ledger@siteledger.local");

        Info info = new Info()
                .title("Site Ledger API")
                .version("1.0.0")
                .description("Append-only supplier and inventory ledgers with derived payment and stock status")
                .contact(contact);

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer));
    }
}
