package hvlc.billing.ingest.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI billingIngestOpenAPI(@Value("${server.port:8080}") int port) {
        Server localServer = new Server();
        localServer.setUrl("http://localhost:" + port);
        localServer.setDescription("Local Development Server");

        Contact contact = new Contact();
        contact.setName("Billing Data Team");

        Info info = new Info()
                .title("Billing Report Ingest API")
                .version("1.0.0")
                .description("Detects the layout of payer billing reports and normalizes them into canonical transactions")
                .contact(contact);

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer));
    }
}
