package fin.lending.intake.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Swagger/OpenAPI Configuration
 * Configures API documentation for the Loan Intake Service
 */
@Configuration
public class SwaggerConfig {

    private static final String TOKEN_SCHEME = "accessToken";

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(apiInfo())
                .servers(apiServers())
                .components(new Components().addSecuritySchemes(TOKEN_SCHEME, new SecurityScheme()
                        .type(SecurityScheme.Type.APIKEY)
                        .in(SecurityScheme.In.HEADER)
                        .name("x-access-token")))
                .addSecurityItem(new SecurityRequirement().addList(TOKEN_SCHEME));
    }

    /**
     * API information
     */
    private Info apiInfo() {
        return new Info()
                .title("Loan Intake Service API")
                .description("REST APIs for customer registration and loan application intake. " +
                             "Monthly payments are computed with fixed-rate amortization.")
                .version("1.0.0")
                .contact(new Contact()
                        .name("Lending Platform Team")
                        .email("support@example.com"));
    }

    private List<Server> apiServers() {
        Server localServer = new Server()
                .url("http://localhost:" + serverPort)
                .description("Local Development Server");

        return List.of(localServer);
    }
}
