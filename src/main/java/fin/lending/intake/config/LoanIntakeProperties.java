package fin.lending.intake.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds the {@code loan-intake} section from application.yml.
 */
@Getter
@Setter
@Validated
@Component
@ConfigurationProperties(prefix = "loan-intake")
public class LoanIntakeProperties {

    @Valid
    private Security security = new Security();

    private Errors errors = new Errors();

    private Cors cors = new Cors();

    @Getter
    @Setter
    public static class Security {
        /** Shared secret expected in the x-access-token header. */
        @NotBlank
        private String apiAccessToken;

        /** Paths served without a token. */
        private List<String> publicPaths = new ArrayList<>(List.of("/health", "/api/health"));
    }

    @Getter
    @Setter
    public static class Errors {
        /** Return messages of unexpected failures to clients; off outside development. */
        private boolean exposeDetails = false;
    }

    @Getter
    @Setter
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
