package fin.lending.intake.interceptor;

import fin.lending.intake.config.LoanIntakeProperties;
import fin.lending.intake.exception.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Shared-token authentication for API endpoints.
 * The token travels in the {@code x-access-token} header.
 */
@Component
@Slf4j
public class TokenAuthInterceptor implements HandlerInterceptor {

    public static final String TOKEN_HEADER = "x-access-token";

    @Autowired
    private LoanIntakeProperties properties;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (CorsUtils.isPreFlightRequest(request)) {
            return true;
        }

        String token = request.getHeader(TOKEN_HEADER);
        if (token == null || token.isEmpty()) {
            log.warn("Missing authentication token: remoteAddr={}, URI={}",
                    request.getRemoteAddr(), request.getRequestURI());
            throw new UnauthorizedException("Authentication token is required");
        }

        String expected = properties.getSecurity().getApiAccessToken();
        if (!MessageDigest.isEqual(
                token.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Invalid authentication token: remoteAddr={}, URI={}",
                    request.getRemoteAddr(), request.getRequestURI());
            throw new UnauthorizedException("Invalid authentication token");
        }

        return true;
    }
}
