package fin.lending.intake.interceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.UUID;

/**
 * Tags each request with a request id (MDC key {@code requestId}) and logs its outcome
 */
@Component
@Slf4j
public class RequestLoggingInterceptor implements HandlerInterceptor {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String MDC_REQUEST_ID = "requestId";

    private static final String START_ATTRIBUTE = RequestLoggingInterceptor.class.getName() + ".start";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        MDC.put(MDC_REQUEST_ID, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        request.setAttribute(START_ATTRIBUTE, System.nanoTime());

        log.debug("Request started: method={}, URI={}", request.getMethod(), request.getRequestURI());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        try {
            Object start = request.getAttribute(START_ATTRIBUTE);
            long durationMs = start instanceof Long ? (System.nanoTime() - (Long) start) / 1_000_000 : -1;
            int status = response.getStatus();

            if (status >= 500) {
                log.error("Request completed: method={}, URI={}, status={}, durationMs={}",
                        request.getMethod(), request.getRequestURI(), status, durationMs);
            } else if (status >= 400) {
                log.warn("Request completed: method={}, URI={}, status={}, durationMs={}",
                        request.getMethod(), request.getRequestURI(), status, durationMs);
            } else {
                log.info("Request completed: method={}, URI={}, status={}, durationMs={}",
                        request.getMethod(), request.getRequestURI(), status, durationMs);
            }
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }
}
