package fin.lending.intake.config;

import fin.lending.intake.interceptor.RequestLoggingInterceptor;
import fin.lending.intake.interceptor.TokenAuthInterceptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: interceptors and CORS
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    @Autowired
    private RequestLoggingInterceptor requestLoggingInterceptor;

    @Autowired
    private TokenAuthInterceptor tokenAuthInterceptor;

    @Autowired
    private LoanIntakeProperties properties;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        // logging first so rejected requests are logged too
        registry.addInterceptor(requestLoggingInterceptor)
                .addPathPatterns("/**");

        registry.addInterceptor(tokenAuthInterceptor)
                .addPathPatterns("/api/**")
                .excludePathPatterns(properties.getSecurity().getPublicPaths().toArray(new String[0]))
                .excludePathPatterns(
                    "/api-docs/**",
                    "/swagger-ui/**",
                    "/swagger-ui.html"
                );
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns(properties.getCors().getAllowedOrigins().toArray(new String[0]))
                .allowedMethods("GET", "POST", "PATCH", "DELETE", "OPTIONS", "HEAD")
                .allowedHeaders("*")
                .exposedHeaders("Content-Type", RequestLoggingInterceptor.REQUEST_ID_HEADER)
                .maxAge(1800L);
    }
}
