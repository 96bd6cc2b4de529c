package fin.lending.intake.config;

import fin.lending.intake.config.typehandler.UuidTypeHandler;
import org.mybatis.spring.annotation.MapperScan;
import org.mybatis.spring.boot.autoconfigure.ConfigurationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;

/**
 * MyBatis configuration class
 * Configures mapper scanning and custom type handlers
 */
@Configuration
@MapperScan("fin.lending.intake.mapper")
public class MyBatisConfig {

    /**
     * Register UUID handling and snake_case column mapping
     */
    @Bean
    public ConfigurationCustomizer loanIntakeMyBatisCustomizer() {
        return configuration -> {
            configuration.setMapUnderscoreToCamelCase(true);
            configuration.getTypeHandlerRegistry().register(UUID.class, UuidTypeHandler.class);
        };
    }
}
