package com.example.indexanalytics.config;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(AnalyticsProperties.class)
public class AnalyticsConfig {

    /**
     * Reports are written with snake_case field names so consumers see a stable layout.
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer reportJsonCustomizer() {
        log.info("🔧 Configuring snake_case JSON for composite reports");
        return builder -> builder
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .featuresToDisable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }
}
