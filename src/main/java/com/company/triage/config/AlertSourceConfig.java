package com.company.triage.config;

import com.company.triage.source.AlertSource;
import com.company.triage.source.JsonAlertSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;

@Configuration
@Slf4j
public class AlertSourceConfig {

    /**
     * JSON batch at a classpath: or file: location
     */
    @Bean
    @ConditionalOnMissingBean(AlertSource.class)
    public AlertSource alertSource(
            @Value("${triage.source.location:classpath:sample_alerts.json}") String location,
            ResourceLoader resourceLoader,
            ObjectMapper objectMapper,
            Validator validator) {

        log.info("Alert source configured at {}", location);
        return new JsonAlertSource(resourceLoader.getResource(location), objectMapper, validator);
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }
}
