package com.company.triage.config;

import com.company.triage.service.AlertProcessor;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Batch-level gauges
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final AlertProcessor alertProcessor;

    @Bean
    public MeterBinder triageMetrics(MeterRegistry registry) {
        return (reg) -> {
            Gauge.builder("triage.alerts.loaded", alertProcessor, processor -> processor.getAlerts().size())
                    .description("Number of valid alerts in the current batch")
                    .register(reg);

            Gauge.builder("triage.alerts.rejected", alertProcessor, AlertProcessor::getRejectedCount)
                    .description("Number of entries rejected while loading the current batch")
                    .register(reg);

            log.info("Triage metrics registered");
        };
    }
}
