package com.company.triage.report;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Logs the triage report once the batch is loaded
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "triage.report.on-startup",
        havingValue = "true",
        matchIfMissing = false
)
public class StartupReportRunner implements ApplicationRunner {

    private final TriageReportRenderer renderer;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Triage report:{}{}", System.lineSeparator(), renderer.renderOverview());
    }
}
