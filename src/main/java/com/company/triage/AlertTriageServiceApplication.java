package com.company.triage;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@OpenAPIDefinition(
        info = @Info(
                title = "Alert Triage Service API",
                version = "1.0.0",
                description = "Filtering, grouping and priority scoring of monitoring alert batches"
        )
)
public class AlertTriageServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertTriageServiceApplication.class, args);
    }
}
