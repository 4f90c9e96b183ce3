package com.example.emailscheduler.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "external-services.processing-pipeline")
public class ProcessingPipelineProperties {
    @NotBlank
    private String baseUrl;
    private int timeoutSeconds = 300;
}
