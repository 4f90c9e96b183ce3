package com.example.emailscheduler.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Mail gateway connection properties
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "external-services.mail-gateway")
public class MailGatewayProperties {
    @NotBlank
    private String baseUrl;
    private int timeoutSeconds = 60;
}
