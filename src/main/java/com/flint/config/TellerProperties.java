package com.flint.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "flint.providers.teller")
public record TellerProperties(String baseUrl, Duration connectTimeout, Duration readTimeout) {}
