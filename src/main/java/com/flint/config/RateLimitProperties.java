package com.flint.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "flint.rate-limit")
public record RateLimitProperties(int registerLimit, Duration registerWindow) {}
