package com.flint.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "flint.providers.snaptrade")
public record SnapTradeProperties(
    String baseUrl,
    String clientId,
    String consumerKey,
    String redirectUrl,
    Duration connectTimeout,
    Duration readTimeout
) {}
