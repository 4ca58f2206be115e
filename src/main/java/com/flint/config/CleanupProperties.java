package com.flint.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "flint.cleanup")
public record CleanupProperties(
    boolean enabled,
    String cron,
    Duration minIdentityAge,
    Duration staleReportAfter
) {}
