package com.flint.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "flint.dashboard")
public record DashboardProperties(Duration sideTimeout, int executorThreads) {}
