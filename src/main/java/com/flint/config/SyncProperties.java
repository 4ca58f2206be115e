package com.flint.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "flint.sync")
public record SyncProperties(Duration staleAfter) {}
