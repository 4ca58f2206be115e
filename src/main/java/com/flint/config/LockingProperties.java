package com.flint.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "flint.locking")
public record LockingProperties(String mode) {}
