package com.flint.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "flint.crypto")
public record CryptoProperties(String secret) {}
