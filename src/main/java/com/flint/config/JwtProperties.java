package com.flint.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "flint.jwt")
public record JwtProperties(String secret, String issuer, long ttlMinutes) {}
