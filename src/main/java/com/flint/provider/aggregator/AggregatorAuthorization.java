package com.flint.provider.aggregator;

public record AggregatorAuthorization(String id, String brokerageName, boolean disabled) {}
