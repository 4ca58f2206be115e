package com.flint.provider.aggregator;

import java.math.BigDecimal;

public record AggregatorAccount(
    String id,
    String authorizationId,
    String name,
    String number,
    String institutionName,
    String accountType,
    String currency,
    BigDecimal totalValue,
    BigDecimal cash,
    BigDecimal buyingPower
) {}
