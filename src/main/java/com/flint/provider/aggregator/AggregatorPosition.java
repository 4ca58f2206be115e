package com.flint.provider.aggregator;

import java.math.BigDecimal;

public record AggregatorPosition(
    String symbol,
    String description,
    BigDecimal quantity,
    BigDecimal averageCost,
    BigDecimal currentPrice,
    String currency
) {}
