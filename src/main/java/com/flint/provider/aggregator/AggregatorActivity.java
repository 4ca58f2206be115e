package com.flint.provider.aggregator;

import java.math.BigDecimal;
import java.time.LocalDate;

public record AggregatorActivity(
    String id,
    String type,
    String symbol,
    String description,
    BigDecimal units,
    BigDecimal price,
    BigDecimal amount,
    String currency,
    LocalDate tradeDate
) {}
