package com.flint.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Locale;

public enum BillingFrequency {
  MONTHLY(28, 32, 0.7, 0.9),
  WEEKLY(6, 8, 0.7, 0.9),
  QUARTERLY(88, 95, 0.5, 0.8),
  YEARLY(360, 370, 0.0, 0.7);

  private static final BigDecimal WEEKS_PER_MONTH = new BigDecimal("4.33");

  private final long minDays;
  private final long maxDays;
  private final double requiredShare;
  private final double maxConfidence;

  BillingFrequency(long minDays, long maxDays, double requiredShare, double maxConfidence) {
    this.minDays = minDays;
    this.maxDays = maxDays;
    this.requiredShare = requiredShare;
    this.maxConfidence = maxConfidence;
  }

  public boolean matches(long days) {
    return days >= minDays && days <= maxDays;
  }

  public double requiredShare() {
    return requiredShare;
  }

  public double maxConfidence() {
    return maxConfidence;
  }

  public LocalDate advance(LocalDate from, long periods) {
    return switch (this) {
      case WEEKLY -> from.plusWeeks(periods);
      case MONTHLY -> from.plusMonths(periods);
      case QUARTERLY -> from.plusMonths(3 * periods);
      case YEARLY -> from.plusYears(periods);
    };
  }

  public BigDecimal monthlyEquivalent(BigDecimal amount) {
    return switch (this) {
      case WEEKLY -> amount.multiply(WEEKS_PER_MONTH).setScale(2, RoundingMode.HALF_UP);
      case MONTHLY -> amount.setScale(2, RoundingMode.HALF_UP);
      case QUARTERLY -> amount.divide(BigDecimal.valueOf(3), 2, RoundingMode.HALF_UP);
      case YEARLY -> amount.divide(BigDecimal.valueOf(12), 2, RoundingMode.HALF_UP);
    };
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
