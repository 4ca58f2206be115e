package com.flint.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "holdings")
@Getter
@Setter
public class Holding {
  @Id
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "account_id", nullable = false)
  private String accountId;

  @Column(name = "provider_authorization_id")
  private String providerAuthorizationId;

  @Column(nullable = false)
  private String symbol;

  @Column
  private String name;

  @Column(nullable = false, precision = 24, scale = 8)
  private BigDecimal quantity;

  @Column(precision = 19, scale = 6)
  private BigDecimal averageCost;

  @Column(nullable = false, precision = 19, scale = 6)
  private BigDecimal currentPrice;

  @Column(nullable = false)
  private String currency = "USD";

  @Column(nullable = false)
  private Instant asOf;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
  }

  public BigDecimal getCurrentValue() {
    return quantity.multiply(currentPrice).setScale(2, RoundingMode.HALF_UP);
  }

  public BigDecimal getProfitLoss() {
    if (averageCost == null) {
      return BigDecimal.ZERO.setScale(2);
    }
    return currentPrice.subtract(averageCost).multiply(quantity).setScale(2, RoundingMode.HALF_UP);
  }
}
