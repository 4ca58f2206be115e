package com.flint.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flint.model.AccountProvider;
import com.flint.model.AccountType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DashboardAccount {
  private String id;
  private AccountProvider provider;
  private AccountType accountType;
  private String displayName;
  private String institutionName;
  private String lastFour;
  private BigDecimal balance;
  private BigDecimal amountOwed;
  private BigDecimal availableCredit;
  private BigDecimal cash;
  private BigDecimal holdingsValue;
  private BigDecimal buyingPower;
  private String currency;
  private BigDecimal percentOfTotal;
  private boolean needsReconnection;
  private Instant lastSyncedAt;
}
