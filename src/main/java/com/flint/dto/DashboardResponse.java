package com.flint.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flint.model.SubscriptionTier;
import java.math.BigDecimal;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class DashboardResponse {
  private BigDecimal totalBalance;
  private BigDecimal bankBalance;
  private BigDecimal investmentBalance;
  private BigDecimal cryptoValue;
  private BigDecimal totalAssets;
  private BigDecimal creditDebt;
  private List<DashboardAccount> accounts;
  private SubscriptionTier subscriptionTier;
  @JsonProperty("isAdmin")
  private boolean admin;
  private boolean needsConnection;
  private ConnectionStatus connectionStatus;

  public static DashboardResponse empty(SubscriptionTier tier, boolean admin, String message) {
    return new DashboardResponse(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
        BigDecimal.ZERO, BigDecimal.ZERO, List.of(), tier, admin, true,
        new ConnectionStatus(false, null, null, message));
  }

  @Getter
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class ConnectionStatus {
    private boolean hasAccounts;
    private String snapTradeError;
    private String bankError;
    private String message;
  }
}
