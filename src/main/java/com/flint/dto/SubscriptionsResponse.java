package com.flint.dto;

import java.math.BigDecimal;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SubscriptionsResponse {
  private List<SubscriptionResponse> subscriptions;
  private BigDecimal totalMonthlySpend;
}
