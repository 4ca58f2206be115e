package com.flint.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class HoldingsResponse {
  private String accountId;
  private List<HoldingResponse> holdings;
  private BigDecimal totalValue;
  private BigDecimal totalProfitLoss;
  private Instant asOf;
}
