package com.flint.dto;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class HoldingResponse {
  private String symbol;
  private String name;
  private BigDecimal quantity;
  private BigDecimal averageCost;
  private BigDecimal currentPrice;
  private BigDecimal currentValue;
  private BigDecimal profitLoss;
  private String currency;
}
