package com.flint.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ActivityResponse {
  private String id;
  private String type;
  private String symbol;
  private String description;
  private BigDecimal units;
  private BigDecimal price;
  private BigDecimal amount;
  private String currency;
  private LocalDate tradeDate;
}
