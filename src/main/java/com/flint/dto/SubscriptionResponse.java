package com.flint.dto;

import com.flint.model.BillingFrequency;
import com.flint.provider.bank.BankTransaction;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SubscriptionResponse {
  private String id;
  private String merchantName;
  private BigDecimal amount;
  private BillingFrequency frequency;
  private LocalDate nextBillingDate;
  private LocalDate lastTransactionDate;
  private double confidence;
  private String category;
  private String accountName;
  private BigDecimal monthlyAmount;
  private List<BankTransaction> transactions;
}
