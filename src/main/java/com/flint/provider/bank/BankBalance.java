package com.flint.provider.bank;

import java.math.BigDecimal;

// for credit accounts ledger is the amount owed, a positive number
public record BankBalance(BigDecimal ledger, BigDecimal available) {}
