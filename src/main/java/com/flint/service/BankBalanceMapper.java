package com.flint.service;

import com.flint.model.AccountType;
import com.flint.provider.bank.BankAccount;
import com.flint.provider.bank.BankBalance;
import java.math.BigDecimal;

final class BankBalanceMapper {
  private BankBalanceMapper() {
  }

  static AccountType accountType(BankAccount account) {
    return account.isCredit() ? AccountType.CREDIT : AccountType.BANK;
  }

  static MappedBalance map(AccountType type, BankBalance balance) {
    BigDecimal ledger = balance.ledger() == null ? BigDecimal.ZERO : balance.ledger();
    if (type == AccountType.CREDIT) {
      return new MappedBalance(ledger.negate(), ledger, balance.available());
    }
    BigDecimal available = balance.available();
    BigDecimal amount = available != null && available.signum() != 0 ? available : ledger;
    return new MappedBalance(amount, null, null);
  }

  // stored balances are already signed
  static MappedBalance fromStored(AccountType type, BigDecimal stored) {
    BigDecimal value = stored == null ? BigDecimal.ZERO : stored;
    if (type == AccountType.CREDIT) {
      return new MappedBalance(value, value.negate(), null);
    }
    return new MappedBalance(value, null, null);
  }

  record MappedBalance(BigDecimal balance, BigDecimal amountOwed, BigDecimal availableCredit) {}
}
