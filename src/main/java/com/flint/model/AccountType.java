package com.flint.model;

public enum AccountType {
  BANK,
  CREDIT,
  INVESTMENT,
  CRYPTO
}
