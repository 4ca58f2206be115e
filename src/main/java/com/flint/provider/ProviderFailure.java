package com.flint.provider;

public enum ProviderFailure {
  AUTH_FAILED,
  RATE_LIMITED,
  IDENTITY_EXISTS,
  NOT_FOUND,
  TRANSIENT,
  UNKNOWN
}
