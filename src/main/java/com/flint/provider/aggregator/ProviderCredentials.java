package com.flint.provider.aggregator;

public record ProviderCredentials(String providerUserId, String providerSecret) {
  @Override
  public String toString() {
    return "ProviderCredentials[providerUserId=" + providerUserId + ", providerSecret=***]";
  }
}
