package com.flint.provider;

public class ProviderException extends RuntimeException {
  private final String provider;
  private final ProviderFailure failure;
  private final Integer httpStatus;
  private final String providerCode;
  private final Long retryAfterSeconds;

  public ProviderException(String provider,
                           ProviderFailure failure,
                           String message,
                           Integer httpStatus,
                           String providerCode,
                           Long retryAfterSeconds,
                           Throwable cause) {
    super(message, cause);
    this.provider = provider;
    this.failure = failure;
    this.httpStatus = httpStatus;
    this.providerCode = providerCode;
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public ProviderException(String provider, ProviderFailure failure, String message) {
    this(provider, failure, message, null, null, null, null);
  }

  public String getProvider() {
    return provider;
  }

  public ProviderFailure getFailure() {
    return failure;
  }

  public Integer getHttpStatus() {
    return httpStatus;
  }

  public String getProviderCode() {
    return providerCode;
  }

  public Long getRetryAfterSeconds() {
    return retryAfterSeconds;
  }

  public boolean is(ProviderFailure candidate) {
    return failure == candidate;
  }
}
