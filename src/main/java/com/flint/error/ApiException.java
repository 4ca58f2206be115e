package com.flint.error;

import org.springframework.web.server.ResponseStatusException;

public class ApiException extends ResponseStatusException {
  private final ErrorCode code;
  private final Long retryAfterSeconds;

  public ApiException(ErrorCode code, String reason) {
    this(code, reason, null, null);
  }

  public ApiException(ErrorCode code, String reason, Throwable cause) {
    this(code, reason, null, cause);
  }

  public ApiException(ErrorCode code, String reason, Long retryAfterSeconds, Throwable cause) {
    super(code.status(), reason, cause);
    this.code = code;
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public static ApiException notRegistered() {
    return new ApiException(ErrorCode.NOT_REGISTERED,
        "Brokerage identity is not registered. Register before syncing connections.");
  }

  public static ApiException rateLimited(Long retryAfterSeconds) {
    return new ApiException(ErrorCode.RATE_LIMITED, "Too many requests, try again later", retryAfterSeconds, null);
  }

  public ErrorCode getCode() {
    return code;
  }

  public Long getRetryAfterSeconds() {
    return retryAfterSeconds;
  }
}
