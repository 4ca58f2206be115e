package com.flint.error;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
  UNAUTHORIZED(HttpStatus.UNAUTHORIZED, false),
  FORBIDDEN(HttpStatus.FORBIDDEN, false),
  NOT_REGISTERED(HttpStatus.PRECONDITION_REQUIRED, false),
  USER_MISMATCH(HttpStatus.CONFLICT, false),
  ORPHANED_IDENTITY(HttpStatus.CONFLICT, true),
  CONNECTION_NOT_VISIBLE(HttpStatus.NOT_FOUND, true),
  NOT_FOUND(HttpStatus.NOT_FOUND, false),
  RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, true),
  SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true),
  VALIDATION_ERROR(HttpStatus.BAD_REQUEST, false),
  INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, false);

  private final HttpStatus status;
  private final boolean retryable;

  ErrorCode(HttpStatus status, boolean retryable) {
    this.status = status;
    this.retryable = retryable;
  }

  public HttpStatus status() {
    return status;
  }

  public boolean retryable() {
    return retryable;
  }

  public static ErrorCode fromStatus(int status) {
    return switch (status) {
      case 400, 422 -> VALIDATION_ERROR;
      case 401 -> UNAUTHORIZED;
      case 403 -> FORBIDDEN;
      case 404 -> NOT_FOUND;
      case 409 -> USER_MISMATCH;
      case 428 -> NOT_REGISTERED;
      case 429 -> RATE_LIMITED;
      case 502, 503, 504 -> SERVICE_UNAVAILABLE;
      default -> INTERNAL_ERROR;
    };
  }
}
