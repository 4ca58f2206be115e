package com.flint.controller;

import com.flint.config.RequestIdFilter;
import com.flint.dto.ErrorResponse;
import com.flint.error.ApiException;
import com.flint.error.ErrorCode;
import com.flint.provider.ProviderException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ApiException.class)
  public ResponseEntity<ErrorResponse> handleApi(ApiException ex) {
    if (ex.getCode() == ErrorCode.INTERNAL_ERROR) {
      log.error("Request failed: {}", ex.getReason(), ex);
    }
    return build(ex.getCode(), ex.getReason(), ex.getRetryAfterSeconds());
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException ex) {
    ErrorCode code = ErrorCode.fromStatus(ex.getStatusCode().value());
    return build(code, ex.getReason() == null ? code.name() : ex.getReason(), null);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
    String message = ex.getBindingResult().getFieldErrors().stream()
        .findFirst()
        .map(error -> error.getField() + " " + error.getDefaultMessage())
        .orElse("Invalid request");
    return build(ErrorCode.VALIDATION_ERROR, message, null);
  }

  @ExceptionHandler({
      ConstraintViolationException.class,
      HttpMessageNotReadableException.class,
      MissingServletRequestParameterException.class,
      MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
    return build(ErrorCode.VALIDATION_ERROR, "Invalid request", null);
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex) {
    return build(ErrorCode.NOT_FOUND, "Not found", null);
  }

  @ExceptionHandler(ProviderException.class)
  public ResponseEntity<ErrorResponse> handleProvider(ProviderException ex) {
    log.error("Unhandled {} failure ({}): {}", ex.getProvider(), ex.getFailure(), ex.getMessage());
    return switch (ex.getFailure()) {
      case RATE_LIMITED -> build(ErrorCode.RATE_LIMITED, "Too many requests, try again later",
          ex.getRetryAfterSeconds());
      case AUTH_FAILED, TRANSIENT -> build(ErrorCode.SERVICE_UNAVAILABLE,
          "Provider temporarily unavailable, try again shortly", null);
      default -> build(ErrorCode.INTERNAL_ERROR, "Unexpected error", null);
    };
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGeneral(Exception ex) {
    log.error("Unhandled error", ex);
    return build(ErrorCode.INTERNAL_ERROR, "Unexpected error", null);
  }

  private ResponseEntity<ErrorResponse> build(ErrorCode code, String message, Long retryAfter) {
    ErrorResponse body = new ErrorResponse(message,
        new ErrorResponse.ErrorBody(code.name(), message, RequestIdFilter.currentRequestId(), code.retryable()),
        retryAfter);
    ResponseEntity.BodyBuilder response = ResponseEntity.status(code.status());
    if (retryAfter != null) {
      response.header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
    }
    return response.body(body);
  }
}
