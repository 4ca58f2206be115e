package com.flint.service;

import com.flint.config.RequestIdFilter;
import com.flint.error.ApiException;
import com.flint.error.ErrorCode;
import com.flint.provider.ProviderException;
import com.flint.provider.bank.BankClient;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class ProviderErrorTranslator {
  private static final Logger log = LoggerFactory.getLogger(ProviderErrorTranslator.class);

  private ProviderErrorTranslator() {
  }

  static ApiException translate(UUID userId, String operation, ProviderException ex) {
    String service = serviceName(ex);
    return switch (ex.getFailure()) {
      case RATE_LIMITED -> ApiException.rateLimited(ex.getRetryAfterSeconds());
      case AUTH_FAILED, TRANSIENT -> {
        log.warn("{} unavailable during {} for user {}: {}",
            ex.getProvider(), operation, LogIds.hash(userId), ex.getMessage());
        yield new ApiException(ErrorCode.SERVICE_UNAVAILABLE,
            service + " service is temporarily unavailable, try again shortly", ex);
      }
      case NOT_FOUND -> {
        if (isBank(ex)) {
          yield new ApiException(ErrorCode.NOT_FOUND, "Bank account was not found", ex);
        }
        log.warn("{} no longer recognises the identity of user {} during {}",
            ex.getProvider(), LogIds.hash(userId), operation);
        yield new ApiException(ErrorCode.ORPHANED_IDENTITY,
            "Brokerage identity is no longer valid. Re-register with repair to restore it.", ex);
      }
      default -> {
        log.error("{} failed during {} for user {} (request {})",
            ex.getProvider(), operation, LogIds.hash(userId), RequestIdFilter.currentRequestId(), ex);
        yield new ApiException(ErrorCode.INTERNAL_ERROR, service + " request failed", ex);
      }
    };
  }

  // a token handed in by the client is the client's mistake, not an outage
  static ApiException translateBankLink(UUID userId, ProviderException ex) {
    return switch (ex.getFailure()) {
      case AUTH_FAILED, NOT_FOUND -> {
        log.info("{} rejected the access token offered by user {}: {}",
            ex.getProvider(), LogIds.hash(userId), ex.getFailure());
        yield new ApiException(ErrorCode.VALIDATION_ERROR,
            "Bank access token is invalid or expired. Link the bank again.", ex);
      }
      default -> translate(userId, "bank link", ex);
    };
  }

  private static boolean isBank(ProviderException ex) {
    return BankClient.PROVIDER.equals(ex.getProvider());
  }

  private static String serviceName(ProviderException ex) {
    return isBank(ex) ? "Bank" : "Brokerage";
  }
}
