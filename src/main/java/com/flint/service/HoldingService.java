package com.flint.service;

import com.flint.dto.ActivityResponse;
import com.flint.dto.HoldingResponse;
import com.flint.dto.HoldingsResponse;
import com.flint.error.ApiException;
import com.flint.error.ErrorCode;
import com.flint.model.Holding;
import com.flint.provider.ProviderException;
import com.flint.provider.aggregator.AggregatorAccount;
import com.flint.provider.aggregator.AggregatorActivity;
import com.flint.provider.aggregator.AggregatorClient;
import com.flint.provider.aggregator.AggregatorPosition;
import com.flint.provider.aggregator.ProviderCredentials;
import com.flint.repository.HoldingRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class HoldingService {
  private static final Logger log = LoggerFactory.getLogger(HoldingService.class);
  private static final int ACTIVITY_HISTORY_DAYS = 365;

  private final RegistrationCoordinator registrationCoordinator;
  private final AggregatorClient aggregatorClient;
  private final HoldingRepository holdingRepository;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public HoldingService(RegistrationCoordinator registrationCoordinator,
                        AggregatorClient aggregatorClient,
                        HoldingRepository holdingRepository,
                        TransactionTemplate transactionTemplate,
                        Clock clock) {
    this.registrationCoordinator = registrationCoordinator;
    this.aggregatorClient = aggregatorClient;
    this.holdingRepository = holdingRepository;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  public HoldingsResponse refreshHoldings(UUID userId, String accountId) {
    ProviderCredentials credentials = registrationCoordinator.requireCredentials(userId);
    AggregatorAccount account = requireAccount(userId, credentials, accountId);
    List<AggregatorPosition> positions;
    try {
      positions = aggregatorClient.listPositions(credentials, accountId);
    } catch (ProviderException ex) {
      throw ProviderErrorTranslator.translate(userId, "holdings", ex);
    }

    Instant asOf = clock.instant();
    List<Holding> snapshot = positions.stream()
        .filter(position -> position.symbol() != null && position.quantity() != null
            && position.currentPrice() != null)
        .map(position -> toHolding(userId, account, position, asOf))
        .toList();
    if (snapshot.size() < positions.size()) {
      log.warn("Dropped {} positions without symbol, quantity or price for account {}",
          positions.size() - snapshot.size(), accountId);
    }
    List<Holding> stored = transactionTemplate.execute(status -> {
      holdingRepository.deleteByUserIdAndAccountId(userId, accountId);
      return holdingRepository.saveAll(snapshot);
    });

    List<HoldingResponse> holdings = stored.stream()
        .sorted((a, b) -> a.getSymbol().compareTo(b.getSymbol()))
        .map(HoldingService::toResponse)
        .toList();
    BigDecimal totalValue = holdings.stream().map(HoldingResponse::getCurrentValue)
        .reduce(BigDecimal.ZERO.setScale(2), BigDecimal::add);
    BigDecimal totalProfitLoss = holdings.stream().map(HoldingResponse::getProfitLoss)
        .reduce(BigDecimal.ZERO.setScale(2), BigDecimal::add);
    return new HoldingsResponse(accountId, holdings, totalValue, totalProfitLoss, asOf);
  }

  public List<ActivityResponse> listActivities(UUID userId, String accountId) {
    ProviderCredentials credentials = registrationCoordinator.requireCredentials(userId);
    requireAccount(userId, credentials, accountId);
    LocalDate end = LocalDate.now(clock);
    try {
      return aggregatorClient.listActivities(credentials, accountId, end.minusDays(ACTIVITY_HISTORY_DAYS), end)
          .stream()
          .map(HoldingService::toResponse)
          .toList();
    } catch (ProviderException ex) {
      throw ProviderErrorTranslator.translate(userId, "activities", ex);
    }
  }

  private AggregatorAccount requireAccount(UUID userId, ProviderCredentials credentials, String accountId) {
    List<AggregatorAccount> accounts;
    try {
      accounts = aggregatorClient.listAccounts(credentials);
    } catch (ProviderException ex) {
      throw ProviderErrorTranslator.translate(userId, "account lookup", ex);
    }
    return accounts.stream()
        .filter(account -> accountId.equals(account.id()))
        .findFirst()
        .orElseThrow(() -> new ApiException(ErrorCode.NOT_FOUND, "Brokerage account not found"));
  }

  private static Holding toHolding(UUID userId, AggregatorAccount account, AggregatorPosition position,
                                   Instant asOf) {
    Holding holding = new Holding();
    holding.setUserId(userId);
    holding.setAccountId(account.id());
    holding.setProviderAuthorizationId(account.authorizationId());
    holding.setSymbol(position.symbol());
    holding.setName(position.description());
    holding.setQuantity(position.quantity());
    holding.setAverageCost(position.averageCost());
    holding.setCurrentPrice(position.currentPrice());
    if (position.currency() != null) {
      holding.setCurrency(position.currency());
    } else if (account.currency() != null) {
      holding.setCurrency(account.currency());
    }
    holding.setAsOf(asOf);
    return holding;
  }

  private static HoldingResponse toResponse(Holding holding) {
    return new HoldingResponse(holding.getSymbol(), holding.getName(), holding.getQuantity(),
        holding.getAverageCost(), holding.getCurrentPrice(), holding.getCurrentValue(), holding.getProfitLoss(),
        holding.getCurrency());
  }

  private static ActivityResponse toResponse(AggregatorActivity activity) {
    return new ActivityResponse(activity.id(), activity.type(), activity.symbol(), activity.description(),
        activity.units(), activity.price(), activity.amount(), activity.currency(), activity.tradeDate());
  }
}
