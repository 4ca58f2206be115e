package com.flint.service;

import com.flint.config.DashboardProperties;
import com.flint.config.RequestIdFilter;
import com.flint.dto.DashboardAccount;
import com.flint.dto.DashboardResponse;
import com.flint.model.AccountProvider;
import com.flint.model.AccountType;
import com.flint.model.ConnectedAccount;
import com.flint.model.SubscriptionTier;
import com.flint.model.User;
import com.flint.provider.ProviderException;
import com.flint.provider.ProviderFailure;
import com.flint.provider.aggregator.AggregatorAccount;
import com.flint.provider.aggregator.AggregatorClient;
import com.flint.provider.aggregator.ProviderCredentials;
import com.flint.provider.bank.BankAccount;
import com.flint.provider.bank.BankBalance;
import com.flint.provider.bank.BankClient;
import com.flint.repository.ConnectedAccountRepository;
import com.flint.repository.UserRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
public class AccountMerger {
  private static final Logger log = LoggerFactory.getLogger(AccountMerger.class);
  private static final Duration DEFAULT_SIDE_TIMEOUT = Duration.ofSeconds(15);
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  static final String NOT_CONNECTED = "not_connected";
  static final String AUTH_FAILED = "auth_failed";
  static final String FETCH_FAILED = "fetch_failed";

  private final UserRepository userRepository;
  private final ConnectedAccountRepository accountRepository;
  private final CredentialStore credentialStore;
  private final AggregatorClient aggregatorClient;
  private final BankClient bankClient;
  private final CryptoService cryptoService;
  private final Executor executor;
  private final Clock clock;
  private final Duration sideTimeout;

  public AccountMerger(UserRepository userRepository,
                       ConnectedAccountRepository accountRepository,
                       CredentialStore credentialStore,
                       AggregatorClient aggregatorClient,
                       BankClient bankClient,
                       CryptoService cryptoService,
                       @Qualifier("aggregationExecutor") Executor executor,
                       DashboardProperties properties,
                       Clock clock) {
    this.userRepository = userRepository;
    this.accountRepository = accountRepository;
    this.credentialStore = credentialStore;
    this.aggregatorClient = aggregatorClient;
    this.bankClient = bankClient;
    this.cryptoService = cryptoService;
    this.executor = executor;
    this.clock = clock;
    this.sideTimeout = properties.sideTimeout() == null ? DEFAULT_SIDE_TIMEOUT : properties.sideTimeout();
  }

  public DashboardResponse buildDashboardView(UUID userId) {
    User user = null;
    try {
      user = userRepository.findById(userId).orElse(null);
      return build(userId, user);
    } catch (RuntimeException ex) {
      log.error("Dashboard assembly failed for user {} (request {})",
          LogIds.hash(userId), RequestIdFilter.currentRequestId(), ex);
      return DashboardResponse.empty(tierOf(user), user != null && user.isAdmin(),
          "We couldn't load your accounts right now. Please try again in a moment.");
    }
  }

  private DashboardResponse build(UUID userId, User user) {
    CompletableFuture<Side> bankFuture = CompletableFuture
        .supplyAsync(() -> loadBankSide(userId), executor)
        .orTimeout(sideTimeout.toMillis(), TimeUnit.MILLISECONDS)
        .exceptionally(ex -> {
          log.warn("Bank side failed for user {}: {}", LogIds.hash(userId), ex.toString());
          return storedBankSide(userId);
        });
    CompletableFuture<Side> brokerageFuture = CompletableFuture
        .supplyAsync(() -> loadBrokerageSide(userId), executor)
        .orTimeout(sideTimeout.toMillis(), TimeUnit.MILLISECONDS)
        .exceptionally(ex -> {
          log.warn("Brokerage side failed for user {}: {}", LogIds.hash(userId), ex.toString());
          return new Side(List.of(), FETCH_FAILED);
        });
    List<DashboardAccount> crypto = loadCryptoAccounts(userId);

    Side bank = bankFuture.join();
    Side brokerage = brokerageFuture.join();

    List<DashboardAccount> accounts = new ArrayList<>();
    accounts.addAll(bank.accounts());
    accounts.addAll(brokerage.accounts());
    accounts.addAll(crypto);

    BigDecimal bankAssets = sum(bank.accounts(), false);
    BigDecimal creditSigned = sum(bank.accounts(), true);
    BigDecimal investment = sum(brokerage.accounts(), false);
    BigDecimal cryptoValue = sum(crypto, false);
    BigDecimal totalAssets = bankAssets.add(investment).add(cryptoValue);
    BigDecimal totalBalance = totalAssets.add(creditSigned);
    applyPercentages(accounts);

    boolean hasAccounts = !accounts.isEmpty();
    DashboardResponse.ConnectionStatus status = new DashboardResponse.ConnectionStatus(
        hasAccounts, brokerage.error(), bank.error(), statusMessage(brokerage.error(), bank.error()));
    return new DashboardResponse(
        scale(totalBalance),
        scale(bankAssets),
        scale(investment),
        scale(cryptoValue),
        scale(totalAssets),
        scale(creditSigned.negate()),
        accounts,
        tierOf(user),
        user != null && user.isAdmin(),
        !hasAccounts,
        status);
  }

  // credit accounts and overdrawn balances hold no share of assets
  static void applyPercentages(List<DashboardAccount> accounts) {
    BigDecimal positiveAssets = accounts.stream()
        .filter(AccountMerger::holdsShare)
        .map(DashboardAccount::getBalance)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
    for (DashboardAccount account : accounts) {
      if (!holdsShare(account) || positiveAssets.signum() <= 0) {
        account.setPercentOfTotal(BigDecimal.ZERO.setScale(1));
        continue;
      }
      account.setPercentOfTotal(account.getBalance()
          .multiply(HUNDRED)
          .divide(positiveAssets, 1, RoundingMode.HALF_UP));
    }
  }

  private static boolean holdsShare(DashboardAccount account) {
    return account.getAccountType() != AccountType.CREDIT && orZero(account.getBalance()).signum() > 0;
  }

  Side loadBankSide(UUID userId) {
    Instant now = clock.instant();
    List<DashboardAccount> result = new ArrayList<>();
    boolean authFailed = false;
    boolean fetchFailed = false;
    for (ConnectedAccount account : accountRepository.findByUserIdAndProviderOrderByCreatedAtAsc(userId,
        AccountProvider.BANK)) {
      String accessToken = accessToken(account);
      if (accessToken == null) {
        result.add(bankAccount(account, BankBalanceMapper.fromStored(account.getAccountType(), account.getBalance()),
            true));
        continue;
      }
      try {
        BankAccount details = bankClient.getAccount(accessToken, account.getExternalAccountId());
        BankBalance balance = bankClient.getBalances(accessToken, account.getExternalAccountId());
        AccountType type = BankBalanceMapper.accountType(details);
        BankBalanceMapper.MappedBalance mapped = BankBalanceMapper.map(type, balance);
        account.setAccountType(type);
        if (details.name() != null) {
          account.setDisplayName(details.name());
        }
        account.setBalance(mapped.balance());
        account.setLastSyncedAt(now);
        accountRepository.save(account);
        result.add(bankAccount(account, mapped, false));
      } catch (ProviderException ex) {
        boolean auth = ex.is(ProviderFailure.AUTH_FAILED);
        authFailed |= auth;
        fetchFailed |= !auth;
        log.warn("Bank account {} for user {} fell back to stored balance: {}",
            account.getId(), LogIds.hash(userId), ex.getFailure());
        result.add(bankAccount(account, BankBalanceMapper.fromStored(account.getAccountType(), account.getBalance()),
            auth));
      }
    }
    return new Side(result, authFailed ? AUTH_FAILED : fetchFailed ? FETCH_FAILED : null);
  }

  private Side storedBankSide(UUID userId) {
    List<DashboardAccount> result = accountRepository.findByUserIdAndProviderOrderByCreatedAtAsc(userId,
            AccountProvider.BANK).stream()
        .map(account -> bankAccount(account,
            BankBalanceMapper.fromStored(account.getAccountType(), account.getBalance()), false))
        .toList();
    return new Side(result, FETCH_FAILED);
  }

  Side loadBrokerageSide(UUID userId) {
    Optional<ProviderCredentials> credentials = credentialStore.find(userId);
    if (credentials.isEmpty()) {
      return new Side(List.of(), NOT_CONNECTED);
    }
    try {
      List<DashboardAccount> accounts = aggregatorClient.listAccounts(credentials.get()).stream()
          .map(this::brokerageAccount)
          .toList();
      return new Side(accounts, null);
    } catch (ProviderException ex) {
      if (ex.is(ProviderFailure.AUTH_FAILED)) {
        // identity stays; the user re-authorizes from the placeholder
        log.warn("Brokerage authorization rejected for user {}", LogIds.hash(userId));
        return new Side(List.of(reconnectPlaceholder()), AUTH_FAILED);
      }
      log.warn("Brokerage accounts unavailable for user {}: {}", LogIds.hash(userId), ex.getFailure());
      return new Side(List.of(), FETCH_FAILED);
    }
  }

  private List<DashboardAccount> loadCryptoAccounts(UUID userId) {
    return accountRepository.findByUserIdAndProviderOrderByCreatedAtAsc(userId, AccountProvider.CRYPTO).stream()
        .map(account -> {
          DashboardAccount view = base(account);
          view.setAccountType(AccountType.CRYPTO);
          view.setBalance(orZero(account.getBalance()));
          return view;
        })
        .toList();
  }

  private DashboardAccount bankAccount(ConnectedAccount account,
                                       BankBalanceMapper.MappedBalance mapped,
                                       boolean needsReconnection) {
    DashboardAccount view = base(account);
    view.setBalance(mapped.balance());
    view.setAmountOwed(mapped.amountOwed());
    view.setAvailableCredit(mapped.availableCredit());
    view.setNeedsReconnection(needsReconnection);
    return view;
  }

  private DashboardAccount base(ConnectedAccount account) {
    DashboardAccount view = new DashboardAccount();
    view.setId(account.getId().toString());
    view.setProvider(account.getProvider());
    view.setAccountType(account.getAccountType());
    view.setDisplayName(account.getDisplayName());
    view.setInstitutionName(account.getInstitutionName());
    view.setLastFour(account.getLastFour());
    view.setCurrency(account.getCurrency());
    view.setLastSyncedAt(account.getLastSyncedAt());
    return view;
  }

  DashboardAccount brokerageAccount(AggregatorAccount account) {
    BigDecimal total = orZero(account.totalValue());
    BigDecimal cash = orZero(account.cash());
    DashboardAccount view = new DashboardAccount();
    view.setId(account.id());
    view.setProvider(AccountProvider.BROKERAGE);
    view.setAccountType(AccountType.INVESTMENT);
    view.setDisplayName(brokerageName(account));
    view.setInstitutionName(account.institutionName());
    view.setLastFour(lastFour(account.number()));
    view.setBalance(total);
    view.setCash(cash);
    view.setHoldingsValue(total.subtract(cash));
    view.setBuyingPower(account.buyingPower() != null ? account.buyingPower() : cash);
    view.setCurrency(account.currency());
    view.setLastSyncedAt(clock.instant());
    return view;
  }

  static String brokerageName(AggregatorAccount account) {
    String name = account.name() == null ? "" : account.name().trim();
    if (!name.isEmpty() && !"default".equalsIgnoreCase(name)) {
      return name;
    }
    String institution = account.institutionName() == null || account.institutionName().isBlank()
        ? "Brokerage"
        : account.institutionName().trim();
    String type = account.accountType() == null || account.accountType().isBlank()
        ? "Investment"
        : account.accountType().trim();
    return institution + " " + type;
  }

  private DashboardAccount reconnectPlaceholder() {
    DashboardAccount view = new DashboardAccount();
    view.setId("brokerage-reconnect");
    view.setProvider(AccountProvider.BROKERAGE);
    view.setAccountType(AccountType.INVESTMENT);
    view.setDisplayName("Brokerage connection");
    view.setBalance(BigDecimal.ZERO);
    view.setCurrency("USD");
    view.setNeedsReconnection(true);
    return view;
  }

  private String accessToken(ConnectedAccount account) {
    if (account.getEncryptedAccessToken() == null) {
      return null;
    }
    try {
      return cryptoService.decrypt(account.getEncryptedAccessToken());
    } catch (IllegalStateException ex) {
      log.warn("Stored access token for bank account {} is unreadable", account.getId());
      return null;
    }
  }

  private static String statusMessage(String brokerageError, String bankError) {
    if (AUTH_FAILED.equals(brokerageError)) {
      return "Your brokerage connection needs to be re-authorized.";
    }
    if (FETCH_FAILED.equals(brokerageError)) {
      return "Brokerage data is temporarily unavailable. Showing your other accounts.";
    }
    if (AUTH_FAILED.equals(bankError)) {
      return "Some bank accounts need to be reconnected.";
    }
    if (FETCH_FAILED.equals(bankError)) {
      return "Some bank balances could not be refreshed and show their last known value.";
    }
    return null;
  }

  private static BigDecimal sum(List<DashboardAccount> accounts, boolean credit) {
    return accounts.stream()
        .filter(account -> (account.getAccountType() == AccountType.CREDIT) == credit)
        .map(DashboardAccount::getBalance)
        .map(AccountMerger::orZero)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  private static SubscriptionTier tierOf(User user) {
    return user == null ? SubscriptionTier.FREE : user.getSubscriptionTier();
  }

  private static String lastFour(String number) {
    if (number == null || number.length() < 4) {
      return number;
    }
    return number.substring(number.length() - 4);
  }

  private static BigDecimal scale(BigDecimal value) {
    return value.setScale(2, RoundingMode.HALF_UP);
  }

  private static BigDecimal orZero(BigDecimal value) {
    return value == null ? BigDecimal.ZERO : value;
  }

  record Side(List<DashboardAccount> accounts, String error) {}
}
