package com.flint.service;

import com.flint.dto.DashboardAccount;
import com.flint.dto.LinkBankRequest;
import com.flint.dto.LinkResult;
import com.flint.model.AccountProvider;
import com.flint.model.ConnectedAccount;
import com.flint.provider.ProviderException;
import com.flint.provider.bank.BankAccount;
import com.flint.provider.bank.BankClient;
import com.flint.repository.ConnectedAccountRepository;
import com.flint.service.lock.ExclusiveLock;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class BankLinkService {
  private static final Logger log = LoggerFactory.getLogger(BankLinkService.class);

  private final BankClient bankClient;
  private final ConnectedAccountRepository accountRepository;
  private final ConnectionLimitPolicy limitPolicy;
  private final CryptoService cryptoService;
  private final ExclusiveLock exclusiveLock;
  private final Clock clock;

  public BankLinkService(BankClient bankClient,
                         ConnectedAccountRepository accountRepository,
                         ConnectionLimitPolicy limitPolicy,
                         CryptoService cryptoService,
                         ExclusiveLock exclusiveLock,
                         Clock clock) {
    this.bankClient = bankClient;
    this.accountRepository = accountRepository;
    this.limitPolicy = limitPolicy;
    this.cryptoService = cryptoService;
    this.exclusiveLock = exclusiveLock;
    this.clock = clock;
  }

  public LinkResult linkAccounts(UUID userId, LinkBankRequest request) {
    List<BankAccount> offered;
    try {
      offered = bankClient.listAccounts(request.getAccessToken());
    } catch (ProviderException ex) {
      throw ProviderErrorTranslator.translateBankLink(userId, ex);
    }
    return exclusiveLock.withExclusiveLock(ConnectionSynchronizer.LOCK_PREFIX + userId,
        () -> store(userId, request, offered));
  }

  private LinkResult store(UUID userId, LinkBankRequest request, List<BankAccount> offered) {
    ConnectionLimitPolicy.Allowance allowance = limitPolicy.allowance(userId);
    long slots = allowance.remaining();
    String encryptedToken = cryptoService.encrypt(request.getAccessToken());
    Instant now = clock.instant();

    int saved = 0;
    int rejected = 0;
    int duplicates = 0;
    Set<String> seen = new HashSet<>();
    List<DashboardAccount> stored = new ArrayList<>();
    for (BankAccount account : offered) {
      if (!seen.add(account.id())
          || accountRepository.findByUserIdAndProviderAndExternalAccountId(userId, AccountProvider.BANK,
              account.id()).isPresent()) {
        duplicates++;
        continue;
      }
      if (slots <= 0) {
        rejected++;
        continue;
      }
      ConnectedAccount entity = new ConnectedAccount();
      entity.setUserId(userId);
      entity.setProvider(AccountProvider.BANK);
      entity.setAccountType(BankBalanceMapper.accountType(account));
      entity.setExternalAccountId(account.id());
      entity.setDisplayName(account.name() == null ? "Bank account" : account.name());
      entity.setInstitutionName(account.institutionName() != null
          ? account.institutionName()
          : request.getInstitutionName());
      entity.setInstitutionId(account.institutionId());
      entity.setLastFour(account.lastFour());
      entity.setCurrency(account.currency() == null ? "USD" : account.currency());
      entity.setEnrollmentId(account.enrollmentId() != null ? account.enrollmentId() : request.getEnrollmentId());
      entity.setEncryptedAccessToken(encryptedToken);
      entity.setCreatedAt(now);
      accountRepository.save(entity);
      slots--;
      saved++;
      stored.add(view(entity));
    }

    long current = allowance.current() + saved;
    log.info("Bank link for user {}: saved={} rejected={} duplicates={}",
        LogIds.hash(userId), saved, rejected, duplicates);
    return new LinkResult(saved, rejected, duplicates, allowance.limit(), current,
        message(saved, rejected, allowance.limit()), stored);
  }

  private static String message(int saved, int rejected, Integer limit) {
    if (rejected == 0) {
      return saved == 0 ? "All accounts were already connected" : null;
    }
    if (saved == 0) {
      return "Connection limit of " + limit + " reached. Upgrade your plan to connect more accounts.";
    }
    return saved + " account(s) connected. " + rejected
        + " account(s) were not connected because your plan allows " + limit + ".";
  }

  private static DashboardAccount view(ConnectedAccount entity) {
    DashboardAccount view = new DashboardAccount();
    view.setId(entity.getId() == null ? null : entity.getId().toString());
    view.setProvider(entity.getProvider());
    view.setAccountType(entity.getAccountType());
    view.setDisplayName(entity.getDisplayName());
    view.setInstitutionName(entity.getInstitutionName());
    view.setLastFour(entity.getLastFour());
    view.setCurrency(entity.getCurrency());
    return view;
  }
}
