package com.flint.service;

import com.flint.dto.SubscriptionResponse;
import com.flint.dto.SubscriptionsResponse;
import com.flint.model.AccountProvider;
import com.flint.model.ConnectedAccount;
import com.flint.provider.ProviderException;
import com.flint.provider.bank.BankClient;
import com.flint.provider.bank.BankTransaction;
import com.flint.repository.ConnectedAccountRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SubscriptionService {
  private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);
  private static final int TRANSACTIONS_PER_ACCOUNT = 500;
  private static final int HISTORY_MONTHS = 12;

  private final ConnectedAccountRepository accountRepository;
  private final BankClient bankClient;
  private final CryptoService cryptoService;
  private final RecurringPaymentDetector detector;
  private final Clock clock;

  public SubscriptionService(ConnectedAccountRepository accountRepository,
                             BankClient bankClient,
                             CryptoService cryptoService,
                             RecurringPaymentDetector detector,
                             Clock clock) {
    this.accountRepository = accountRepository;
    this.bankClient = bankClient;
    this.cryptoService = cryptoService;
    this.detector = detector;
    this.clock = clock;
  }

  public List<BankTransaction> listTransactions(UUID userId) {
    LocalDate since = LocalDate.now(clock).minusMonths(HISTORY_MONTHS);
    List<BankTransaction> transactions = new ArrayList<>();
    for (ConnectedAccount account : accountRepository.findByUserIdAndProviderOrderByCreatedAtAsc(userId,
        AccountProvider.BANK)) {
      if (account.getEncryptedAccessToken() == null) {
        continue;
      }
      try {
        String accessToken = cryptoService.decrypt(account.getEncryptedAccessToken());
        bankClient.listTransactions(accessToken, account.getExternalAccountId(), TRANSACTIONS_PER_ACCOUNT)
            .stream()
            .filter(transaction -> !transaction.date().isBefore(since))
            .map(transaction -> transaction.withAccountName(account.getDisplayName()))
            .forEach(transactions::add);
      } catch (ProviderException ex) {
        log.warn("Transactions unavailable for bank account {} of user {}: {}",
            account.getId(), LogIds.hash(userId), ex.getFailure());
      }
    }
    transactions.sort(Comparator.comparing(BankTransaction::date).reversed());
    return transactions;
  }

  public SubscriptionsResponse detectSubscriptions(UUID userId) {
    List<BankTransaction> outgoing = listTransactions(userId).stream()
        .filter(transaction -> transaction.amount().signum() < 0)
        .toList();
    List<SubscriptionResponse> subscriptions = detector.detectSubscriptions(outgoing);
    return new SubscriptionsResponse(subscriptions, RecurringPaymentDetector.totalMonthlySpend(subscriptions));
  }
}
