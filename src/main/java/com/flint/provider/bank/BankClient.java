package com.flint.provider.bank;

import java.util.List;

public interface BankClient {
  String PROVIDER = "Teller";

  List<BankAccount> listAccounts(String accessToken);

  BankAccount getAccount(String accessToken, String accountId);

  BankBalance getBalances(String accessToken, String accountId);

  List<BankTransaction> listTransactions(String accessToken, String accountId, int count);
}
