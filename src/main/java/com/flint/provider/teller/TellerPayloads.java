package com.flint.provider.teller;

import static com.flint.provider.JsonAliases.firstDecimal;
import static com.flint.provider.JsonAliases.firstText;

import com.fasterxml.jackson.databind.JsonNode;
import com.flint.provider.bank.BankAccount;
import com.flint.provider.bank.BankBalance;
import com.flint.provider.bank.BankTransaction;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class TellerPayloads {
  private static final Logger log = LoggerFactory.getLogger(TellerPayloads.class);

  private TellerPayloads() {
  }

  static List<BankAccount> accounts(JsonNode root) {
    List<BankAccount> accounts = new ArrayList<>();
    if (root == null || !root.isArray()) {
      return accounts;
    }
    for (JsonNode node : root) {
      BankAccount account = account(node);
      if (account != null) {
        accounts.add(account);
      }
    }
    return accounts;
  }

  static BankAccount account(JsonNode node) {
    String id = firstText(node, "id");
    if (id == null) {
      return null;
    }
    return new BankAccount(
        id,
        firstText(node, "name"),
        firstText(node, "type"),
        firstText(node, "subtype"),
        firstText(node, "institution.name", "institution_name"),
        firstText(node, "institution.id"),
        firstText(node, "last_four"),
        orDefault(firstText(node, "currency"), "USD"),
        firstText(node, "enrollment_id")
    );
  }

  static BankBalance balance(JsonNode node) {
    return new BankBalance(firstDecimal(node, "ledger"), firstDecimal(node, "available"));
  }

  static List<BankTransaction> transactions(JsonNode root) {
    List<BankTransaction> transactions = new ArrayList<>();
    if (root == null || !root.isArray()) {
      return transactions;
    }
    for (JsonNode node : root) {
      LocalDate date = parseDate(firstText(node, "date"));
      BigDecimal amount = firstDecimal(node, "amount");
      if (date == null || amount == null) {
        log.warn("Skipping bank transaction without date or amount");
        continue;
      }
      transactions.add(new BankTransaction(
          firstText(node, "id"),
          firstText(node, "account_id"),
          null,
          date,
          amount,
          firstText(node, "description"),
          firstText(node, "details.counterparty.name"),
          firstText(node, "details.category"),
          firstText(node, "status")
      ));
    }
    return transactions;
  }

  private static LocalDate parseDate(String value) {
    if (value == null) {
      return null;
    }
    try {
      return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
    } catch (DateTimeParseException ex) {
      log.debug("Unparseable transaction date {}", value);
      return null;
    }
  }

  private static String orDefault(String value, String fallback) {
    return value == null ? fallback : value;
  }
}
