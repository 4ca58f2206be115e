package com.flint.provider.snaptrade;

import static com.flint.provider.JsonAliases.firstBoolean;
import static com.flint.provider.JsonAliases.firstDecimal;
import static com.flint.provider.JsonAliases.firstText;

import com.fasterxml.jackson.databind.JsonNode;
import com.flint.provider.aggregator.AggregatorAccount;
import com.flint.provider.aggregator.AggregatorActivity;
import com.flint.provider.aggregator.AggregatorAuthorization;
import com.flint.provider.aggregator.AggregatorPosition;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SnapTradePayloads {
  private static final Logger log = LoggerFactory.getLogger(SnapTradePayloads.class);

  static final String[] AUTHORIZATION_REF_ALIASES = {
      "brokerage_authorization",
      "brokerage_authorization.id",
      "brokerage_authorization_id",
      "brokerageAuthorizationId",
      "authorization_id",
      "authorizationId",
      "connection_id",
      "meta.brokerage_authorization"
  };
  static final String[] AUTHORIZATION_ID_ALIASES = {
      "id", "authorization_id", "authorizationId", "brokerage_authorization_id"
  };
  static final String[] INSTITUTION_ALIASES = {
      "institution_name", "brokerage_authorization.brokerage.name", "brokerage.name", "meta.institution_name"
  };
  static final String[] TOTAL_VALUE_ALIASES = {"total_value", "balance.total", "balance.total_value"};
  static final String[] CASH_ALIASES = {"cash", "balance.cash", "cash_balance"};
  static final String[] BUYING_POWER_ALIASES = {"buying_power", "balance.buying_power", "buyingPower"};

  private SnapTradePayloads() {
  }

  public static List<AggregatorAccount> accounts(JsonNode root) {
    List<AggregatorAccount> accounts = new ArrayList<>();
    for (JsonNode node : items(root, "accounts", "data")) {
      String id = firstText(node, "id", "account_id");
      if (id == null) {
        log.warn("Skipping aggregator account without id");
        continue;
      }
      accounts.add(new AggregatorAccount(
          id,
          resolveAuthorizationId(node),
          firstText(node, "name"),
          firstText(node, "number"),
          firstText(node, INSTITUTION_ALIASES),
          firstText(node, "meta.type", "raw_type", "type"),
          defaultCurrency(firstText(node, "balance.total.currency", "total_value.currency", "currency")),
          firstDecimal(node, TOTAL_VALUE_ALIASES),
          firstDecimal(node, CASH_ALIASES),
          firstDecimal(node, BUYING_POWER_ALIASES)
      ));
    }
    return accounts;
  }

  public static String resolveAuthorizationId(JsonNode account) {
    return firstText(account, AUTHORIZATION_REF_ALIASES);
  }

  public static List<AggregatorAuthorization> authorizations(JsonNode root) {
    List<AggregatorAuthorization> authorizations = new ArrayList<>();
    for (JsonNode node : items(root, "authorizations", "data")) {
      String id = firstText(node, AUTHORIZATION_ID_ALIASES);
      if (id == null) {
        log.warn("Skipping aggregator authorization without a resolvable id");
        continue;
      }
      authorizations.add(new AggregatorAuthorization(
          id,
          firstText(node, "brokerage.name", "brokerage.display_name", "name", "institution_name"),
          firstBoolean(node, false, "disabled", "is_disabled")
      ));
    }
    return authorizations;
  }

  public static List<AggregatorPosition> positions(JsonNode root) {
    List<AggregatorPosition> positions = new ArrayList<>();
    for (JsonNode node : items(root, "positions", "data")) {
      String symbol = firstText(node, "symbol.symbol.symbol", "symbol.symbol", "symbol.raw_symbol", "symbol", "ticker");
      BigDecimal quantity = firstDecimal(node, "units", "fractional_units", "quantity");
      BigDecimal price = firstDecimal(node, "price", "last_price", "current_price", "market_price");
      if (symbol == null || quantity == null || price == null) {
        log.warn("Skipping position missing symbol, quantity or price");
        continue;
      }
      positions.add(new AggregatorPosition(
          symbol,
          firstText(node, "symbol.symbol.description", "symbol.description", "description"),
          quantity,
          firstDecimal(node, "average_purchase_price", "average_cost", "cost_basis_per_share"),
          price,
          defaultCurrency(firstText(node, "currency.code", "symbol.symbol.currency.code", "currency"))
      ));
    }
    return positions;
  }

  public static List<AggregatorActivity> activities(JsonNode root) {
    List<AggregatorActivity> activities = new ArrayList<>();
    for (JsonNode node : items(root, "activities", "data")) {
      activities.add(new AggregatorActivity(
          firstText(node, "id"),
          firstText(node, "type"),
          firstText(node, "symbol.symbol", "symbol.raw_symbol", "symbol"),
          firstText(node, "description"),
          firstDecimal(node, "units", "quantity"),
          firstDecimal(node, "price"),
          firstDecimal(node, "net_amount", "amount"),
          defaultCurrency(firstText(node, "currency.code", "currency")),
          parseDate(firstText(node, "trade_date", "settlement_date", "date"))
      ));
    }
    return activities;
  }

  static List<JsonNode> items(JsonNode root, String... wrapperKeys) {
    if (root == null || root.isNull()) {
      return List.of();
    }
    JsonNode array = root;
    if (!root.isArray()) {
      array = null;
      for (String key : wrapperKeys) {
        JsonNode candidate = root.get(key);
        if (candidate != null && candidate.isArray()) {
          array = candidate;
          break;
        }
      }
    }
    if (array == null) {
      return List.of();
    }
    List<JsonNode> items = new ArrayList<>();
    array.forEach(items::add);
    return items;
  }

  private static LocalDate parseDate(String value) {
    if (value == null || value.length() < 10) {
      return null;
    }
    try {
      return LocalDate.parse(value.substring(0, 10));
    } catch (DateTimeParseException ex) {
      log.debug("Unparseable activity date {}", value);
      return null;
    }
  }

  private static String defaultCurrency(String currency) {
    return currency == null ? "USD" : currency;
  }
}
