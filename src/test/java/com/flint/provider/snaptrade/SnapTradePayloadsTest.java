package com.flint.provider.snaptrade;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flint.provider.aggregator.AggregatorAccount;
import com.flint.provider.aggregator.AggregatorAuthorization;
import com.flint.provider.aggregator.AggregatorPosition;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SnapTradePayloadsTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @ParameterizedTest
  @ValueSource(strings = {
      "{\"id\":\"a\",\"brokerage_authorization\":\"auth-1\"}",
      "{\"id\":\"a\",\"brokerage_authorization\":{\"id\":\"auth-1\"}}",
      "{\"id\":\"a\",\"brokerage_authorization_id\":\"auth-1\"}",
      "{\"id\":\"a\",\"brokerageAuthorizationId\":\"auth-1\"}",
      "{\"id\":\"a\",\"authorization_id\":\"auth-1\"}",
      "{\"id\":\"a\",\"authorizationId\":\"auth-1\"}",
      "{\"id\":\"a\",\"connection_id\":\"auth-1\"}",
      "{\"id\":\"a\",\"meta\":{\"brokerage_authorization\":\"auth-1\"}}"
  })
  void resolvesAuthorizationReferenceFromEveryKnownShape(String json) throws Exception {
    assertThat(SnapTradePayloads.resolveAuthorizationId(objectMapper.readTree(json))).isEqualTo("auth-1");
  }

  @Test
  void unresolvableReferenceIsNull() throws Exception {
    JsonNode account = objectMapper.readTree("{\"id\":\"a\",\"brokerage_authorization\":{\"name\":\"x\"}}");

    assertThat(SnapTradePayloads.resolveAuthorizationId(account)).isNull();
  }

  @Test
  void readsAccountsWithNestedBalances() throws Exception {
    JsonNode root = objectMapper.readTree("""
        [{"id":"acc-1","name":"Default","number":"ABC98765",
          "institution_name":"Questrade",
          "meta":{"type":"TFSA"},
          "brokerage_authorization":"auth-1",
          "balance":{"total":{"amount":1520.5,"currency":"CAD"}},
          "cash":"20.50"},
         {"name":"no id"}]
        """);

    List<AggregatorAccount> accounts = SnapTradePayloads.accounts(root);

    assertThat(accounts).hasSize(1);
    AggregatorAccount account = accounts.get(0);
    assertThat(account.authorizationId()).isEqualTo("auth-1");
    assertThat(account.institutionName()).isEqualTo("Questrade");
    assertThat(account.accountType()).isEqualTo("TFSA");
    assertThat(account.currency()).isEqualTo("CAD");
    assertThat(account.totalValue()).isEqualByComparingTo("1520.5");
    assertThat(account.cash()).isEqualByComparingTo("20.50");
  }

  @Test
  void readsAuthorizationsFromWrappedList() throws Exception {
    JsonNode root = objectMapper.readTree("""
        {"data":[{"id":"auth-1","brokerage":{"name":"Alpaca"},"disabled":true},{"name":"missing id"}]}
        """);

    List<AggregatorAuthorization> authorizations = SnapTradePayloads.authorizations(root);

    assertThat(authorizations).containsExactly(new AggregatorAuthorization("auth-1", "Alpaca", true));
  }

  @Test
  void readsPositionsWithNestedSymbol() throws Exception {
    JsonNode root = objectMapper.readTree("""
        [{"symbol":{"symbol":{"symbol":"VTI","description":"Vanguard Total Market",
                              "currency":{"code":"USD"}}},
          "units":3,"price":250.10,"average_purchase_price":200},
         {"symbol":"BAD","units":1}]
        """);

    List<AggregatorPosition> positions = SnapTradePayloads.positions(root);

    assertThat(positions).hasSize(1);
    AggregatorPosition position = positions.get(0);
    assertThat(position.symbol()).isEqualTo("VTI");
    assertThat(position.description()).isEqualTo("Vanguard Total Market");
    assertThat(position.quantity()).isEqualByComparingTo(BigDecimal.valueOf(3));
    assertThat(position.averageCost()).isEqualByComparingTo("200");
    assertThat(position.currency()).isEqualTo("USD");
  }
}
