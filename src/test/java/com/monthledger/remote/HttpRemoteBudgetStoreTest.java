package com.monthledger.remote;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withUnauthorizedRequest;

import com.fasterxml.jackson.databind.node.TextNode;
import com.monthledger.model.BudgetData;
import com.monthledger.service.ClientSession;
import java.math.BigDecimal;
import java.net.ConnectException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class HttpRemoteBudgetStoreTest {
  private static final String BASE = "http://remote.test";

  private MockRestServiceServer server;
  private HttpRemoteBudgetStore store;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
    server = MockRestServiceServer.bindTo(builder).build();
    ClientSession session = new ClientSession();
    session.start("user-1", "secret-token");
    store = new HttpRemoteBudgetStore(builder.build(), session);
  }

  @Test
  void listsMonthsWithBearerToken() {
    server.expect(requestTo(BASE + "/api/months"))
        .andExpect(method(HttpMethod.GET))
        .andExpect(header("Authorization", "Bearer secret-token"))
        .andRespond(withSuccess("""
            {"months":[
              {"monthKey":"2024-01","data":{"jointAccount":{"initialBalance":10}},"updatedAt":"2024-01-31T08:00:00Z"},
              {"monthKey":"2024-02","data":{},"updatedAt":1706745600000},
              {"data":{}}
            ]}
            """, MediaType.APPLICATION_JSON));

    List<RemoteMonth> months = store.listMonths();

    assertThat(months).extracting(RemoteMonth::monthKey).containsExactly("2024-01", "2024-02");
    assertThat(months.get(0).updatedAt()).isEqualTo(Instant.parse("2024-01-31T08:00:00Z"));
    assertThat(months.get(1).updatedAt()).isEqualTo(Instant.ofEpochMilli(1706745600000L));
    server.verify();
  }

  @Test
  void missingMonthIsEmpty() {
    server.expect(requestTo(BASE + "/api/months/2024-05")).andRespond(withStatus(HttpStatus.NOT_FOUND));

    Optional<RemoteMonth> month = store.getMonth("2024-05");

    assertThat(month).isEmpty();
  }

  @Test
  void putSendsDataEnvelopeAndReturnsTimestamp() {
    BudgetData data = new BudgetData();
    data.getJointAccount().setInitialBalance(new BigDecimal("120"));
    server.expect(requestTo(BASE + "/api/months/2024-03"))
        .andExpect(method(HttpMethod.PUT))
        .andExpect(jsonPath("$.data.jointAccount.initialBalance").value(120))
        .andRespond(withSuccess("{\"updatedAt\":\"2024-03-01T00:00:00Z\"}", MediaType.APPLICATION_JSON));

    Instant updatedAt = store.putMonth("2024-03", data);

    assertThat(updatedAt).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
    server.verify();
  }

  @Test
  void settingsAreUnwrapped() {
    server.expect(requestTo(BASE + "/api/settings"))
        .andRespond(withSuccess("{\"settings\":{\"currency\":\"EUR\"}}", MediaType.APPLICATION_JSON));

    assertThat(store.getSettings().get("currency").asText()).isEqualTo("EUR");
  }

  @Test
  void unauthorizedMapsToUnauthorizedException() {
    server.expect(requestTo(BASE + "/api/months")).andRespond(withUnauthorizedRequest());

    assertThatThrownBy(() -> store.listMonths()).isInstanceOf(UnauthorizedException.class);
  }

  @Test
  void otherClientErrorsAreRejections() {
    server.expect(requestTo(BASE + "/api/months/2024-03")).andRespond(withBadRequest());

    assertThatThrownBy(() -> store.deleteMonth("2024-03"))
        .isInstanceOfSatisfying(ClientRejectedException.class, ex -> assertThat(ex.getStatus()).isEqualTo(400));
  }

  @Test
  void throttlingAndTimeoutsAreTransient() {
    server.expect(requestTo(BASE + "/api/months/2024-03")).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
    server.expect(requestTo(BASE + "/api/months/2024-04")).andRespond(withStatus(HttpStatus.REQUEST_TIMEOUT));

    assertThatThrownBy(() -> store.deleteMonth("2024-03"))
        .isInstanceOfSatisfying(TransientRemoteException.class, ex -> {
          assertThat(ex.getStatus()).isEqualTo(429);
          assertThat(ex.isConnectivityLoss()).isFalse();
        });
    assertThatThrownBy(() -> store.deleteMonth("2024-04"))
        .isInstanceOfSatisfying(TransientRemoteException.class, ex -> assertThat(ex.getStatus()).isEqualTo(408));
  }

  @Test
  void serverErrorsAreTransient() {
    server.expect(requestTo(BASE + "/api/months")).andRespond(withServerError());

    assertThatThrownBy(() -> store.listMonths())
        .isInstanceOfSatisfying(TransientRemoteException.class, ex -> {
          assertThat(ex.getStatus()).isEqualTo(500);
          assertThat(ex.isConnectivityLoss()).isFalse();
        });
  }

  @Test
  void ioFailuresAreConnectivityLoss() {
    server.expect(requestTo(BASE + "/api/health")).andRespond(withException(new ConnectException("refused")));

    assertThatThrownBy(() -> store.ping())
        .isInstanceOfSatisfying(TransientRemoteException.class,
            ex -> assertThat(ex.isConnectivityLoss()).isTrue());
  }

  @Test
  void parsesOffsetTimestamps() {
    assertThat(HttpRemoteBudgetStore.parseTimestamp(new TextNode("2024-01-31T10:00:00+02:00")))
        .isEqualTo(Instant.parse("2024-01-31T08:00:00Z"));
    assertThat(HttpRemoteBudgetStore.parseTimestamp(new TextNode("yesterday"))).isNull();
  }
}
