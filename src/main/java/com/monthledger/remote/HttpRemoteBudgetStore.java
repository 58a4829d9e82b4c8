package com.monthledger.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.monthledger.model.BudgetData;
import com.monthledger.service.ClientSession;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Component
public class HttpRemoteBudgetStore implements RemoteBudgetStore {
  private static final Logger log = LoggerFactory.getLogger(HttpRemoteBudgetStore.class);

  private final RestClient restClient;
  private final ClientSession session;

  public HttpRemoteBudgetStore(@Qualifier("remoteStoreRestClient") RestClient restClient, ClientSession session) {
    this.restClient = restClient;
    this.session = session;
  }

  @Override
  public List<RemoteMonth> listMonths() {
    JsonNode body = call("list months", () -> restClient.get()
        .uri("/api/months")
        .headers(this::authorize)
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .body(JsonNode.class));
    JsonNode months = body == null ? null : (body.isArray() ? body : body.get("months"));
    List<RemoteMonth> result = new ArrayList<>();
    if (months == null || !months.isArray()) {
      return result;
    }
    for (JsonNode month : months) {
      RemoteMonth parsed = toRemoteMonth(month, null);
      if (parsed != null) {
        result.add(parsed);
      }
    }
    return result;
  }

  @Override
  public Optional<RemoteMonth> getMonth(String monthKey) {
    return call("get month " + monthKey, () -> {
      try {
        JsonNode body = restClient.get()
            .uri("/api/months/{monthKey}", monthKey)
            .headers(this::authorize)
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .body(JsonNode.class);
        return Optional.ofNullable(toRemoteMonth(body, monthKey));
      } catch (HttpClientErrorException.NotFound ex) {
        return Optional.empty();
      }
    });
  }

  @Override
  public Instant putMonth(String monthKey, BudgetData data) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("data", data);
    JsonNode response = call("put month " + monthKey, () -> restClient.put()
        .uri("/api/months/{monthKey}", monthKey)
        .headers(this::authorize)
        .contentType(MediaType.APPLICATION_JSON)
        .body(body)
        .retrieve()
        .body(JsonNode.class));
    return response == null ? null : parseTimestamp(response.get("updatedAt"));
  }

  @Override
  public void deleteMonth(String monthKey) {
    call("delete month " + monthKey, () -> restClient.delete()
        .uri("/api/months/{monthKey}", monthKey)
        .headers(this::authorize)
        .retrieve()
        .toBodilessEntity());
  }

  @Override
  public JsonNode getSettings() {
    JsonNode body = call("get settings", () -> restClient.get()
        .uri("/api/settings")
        .headers(this::authorize)
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .body(JsonNode.class));
    return unwrapSettings(body);
  }

  @Override
  public JsonNode patchSettings(JsonNode partial) {
    JsonNode body = call("patch settings", () -> restClient.patch()
        .uri("/api/settings")
        .headers(this::authorize)
        .contentType(MediaType.APPLICATION_JSON)
        .body(partial)
        .retrieve()
        .body(JsonNode.class));
    return unwrapSettings(body);
  }

  @Override
  public void ping() {
    call("health", () -> restClient.get()
        .uri("/api/health")
        .retrieve()
        .toBodilessEntity());
  }

  private void authorize(HttpHeaders headers) {
    String token = session.getAccessToken();
    if (token != null && !token.isBlank()) {
      headers.setBearerAuth(token);
    }
  }

  private <T> T call(String operation, Supplier<T> request) {
    try {
      return request.get();
    } catch (HttpClientErrorException.Unauthorized ex) {
      throw new UnauthorizedException("Remote store rejected credentials during " + operation, ex);
    } catch (HttpClientErrorException ex) {
      int status = ex.getStatusCode().value();
      if (RemoteStoreException.isRetryableClientStatus(status)) {
        throw new TransientRemoteException(
            "Remote store asked to retry " + operation + " later (" + status + ")", status, false, ex);
      }
      throw new ClientRejectedException("Remote store rejected " + operation + " (" + status + ")", status, ex);
    } catch (HttpServerErrorException ex) {
      throw new TransientRemoteException(
          "Remote store failed " + operation + " (" + ex.getStatusCode().value() + ")",
          ex.getStatusCode().value(), false, ex);
    } catch (RestClientResponseException ex) {
      throw new TransientRemoteException(
          "Unexpected response during " + operation + " (" + ex.getStatusCode().value() + ")",
          ex.getStatusCode().value(), false, ex);
    } catch (ResourceAccessException ex) {
      throw new TransientRemoteException("Remote store unreachable during " + operation, 0, true, ex);
    } catch (RestClientException ex) {
      log.debug("Remote store call {} failed: {}", operation, ex.getMessage());
      throw new TransientRemoteException("Remote store call failed during " + operation, 0, false, ex);
    }
  }

  private static RemoteMonth toRemoteMonth(JsonNode node, String fallbackKey) {
    if (node == null || !node.isObject()) {
      return null;
    }
    JsonNode keyNode = node.get("monthKey");
    String monthKey = keyNode != null && keyNode.isTextual() ? keyNode.asText() : fallbackKey;
    if (monthKey == null) {
      return null;
    }
    return new RemoteMonth(monthKey, node.get("data"), parseTimestamp(node.get("updatedAt")));
  }

  private static JsonNode unwrapSettings(JsonNode body) {
    if (body != null && body.has("settings") && body.get("settings").isObject()) {
      return body.get("settings");
    }
    return body;
  }

  static Instant parseTimestamp(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      return Instant.ofEpochMilli(node.asLong());
    }
    String text = node.asText();
    if (text.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(text);
    } catch (DateTimeParseException ex) {
      try {
        return OffsetDateTime.parse(text).toInstant();
      } catch (DateTimeParseException ignored) {
        log.debug("Ignoring unparseable remote timestamp {}", text);
        return null;
      }
    }
  }
}
