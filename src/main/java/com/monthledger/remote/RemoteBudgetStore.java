package com.monthledger.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.monthledger.model.BudgetData;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative copy of the household's months and settings. Every operation may throw
 * {@link UnauthorizedException}, {@link ClientRejectedException} or {@link TransientRemoteException}.
 */
public interface RemoteBudgetStore {
  List<RemoteMonth> listMonths();

  Optional<RemoteMonth> getMonth(String monthKey);

  /**
   * @return the remote modification time of the written record, or {@code null} if not reported
   */
  Instant putMonth(String monthKey, BudgetData data);

  void deleteMonth(String monthKey);

  JsonNode getSettings();

  JsonNode patchSettings(JsonNode partial);

  void ping();
}
