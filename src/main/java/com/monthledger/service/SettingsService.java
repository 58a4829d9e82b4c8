package com.monthledger.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.monthledger.remote.RemoteBudgetStore;
import com.monthledger.remote.RemoteStoreException;
import com.monthledger.remote.UnauthorizedException;
import com.monthledger.sync.SyncQueue;
import com.monthledger.sync.SyncWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

/**
 * Household-wide settings document. Local patches apply immediately and travel to the remote
 * store like month edits; a queued patch is re-applied on top of whatever the remote returns.
 */
@Service
public class SettingsService {
  private static final Logger log = LoggerFactory.getLogger(SettingsService.class);

  private final RemoteBudgetStore remoteStore;
  private final SyncQueue queue;
  private final SyncWorker syncWorker;
  private final ClientSession session;
  private final ObjectMapper objectMapper;

  private ObjectNode settings;

  public SettingsService(RemoteBudgetStore remoteStore,
                         SyncQueue queue,
                         SyncWorker syncWorker,
                         ClientSession session,
                         ObjectMapper objectMapper) {
    this.remoteStore = remoteStore;
    this.queue = queue;
    this.syncWorker = syncWorker;
    this.session = session;
    this.objectMapper = objectMapper;
    this.settings = objectMapper.createObjectNode();
  }

  public synchronized ObjectNode load() {
    ObjectNode loaded = objectMapper.createObjectNode();
    try {
      JsonNode remote = remoteStore.getSettings();
      if (remote != null && remote.isObject()) {
        loaded.setAll((ObjectNode) remote);
      }
    } catch (UnauthorizedException ex) {
      session.expire();
      throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Session expired");
    } catch (RemoteStoreException ex) {
      log.warn("Could not load settings from remote store: {}", ex.getMessage());
      loaded.setAll(settings);
    }
    queue.settings().ifPresent(pending -> {
      try {
        JsonNode patch = objectMapper.readTree(pending.payload());
        if (patch.isObject()) {
          loaded.setAll((ObjectNode) patch);
        }
      } catch (JsonProcessingException ex) {
        log.warn("Ignoring unreadable pending settings patch");
      }
    });
    settings = loaded;
    return settings.deepCopy();
  }

  public synchronized ObjectNode current() {
    return settings.deepCopy();
  }

  public synchronized ObjectNode patch(JsonNode partial) {
    if (partial == null || !partial.isObject()) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Settings patch must be a JSON object");
    }
    if (!session.isActive()) {
      throw new ResponseStatusException(HttpStatus.CONFLICT, "No active session");
    }
    settings.setAll((ObjectNode) partial.deepCopy());
    syncWorker.writeSettings(partial.deepCopy());
    return settings.deepCopy();
  }

  public synchronized void clear() {
    settings = objectMapper.createObjectNode();
  }
}
