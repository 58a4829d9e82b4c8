package com.monthledger.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Edits not yet confirmed by the remote store, plus the last payload known to be written for
 * each month. Every change is persisted through {@link LocalStateStore} before returning.
 *
 * <p>Entries are only ever removed with the exact value a caller read earlier
 * ({@link #removeUpsertIf}), so an edit queued while a flush is in flight survives that flush.
 */
@Component
public class SyncQueue {
  private static final Logger log = LoggerFactory.getLogger(SyncQueue.class);

  private final LocalStateStore stateStore;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  private final Map<String, String> lastSynced = new HashMap<>();
  private final SortedMap<String, QueuedUpsert> upserts = new TreeMap<>();
  private final SortedMap<String, Instant> deletes = new TreeMap<>();
  private QueuedSettings settings;

  public SyncQueue(LocalStateStore stateStore, ObjectMapper objectMapper, Clock clock) {
    this.stateStore = stateStore;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  public synchronized void restore() {
    upserts.clear();
    deletes.clear();
    upserts.putAll(stateStore.loadQueuedUpserts());
    deletes.putAll(stateStore.loadQueuedDeletes());
    settings = stateStore.loadQueuedSettings().orElse(null);
    if (!isEmpty()) {
      log.info("Restored sync queue: {} upserts, {} deletes, settings pending: {}",
          upserts.size(), deletes.size(), settings != null);
    }
  }

  /**
   * Forgets every queued change, in memory and in the local state store.
   */
  public synchronized void discardAll() {
    stateStore.loadQueuedUpserts().keySet().forEach(stateStore::removeQueuedUpsert);
    stateStore.loadQueuedDeletes().keySet().forEach(stateStore::removeQueuedDelete);
    stateStore.clearQueuedSettings();
    upserts.clear();
    deletes.clear();
    settings = null;
    lastSynced.clear();
  }

  public synchronized void markSynced(String monthKey, String payload) {
    lastSynced.put(monthKey, payload);
  }

  public synchronized void forgetSynced(String monthKey) {
    lastSynced.remove(monthKey);
  }

  public synchronized void resetSynced() {
    lastSynced.clear();
  }

  public synchronized boolean differsFromSynced(String monthKey, String payload) {
    return !Objects.equals(lastSynced.get(monthKey), payload);
  }

  /**
   * Queues a write, replacing any earlier queued write for the month. A pending delete for the
   * same month is superseded.
   */
  public synchronized QueuedUpsert enqueueUpsert(String monthKey, String payload) {
    QueuedUpsert upsert = new QueuedUpsert(payload, clock.instant());
    upserts.put(monthKey, upsert);
    stateStore.saveQueuedUpsert(monthKey, upsert);
    if (deletes.remove(monthKey) != null) {
      stateStore.removeQueuedDelete(monthKey);
    }
    log.debug("Queued write for {}", monthKey);
    return upsert;
  }

  /**
   * Queues a delete and cancels any pending write for the month.
   */
  public synchronized Instant enqueueDelete(String monthKey) {
    Instant queuedAt = clock.instant();
    if (upserts.remove(monthKey) != null) {
      stateStore.removeQueuedUpsert(monthKey);
    }
    deletes.put(monthKey, queuedAt);
    stateStore.saveQueuedDelete(monthKey, queuedAt);
    log.debug("Queued delete for {}", monthKey);
    return queuedAt;
  }

  public synchronized void cancelUpsert(String monthKey) {
    if (upserts.remove(monthKey) != null) {
      stateStore.removeQueuedUpsert(monthKey);
    }
  }

  /**
   * Merges {@code patch} into the pending settings write, later keys winning.
   */
  public synchronized QueuedSettings enqueueSettings(JsonNode patch) {
    ObjectNode merged = settings == null ? objectMapper.createObjectNode() : parseSettings(settings.payload());
    if (patch != null && patch.isObject()) {
      merged.setAll((ObjectNode) patch);
    }
    try {
      settings = new QueuedSettings(objectMapper.writeValueAsString(merged), clock.instant());
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize settings patch", ex);
    }
    stateStore.saveQueuedSettings(settings);
    return settings;
  }

  public synchronized Optional<QueuedUpsert> upsert(String monthKey) {
    return Optional.ofNullable(upserts.get(monthKey));
  }

  public synchronized Optional<Instant> delete(String monthKey) {
    return Optional.ofNullable(deletes.get(monthKey));
  }

  public synchronized Optional<QueuedSettings> settings() {
    return Optional.ofNullable(settings);
  }

  public synchronized List<String> upsertKeys() {
    return new ArrayList<>(upserts.keySet());
  }

  public synchronized List<String> deleteKeys() {
    return new ArrayList<>(deletes.keySet());
  }

  public synchronized SortedMap<String, QueuedUpsert> upsertsSnapshot() {
    return new TreeMap<>(upserts);
  }

  /**
   * Removes the queued write only if it is still {@code expected}.
   */
  public synchronized boolean removeUpsertIf(String monthKey, QueuedUpsert expected) {
    if (!Objects.equals(upserts.get(monthKey), expected)) {
      return false;
    }
    upserts.remove(monthKey);
    stateStore.removeQueuedUpsert(monthKey);
    return true;
  }

  public synchronized boolean removeDeleteIf(String monthKey, Instant expectedQueuedAt) {
    if (!Objects.equals(deletes.get(monthKey), expectedQueuedAt)) {
      return false;
    }
    deletes.remove(monthKey);
    stateStore.removeQueuedDelete(monthKey);
    return true;
  }

  public synchronized boolean removeSettingsIf(QueuedSettings expected) {
    if (!Objects.equals(settings, expected)) {
      return false;
    }
    settings = null;
    stateStore.clearQueuedSettings();
    return true;
  }

  public synchronized boolean isQueued(String monthKey) {
    return upserts.containsKey(monthKey) || deletes.containsKey(monthKey);
  }

  public synchronized boolean isEmpty() {
    return upserts.isEmpty() && deletes.isEmpty() && settings == null;
  }

  public synchronized int upsertCount() {
    return upserts.size();
  }

  public synchronized int deleteCount() {
    return deletes.size();
  }

  public synchronized boolean hasPendingSettings() {
    return settings != null;
  }

  ObjectNode parseSettings(String payload) {
    try {
      JsonNode node = objectMapper.readTree(payload);
      return node != null && node.isObject() ? (ObjectNode) node : objectMapper.createObjectNode();
    } catch (JsonProcessingException ex) {
      log.warn("Discarding unreadable pending settings payload");
      return objectMapper.createObjectNode();
    }
  }
}
