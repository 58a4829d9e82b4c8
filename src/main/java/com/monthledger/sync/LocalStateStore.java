package com.monthledger.sync;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Durable local state that survives restarts: the offline month snapshot, the sync queue and
 * client preferences such as the last viewed month.
 */
public interface LocalStateStore {
  SortedMap<String, String> loadSnapshot();

  void saveMonths(Map<String, String> payloads);

  void removeMonths(Collection<String> monthKeys);

  SortedMap<String, QueuedUpsert> loadQueuedUpserts();

  SortedMap<String, Instant> loadQueuedDeletes();

  Optional<QueuedSettings> loadQueuedSettings();

  void saveQueuedUpsert(String monthKey, QueuedUpsert upsert);

  void removeQueuedUpsert(String monthKey);

  void saveQueuedDelete(String monthKey, Instant queuedAt);

  void removeQueuedDelete(String monthKey);

  void saveQueuedSettings(QueuedSettings settings);

  void clearQueuedSettings();

  Optional<String> preference(String key);

  void savePreference(String key, String value);
}
