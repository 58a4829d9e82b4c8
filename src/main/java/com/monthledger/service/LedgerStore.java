package com.monthledger.service;

import com.monthledger.ledger.JointBalanceCarryover;
import com.monthledger.model.BudgetData;
import com.monthledger.sync.BudgetPayloadCodec;
import com.monthledger.sync.LocalStateStore;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sole owner of the in-memory month map. Every change runs against a private copy and replaces
 * the map only when the action completes, then carries the joint balance forward and writes the
 * touched months to the offline snapshot.
 */
@Component
public class LedgerStore {
  private static final Logger log = LoggerFactory.getLogger(LedgerStore.class);

  private final LocalStateStore stateStore;
  private final BudgetPayloadCodec codec;
  private final JointBalanceCarryover carryover;

  private NavigableMap<String, BudgetData> months = new TreeMap<>();
  private boolean open;

  public LedgerStore(LocalStateStore stateStore, BudgetPayloadCodec codec, JointBalanceCarryover carryover) {
    this.stateStore = stateStore;
    this.codec = codec;
    this.carryover = carryover;
  }

  /**
   * Replaces the whole map, recomputes carryover from the first month and rewrites the snapshot.
   *
   * @return months whose opening balance had to be corrected
   */
  public synchronized SortedSet<String> open(SortedMap<String, BudgetData> initial) {
    NavigableMap<String, BudgetData> loaded = new TreeMap<>();
    initial.forEach((key, value) -> loaded.put(key, value.copy()));
    SortedSet<String> corrected = loaded.isEmpty()
        ? new TreeSet<>()
        : carryover.recarryFrom(loaded, loaded.firstKey());
    SortedSet<String> stale = new TreeSet<>(stateStore.loadSnapshot().keySet());
    stale.removeAll(loaded.keySet());
    stateStore.removeMonths(stale);
    stateStore.saveMonths(encode(loaded, loaded.keySet()));
    months = loaded;
    open = true;
    log.info("Ledger opened with {} months", months.size());
    return corrected;
  }

  public synchronized void close() {
    months = new TreeMap<>();
    open = false;
  }

  public synchronized boolean isOpen() {
    return open;
  }

  /**
   * Drops the persisted offline snapshot. Only valid while the ledger is closed.
   */
  public synchronized void discardSnapshot() {
    if (open) {
      throw new IllegalStateException("Ledger is open");
    }
    stateStore.removeMonths(stateStore.loadSnapshot().keySet());
  }

  /**
   * Reads the offline snapshot. Unreadable entries are skipped.
   */
  public SortedMap<String, BudgetData> loadSnapshot() {
    SortedMap<String, BudgetData> result = new TreeMap<>();
    for (Map.Entry<String, String> entry : stateStore.loadSnapshot().entrySet()) {
      try {
        result.put(entry.getKey(), codec.decode(entry.getValue()));
      } catch (IllegalArgumentException ex) {
        log.warn("Skipping unreadable snapshot for {}", entry.getKey());
      }
    }
    return result;
  }

  /**
   * Applies {@code action} atomically. If it throws, the map is left untouched.
   */
  public synchronized <T> LedgerMutation<T> mutate(Function<NavigableMap<String, BudgetData>, T> action) {
    requireOpen();
    NavigableMap<String, BudgetData> working = deepCopy(months);
    T result = action.apply(working);

    String carryStart = earliestAffected(working);
    if (carryStart != null) {
      carryover.recarryFrom(working, carryStart);
    }

    SortedSet<String> changed = new TreeSet<>();
    for (Map.Entry<String, BudgetData> entry : working.entrySet()) {
      if (!Objects.equals(months.get(entry.getKey()), entry.getValue())) {
        changed.add(entry.getKey());
      }
    }
    SortedSet<String> removed = new TreeSet<>(months.keySet());
    removed.removeAll(working.keySet());

    months = working;
    if (!changed.isEmpty()) {
      stateStore.saveMonths(encode(working, changed));
    }
    if (!removed.isEmpty()) {
      stateStore.removeMonths(removed);
    }
    return new LedgerMutation<>(result, changed, removed);
  }

  /**
   * Installs a month value that came from the remote store.
   */
  public LedgerMutation<Void> adoptRemote(String monthKey, BudgetData data) {
    return mutate(map -> {
      map.put(monthKey, data.copy());
      return null;
    });
  }

  public synchronized Optional<BudgetData> month(String monthKey) {
    BudgetData data = months.get(monthKey);
    return data == null ? Optional.empty() : Optional.of(data.copy());
  }

  public synchronized NavigableMap<String, BudgetData> snapshot() {
    return deepCopy(months);
  }

  public synchronized SortedSet<String> monthKeys() {
    return new TreeSet<>(months.keySet());
  }

  public synchronized boolean contains(String monthKey) {
    return months.containsKey(monthKey);
  }

  private String earliestAffected(NavigableMap<String, BudgetData> working) {
    String earliest = null;
    for (Map.Entry<String, BudgetData> entry : working.entrySet()) {
      if (!Objects.equals(months.get(entry.getKey()), entry.getValue())) {
        earliest = entry.getKey();
        break;
      }
    }
    for (String key : months.keySet()) {
      if (!working.containsKey(key)) {
        String predecessor = working.lowerKey(key);
        if (predecessor != null && (earliest == null || predecessor.compareTo(earliest) < 0)) {
          earliest = predecessor;
        }
        break;
      }
    }
    return earliest;
  }

  private Map<String, String> encode(NavigableMap<String, BudgetData> source, Iterable<String> keys) {
    Map<String, String> payloads = new LinkedHashMap<>();
    for (String key : keys) {
      payloads.put(key, codec.encode(source.get(key)));
    }
    return payloads;
  }

  private void requireOpen() {
    if (!open) {
      throw new IllegalStateException("Ledger is not open");
    }
  }

  private static NavigableMap<String, BudgetData> deepCopy(NavigableMap<String, BudgetData> source) {
    NavigableMap<String, BudgetData> copy = new TreeMap<>();
    source.forEach((key, value) -> copy.put(key, value.copy()));
    return copy;
  }
}
