package com.monthledger.service;

import com.monthledger.dto.SessionResponse;
import com.monthledger.ledger.BudgetDataNormalizer;
import com.monthledger.ledger.MonthMaterializer;
import com.monthledger.model.BudgetData;
import com.monthledger.model.MonthKey;
import com.monthledger.remote.RemoteBudgetStore;
import com.monthledger.remote.RemoteMonth;
import com.monthledger.remote.RemoteStoreException;
import com.monthledger.remote.UnauthorizedException;
import com.monthledger.sync.BudgetPayloadCodec;
import com.monthledger.sync.ConnectivityMonitor;
import com.monthledger.sync.LocalStateStore;
import com.monthledger.sync.QueuedUpsert;
import com.monthledger.sync.SyncQueue;
import com.monthledger.sync.SyncWorker;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

/**
 * Opens and closes the ledger around a signed-in user. Opening loads the remote months (or the
 * offline snapshot when the remote store cannot be reached), replays queued edits on top and
 * makes sure the current calendar month exists.
 *
 * <p>Local state (queued edits and the offline snapshot) belongs to the last user who opened a
 * session; signing in as someone else discards it first.
 */
@Service
public class SessionService {
  private static final Logger log = LoggerFactory.getLogger(SessionService.class);
  static final String STATE_OWNER_KEY = "stateOwner";

  private final ClientSession session;
  private final RemoteBudgetStore remoteStore;
  private final BudgetDataNormalizer normalizer;
  private final BudgetPayloadCodec codec;
  private final LedgerStore store;
  private final MonthMaterializer materializer;
  private final SyncQueue queue;
  private final LocalStateStore stateStore;
  private final SyncWorker syncWorker;
  private final ConnectivityMonitor connectivity;
  private final SettingsService settingsService;
  private final LedgerService ledgerService;
  private final Clock clock;

  public SessionService(ClientSession session,
                        RemoteBudgetStore remoteStore,
                        BudgetDataNormalizer normalizer,
                        BudgetPayloadCodec codec,
                        LedgerStore store,
                        MonthMaterializer materializer,
                        SyncQueue queue,
                        LocalStateStore stateStore,
                        SyncWorker syncWorker,
                        ConnectivityMonitor connectivity,
                        SettingsService settingsService,
                        LedgerService ledgerService,
                        Clock clock) {
    this.session = session;
    this.remoteStore = remoteStore;
    this.normalizer = normalizer;
    this.codec = codec;
    this.store = store;
    this.materializer = materializer;
    this.queue = queue;
    this.stateStore = stateStore;
    this.syncWorker = syncWorker;
    this.connectivity = connectivity;
    this.settingsService = settingsService;
    this.ledgerService = ledgerService;
    this.clock = clock;
  }

  public synchronized SessionResponse open(String userId, String accessToken) {
    if (store.isOpen()) {
      syncWorker.handOffPendingWrites();
      store.close();
    }
    session.start(userId, accessToken);
    claimLocalState(userId);
    queue.restore();
    queue.resetSynced();

    SortedMap<String, BudgetData> months = new TreeMap<>();
    boolean offline = false;
    try {
      for (RemoteMonth remote : remoteStore.listMonths()) {
        if (!MonthKey.isValid(remote.monthKey())) {
          log.debug("Ignoring remote month with invalid key {}", remote.monthKey());
          continue;
        }
        BudgetData data = normalizer.normalize(remote.data());
        months.put(remote.monthKey(), data);
        queue.markSynced(remote.monthKey(), codec.encode(data));
      }
      connectivity.markOnline();
    } catch (UnauthorizedException ex) {
      session.expire();
      throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Session expired");
    } catch (RemoteStoreException ex) {
      log.warn("Remote store unavailable ({}), opening offline snapshot", ex.getMessage());
      connectivity.markOffline();
      offline = true;
      months.putAll(store.loadSnapshot());
    }

    for (Map.Entry<String, QueuedUpsert> entry : queue.upsertsSnapshot().entrySet()) {
      try {
        months.put(entry.getKey(), codec.decode(entry.getValue().payload()));
      } catch (IllegalArgumentException ex) {
        log.warn("Skipping unreadable queued write for {}", entry.getKey());
      }
    }
    for (String deleted : queue.deleteKeys()) {
      months.remove(deleted);
    }

    SortedSet<String> toWrite = new TreeSet<>(store.open(months));
    String currentMonth = MonthKey.current(clock);
    if (!store.contains(currentMonth)) {
      LedgerMutation<Void> created = store.mutate(map -> {
        Map.Entry<String, BudgetData> previous = map.lowerEntry(currentMonth);
        map.put(currentMonth, previous == null
            ? materializer.emptyMonth()
            : materializer.deriveFrom(previous.getValue(), currentMonth));
        return null;
      });
      toWrite.addAll(created.changedMonths());
    }
    syncWorker.scheduleWrite(toWrite);

    if (!offline) {
      settingsService.load();
      if (!queue.isEmpty()) {
        syncWorker.requestFlush();
      }
    }
    log.info("Session opened for {} with {} months{}", userId, store.monthKeys().size(),
        offline ? " (offline)" : "");
    return status(offline, currentMonth);
  }

  /**
   * Signs out. Edits still waiting for the debounce are queued so they survive until the next
   * sign-in.
   */
  public synchronized void close() {
    syncWorker.handOffPendingWrites();
    String userId = session.getUserId();
    store.close();
    settingsService.clear();
    session.end();
    log.info("Session closed for {}", userId);
  }

  public synchronized SessionResponse current() {
    return status(!connectivity.isOnline(), store.isOpen() ? MonthKey.current(clock) : null);
  }

  private void claimLocalState(String userId) {
    Optional<String> owner = stateStore.preference(STATE_OWNER_KEY);
    if (owner.isPresent() && owner.get().equals(userId)) {
      return;
    }
    if (owner.isPresent()) {
      log.info("Discarding local state left by another user before opening session for {}", userId);
      queue.discardAll();
      store.discardSnapshot();
    }
    stateStore.savePreference(STATE_OWNER_KEY, userId);
  }

  private SessionResponse status(boolean offline, String currentMonth) {
    return new SessionResponse(
        session.getUserId(),
        session.getStatus(),
        offline,
        store.isOpen() ? new ArrayList<>(store.monthKeys()) : new ArrayList<>(),
        currentMonth,
        session.getUserId() == null ? null : ledgerService.lastViewedMonth());
  }
}
