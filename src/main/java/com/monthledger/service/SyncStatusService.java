package com.monthledger.service;

import com.monthledger.dto.SyncStatusResponse;
import com.monthledger.sync.ConnectivityMonitor;
import com.monthledger.sync.FlushReport;
import com.monthledger.sync.SyncQueue;
import com.monthledger.sync.SyncState;
import com.monthledger.sync.SyncWorker;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import org.springframework.stereotype.Service;

@Service
public class SyncStatusService {
  private final SyncWorker syncWorker;
  private final SyncQueue queue;
  private final ConnectivityMonitor connectivity;
  private final LedgerStore store;
  private final ClientSession session;

  public SyncStatusService(SyncWorker syncWorker,
                           SyncQueue queue,
                           ConnectivityMonitor connectivity,
                           LedgerStore store,
                           ClientSession session) {
    this.syncWorker = syncWorker;
    this.queue = queue;
    this.connectivity = connectivity;
    this.store = store;
    this.session = session;
  }

  public SyncStatusResponse status() {
    SortedSet<String> keys = new TreeSet<>(store.monthKeys());
    keys.addAll(queue.upsertKeys());
    keys.addAll(queue.deleteKeys());
    Map<String, SyncState> months = new LinkedHashMap<>();
    for (String key : keys) {
      months.put(key, syncWorker.stateOf(key));
    }
    return new SyncStatusResponse(
        connectivity.isOnline(),
        session.getStatus(),
        syncWorker.isFlushInProgress(),
        queue.upsertCount(),
        queue.deleteCount(),
        queue.hasPendingSettings(),
        syncWorker.dirtyCount(),
        months);
  }

  public FlushReport flush() {
    syncWorker.writeDirtyNow();
    return syncWorker.flushAndWait();
  }

  /**
   * Forces the connectivity flag. Going online triggers a flush.
   */
  public SyncStatusResponse setOnline(boolean online) {
    if (online) {
      syncWorker.onReconnected();
    } else {
      connectivity.markOffline();
    }
    return status();
  }
}
