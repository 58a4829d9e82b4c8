package com.monthledger.sync;

import com.monthledger.config.SyncProperties;
import com.monthledger.remote.RemoteBudgetStore;
import com.monthledger.remote.RemoteStoreException;
import com.monthledger.service.ClientSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SyncScheduler {
  private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

  private final SyncWorker worker;
  private final SyncQueue queue;
  private final ConnectivityMonitor connectivity;
  private final RemoteBudgetStore remoteStore;
  private final ClientSession session;
  private final SyncProperties syncProperties;

  public SyncScheduler(SyncWorker worker,
                       SyncQueue queue,
                       ConnectivityMonitor connectivity,
                       RemoteBudgetStore remoteStore,
                       ClientSession session,
                       SyncProperties syncProperties) {
    this.worker = worker;
    this.queue = queue;
    this.connectivity = connectivity;
    this.remoteStore = remoteStore;
    this.session = session;
    this.syncProperties = syncProperties;
  }

  @Scheduled(fixedDelayString = "${monthledger.sync.flush-interval-ms:30000}")
  public void run() {
    if (!syncProperties.enabled() || !session.isActive()) {
      return;
    }
    if (connectivity.isOnline()) {
      if (!queue.isEmpty() && !worker.isFlushInProgress()) {
        worker.requestFlush();
      }
      return;
    }
    try {
      remoteStore.ping();
      worker.onReconnected();
    } catch (RemoteStoreException ex) {
      log.debug("Remote store still unreachable: {}", ex.getMessage());
    }
  }
}
