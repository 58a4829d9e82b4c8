package com.monthledger.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.monthledger.config.SyncProperties;
import com.monthledger.model.BudgetData;
import com.monthledger.remote.RemoteBudgetStore;
import com.monthledger.service.ClientSession;
import com.monthledger.service.LedgerStore;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Moves local edits towards the remote store. Writes are debounced per edit burst and sent
 * directly while online; anything that cannot be sent lands in the {@link SyncQueue}. All remote
 * traffic runs on the single-threaded sync {@link TaskScheduler}.
 */
@Component
public class SyncWorker {
  private static final Logger log = LoggerFactory.getLogger(SyncWorker.class);

  private final SyncQueue queue;
  private final SyncReconciler reconciler;
  private final LedgerStore ledgerStore;
  private final RemoteBudgetStore remoteStore;
  private final BudgetPayloadCodec codec;
  private final ConnectivityMonitor connectivity;
  private final ClientSession session;
  private final RemoteFailureClassifier classifier;
  private final SyncProperties syncProperties;

  private final TaskScheduler taskScheduler;
  private final AtomicBoolean flushInProgress = new AtomicBoolean(false);
  private final Set<String> dirty = new LinkedHashSet<>();
  private ScheduledFuture<?> pendingWrite;

  public SyncWorker(SyncQueue queue,
                    SyncReconciler reconciler,
                    LedgerStore ledgerStore,
                    RemoteBudgetStore remoteStore,
                    BudgetPayloadCodec codec,
                    ConnectivityMonitor connectivity,
                    ClientSession session,
                    RemoteFailureClassifier classifier,
                    SyncProperties syncProperties,
                    TaskScheduler taskScheduler) {
    this.queue = queue;
    this.reconciler = reconciler;
    this.ledgerStore = ledgerStore;
    this.remoteStore = remoteStore;
    this.codec = codec;
    this.connectivity = connectivity;
    this.session = session;
    this.classifier = classifier;
    this.syncProperties = syncProperties;
    this.taskScheduler = taskScheduler;
  }

  /**
   * Marks months dirty and (re)starts the debounce timer.
   */
  public synchronized void scheduleWrite(Collection<String> monthKeys) {
    if (monthKeys.isEmpty()) {
      return;
    }
    dirty.addAll(monthKeys);
    if (pendingWrite != null) {
      pendingWrite.cancel(false);
    }
    pendingWrite = taskScheduler.schedule(this::writeDirtyNow,
        taskScheduler.getClock().instant().plusMillis(Math.max(0, syncProperties.debounceMs())));
  }

  /**
   * Sends every dirty month now. Runs on the sync thread after the debounce delay.
   */
  public void writeDirtyNow() {
    for (String monthKey : drainDirty()) {
      writeMonth(monthKey);
    }
  }

  /**
   * Hands dirty months to the queue without contacting the remote store.
   */
  public void handOffPendingWrites() {
    for (String monthKey : drainDirty()) {
      ledgerStore.month(monthKey).ifPresent(data -> {
        String payload = codec.encode(data);
        if (queue.differsFromSynced(monthKey, payload)) {
          queue.enqueueUpsert(monthKey, payload);
        }
      });
    }
  }

  void writeMonth(String monthKey) {
    Optional<BudgetData> current = ledgerStore.month(monthKey);
    if (current.isEmpty()) {
      return;
    }
    String payload = codec.encode(current.get());
    if (!queue.differsFromSynced(monthKey, payload)) {
      return;
    }
    if (!canSendDirectly() || queue.isQueued(monthKey)) {
      queue.enqueueUpsert(monthKey, payload);
      return;
    }
    try {
      remoteStore.putMonth(monthKey, current.get());
      queue.markSynced(monthKey, payload);
      log.debug("Wrote {} to remote store", monthKey);
    } catch (RuntimeException ex) {
      handleDirectFailure(monthKey, ex, () -> queue.enqueueUpsert(monthKey, payload));
    }
  }

  /**
   * Removes a month remotely, or queues the delete when that is not possible right now.
   */
  public void deleteMonth(String monthKey) {
    synchronized (this) {
      dirty.remove(monthKey);
    }
    if (!canSendDirectly()) {
      queue.enqueueDelete(monthKey);
      return;
    }
    try {
      remoteStore.deleteMonth(monthKey);
      queue.cancelUpsert(monthKey);
      queue.forgetSynced(monthKey);
    } catch (RuntimeException ex) {
      handleDirectFailure(monthKey, ex, () -> queue.enqueueDelete(monthKey));
    }
  }

  public void writeSettings(JsonNode patch) {
    if (!canSendDirectly() || queue.hasPendingSettings()) {
      queue.enqueueSettings(patch);
      return;
    }
    try {
      remoteStore.patchSettings(patch);
    } catch (RuntimeException ex) {
      handleDirectFailure("settings", ex, () -> queue.enqueueSettings(patch));
    }
  }

  public void requestFlush() {
    taskScheduler.schedule(this::flushNow, taskScheduler.getClock().instant());
  }

  /**
   * Runs a flush on the sync thread and waits for its report.
   */
  public FlushReport flushAndWait() {
    try {
      return CompletableFuture.supplyAsync(this::flushNow,
          task -> taskScheduler.schedule(task, taskScheduler.getClock().instant())).get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return FlushReport.skippedRun();
    } catch (ExecutionException ex) {
      throw new IllegalStateException("Sync flush failed", ex.getCause());
    }
  }

  /**
   * Runs one flush unless another is already in flight.
   */
  public FlushReport flushNow() {
    if (!syncProperties.enabled() || !flushInProgress.compareAndSet(false, true)) {
      return FlushReport.skippedRun();
    }
    try {
      FlushReport report = reconciler.flush();
      if (report.connectivityLost()) {
        connectivity.markOffline();
      }
      if (!report.followUpMonths().isEmpty()) {
        scheduleWrite(report.followUpMonths());
      }
      return report;
    } finally {
      flushInProgress.set(false);
    }
  }

  public boolean isFlushInProgress() {
    return flushInProgress.get();
  }

  public void onReconnected() {
    if (connectivity.markOnline()) {
      requestFlush();
    }
  }

  public SyncState stateOf(String monthKey) {
    if (reconciler.isReconciling(monthKey)) {
      return SyncState.RECONCILING;
    }
    if (queue.isQueued(monthKey)) {
      return SyncState.QUEUED;
    }
    synchronized (this) {
      if (dirty.contains(monthKey)) {
        return SyncState.DIRTY;
      }
    }
    return SyncState.CLEAN;
  }

  public synchronized int dirtyCount() {
    return dirty.size();
  }

  /**
   * Queues whatever is still dirty; the scheduler itself is stopped by the container.
   */
  @PreDestroy
  public void shutdown() {
    handOffPendingWrites();
  }

  private boolean canSendDirectly() {
    return syncProperties.enabled()
        && connectivity.isOnline()
        && session.isActive()
        && !flushInProgress.get();
  }

  private void handleDirectFailure(String entryKey, RuntimeException failure, Runnable enqueue) {
    switch (classifier.classify(failure)) {
      case UNAUTHORIZED -> {
        enqueue.run();
        session.expire();
      }
      case CLIENT_REJECTED -> log.warn("Remote store rejected {}, not retrying: {}", entryKey, failure.getMessage());
      default -> {
        enqueue.run();
        if (classifier.isConnectivityLoss(failure)) {
          connectivity.markOffline();
        } else {
          log.warn("Transient failure writing {}, queued for retry: {}", entryKey, failure.getMessage());
        }
      }
    }
  }

  private synchronized List<String> drainDirty() {
    if (pendingWrite != null) {
      pendingWrite.cancel(false);
      pendingWrite = null;
    }
    List<String> keys = new ArrayList<>(dirty);
    dirty.clear();
    return keys;
  }
}
