package com.monthledger.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.monthledger.ledger.BudgetDataNormalizer;
import com.monthledger.model.BudgetData;
import com.monthledger.remote.RemoteBudgetStore;
import com.monthledger.remote.RemoteMonth;
import com.monthledger.service.ClientSession;
import com.monthledger.service.LedgerMutation;
import com.monthledger.service.LedgerStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drains the sync queue against the remote store: deletes first, then writes, then settings.
 * A remote month strictly newer than the queued edit wins and replaces the local value; otherwise
 * the local value is pushed and the entry is dropped only once the push succeeded. A local edit
 * made after the queued entry is never replaced by the remote value; it is queued afresh instead.
 *
 * <p>The queue is re-read before every entry, never captured up front.
 */
@Component
public class SyncReconciler {
  private static final Logger log = LoggerFactory.getLogger(SyncReconciler.class);

  private final RemoteBudgetStore remoteStore;
  private final SyncQueue queue;
  private final LedgerStore ledgerStore;
  private final BudgetPayloadCodec codec;
  private final BudgetDataNormalizer normalizer;
  private final RemoteFailureClassifier classifier;
  private final ClientSession session;
  private final ObjectMapper objectMapper;
  private final Set<String> reconciling = ConcurrentHashMap.newKeySet();

  public SyncReconciler(RemoteBudgetStore remoteStore,
                        SyncQueue queue,
                        LedgerStore ledgerStore,
                        BudgetPayloadCodec codec,
                        BudgetDataNormalizer normalizer,
                        RemoteFailureClassifier classifier,
                        ClientSession session,
                        ObjectMapper objectMapper) {
    this.remoteStore = remoteStore;
    this.queue = queue;
    this.ledgerStore = ledgerStore;
    this.codec = codec;
    this.normalizer = normalizer;
    this.classifier = classifier;
    this.session = session;
    this.objectMapper = objectMapper;
  }

  /**
   * Runs one flush. Callers serialize runs; see {@link SyncWorker#flushNow()}.
   */
  public FlushReport flush() {
    if (!session.isActive() || !ledgerStore.isOpen()) {
      return FlushReport.skippedRun();
    }
    Run run = new Run();
    if (flushDeletes(run) && flushUpserts(run)) {
      flushSettings(run);
    }
    FlushReport report = run.report();
    if (!report.pushed().isEmpty() || !report.adopted().isEmpty() || !report.dropped().isEmpty()
        || report.settingsPushed()) {
      log.info("Sync flush: {} pushed, {} adopted, {} dropped, {} retained",
          report.pushed().size(), report.adopted().size(), report.dropped().size(), report.retained().size());
    }
    return report;
  }

  public boolean isReconciling(String monthKey) {
    return reconciling.contains(monthKey);
  }

  private boolean flushDeletes(Run run) {
    for (String monthKey : queue.deleteKeys()) {
      Optional<Instant> queued = queue.delete(monthKey);
      if (queued.isEmpty()) {
        continue;
      }
      Instant queuedAt = queued.get();
      reconciling.add(monthKey);
      try {
        Optional<RemoteMonth> remote = remoteStore.getMonth(monthKey);
        if (remote.isPresent() && isStrictlyNewer(remote.get().updatedAt(), queuedAt)) {
          if (localMovedOn(monthKey, null)) {
            requeueLocal(monthKey, run);
          } else if (queue.removeDeleteIf(monthKey, queuedAt)) {
            adopt(remote.get(), run);
          }
          continue;
        }
        if (remote.isPresent()) {
          remoteStore.deleteMonth(monthKey);
        }
        queue.removeDeleteIf(monthKey, queuedAt);
        queue.forgetSynced(monthKey);
        run.pushed.add(monthKey);
        log.debug("Deleted {} remotely", monthKey);
      } catch (RuntimeException ex) {
        if (!handleFailure(monthKey, ex, () -> queue.removeDeleteIf(monthKey, queuedAt), run)) {
          return false;
        }
      } finally {
        reconciling.remove(monthKey);
      }
    }
    return true;
  }

  private boolean flushUpserts(Run run) {
    for (String monthKey : queue.upsertKeys()) {
      Optional<QueuedUpsert> queued = queue.upsert(monthKey);
      if (queued.isEmpty()) {
        continue;
      }
      QueuedUpsert entry = queued.get();
      reconciling.add(monthKey);
      try {
        BudgetData local;
        try {
          local = codec.decode(entry.payload());
        } catch (IllegalArgumentException ex) {
          log.warn("Dropping unreadable queued write for {}", monthKey);
          queue.removeUpsertIf(monthKey, entry);
          run.dropped.add(monthKey);
          continue;
        }
        Optional<RemoteMonth> remote = remoteStore.getMonth(monthKey);
        if (remote.isPresent() && isStrictlyNewer(remote.get().updatedAt(), entry.queuedAt())) {
          if (localMovedOn(monthKey, entry.payload())) {
            requeueLocal(monthKey, run);
          } else if (queue.removeUpsertIf(monthKey, entry)) {
            adopt(remote.get(), run);
          }
          continue;
        }
        remoteStore.putMonth(monthKey, local);
        queue.markSynced(monthKey, entry.payload());
        queue.removeUpsertIf(monthKey, entry);
        run.pushed.add(monthKey);
        log.debug("Pushed {} to remote store", monthKey);
      } catch (RuntimeException ex) {
        if (!handleFailure(monthKey, ex, () -> queue.removeUpsertIf(monthKey, entry), run)) {
          return false;
        }
      } finally {
        reconciling.remove(monthKey);
      }
    }
    return true;
  }

  private void flushSettings(Run run) {
    Optional<QueuedSettings> queued = queue.settings();
    if (queued.isEmpty()) {
      return;
    }
    QueuedSettings entry = queued.get();
    try {
      JsonNode patch = objectMapper.readTree(entry.payload());
      remoteStore.patchSettings(patch);
      queue.removeSettingsIf(entry);
      run.settingsPushed = true;
    } catch (JsonProcessingException ex) {
      log.warn("Dropping unreadable queued settings patch");
      queue.removeSettingsIf(entry);
    } catch (RuntimeException ex) {
      handleFailure("settings", ex, () -> queue.removeSettingsIf(entry), run);
    }
  }

  /**
   * Whether the ledger holds a month value other than {@code queuedPayload}, i.e. an edit made
   * after the queued entry that has not reached the queue yet. {@code null} stands for a queued
   * delete.
   */
  private boolean localMovedOn(String monthKey, String queuedPayload) {
    Optional<String> current = ledgerStore.month(monthKey).map(codec::encode);
    return current.isPresent() && !current.get().equals(queuedPayload);
  }

  private void requeueLocal(String monthKey, Run run) {
    ledgerStore.month(monthKey).ifPresent(data -> queue.enqueueUpsert(monthKey, codec.encode(data)));
    run.retained.add(monthKey);
    log.info("Kept local edit of {} over an older queued entry, re-queued it", monthKey);
  }

  private void adopt(RemoteMonth remote, Run run) {
    BudgetData data = normalizer.normalize(remote.data());
    LedgerMutation<Void> mutation = ledgerStore.adoptRemote(remote.monthKey(), data);
    queue.markSynced(remote.monthKey(), codec.encode(ledgerStore.month(remote.monthKey()).orElse(data)));
    run.adopted.add(remote.monthKey());
    for (String changed : mutation.changedMonths()) {
      if (!changed.equals(remote.monthKey())) {
        run.followUps.add(changed);
      }
    }
    log.info("Adopted newer remote value for {}", remote.monthKey());
  }

  /**
   * @return {@code false} when the flush must stop
   */
  private boolean handleFailure(String entryKey, RuntimeException failure, Runnable drop, Run run) {
    switch (classifier.classify(failure)) {
      case UNAUTHORIZED -> {
        session.expire();
        run.aborted = true;
        run.retained.add(entryKey);
        return false;
      }
      case CLIENT_REJECTED -> {
        log.warn("Remote store rejected queued change for {}, dropping it: {}", entryKey, failure.getMessage());
        drop.run();
        run.dropped.add(entryKey);
        return true;
      }
      default -> {
        run.retained.add(entryKey);
        if (classifier.isConnectivityLoss(failure)) {
          run.connectivityLost = true;
          return false;
        }
        log.warn("Transient failure syncing {}, will retry: {}", entryKey, failure.getMessage());
        return true;
      }
    }
  }

  private static boolean isStrictlyNewer(Instant remoteUpdatedAt, Instant localQueuedAt) {
    return remoteUpdatedAt != null && localQueuedAt != null && remoteUpdatedAt.isAfter(localQueuedAt);
  }

  private static final class Run {
    private final List<String> pushed = new ArrayList<>();
    private final List<String> adopted = new ArrayList<>();
    private final List<String> dropped = new ArrayList<>();
    private final List<String> retained = new ArrayList<>();
    private final SortedSet<String> followUps = new TreeSet<>();
    private boolean settingsPushed;
    private boolean aborted;
    private boolean connectivityLost;

    private FlushReport report() {
      return new FlushReport(false,
          Collections.unmodifiableList(pushed),
          Collections.unmodifiableList(adopted),
          Collections.unmodifiableList(dropped),
          Collections.unmodifiableList(retained),
          followUps,
          settingsPushed,
          aborted,
          connectivityLost);
    }
  }
}
