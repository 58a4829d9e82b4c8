package com.monthledger.sync;

import static org.assertj.core.api.Assertions.assertThat;

import com.monthledger.ledger.LedgerFixtures;
import com.monthledger.remote.ClientRejectedException;
import com.monthledger.remote.TransientRemoteException;
import com.monthledger.remote.UnauthorizedException;
import com.monthledger.service.ClientSession;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SyncWorkerTest {
  private SyncHarness harness;
  private SyncWorker worker;

  @BeforeEach
  void setUp() {
    harness = new SyncHarness();
    harness.open(LedgerFixtures.emptyMonths("2024-01", "2024-02"));
    worker = harness.worker(true, 60_000);
  }

  @AfterEach
  void tearDown() {
    worker.shutdown();
    harness.close();
  }

  @Test
  void writesDirectlyWhileOnline() {
    worker.writeMonth("2024-01");

    assertThat(harness.remote.calls()).containsExactly("put:2024-01");
    assertThat(harness.queue.isEmpty()).isTrue();
    assertThat(worker.stateOf("2024-01")).isEqualTo(SyncState.CLEAN);
  }

  @Test
  void unchangedMonthIsNotWrittenTwice() {
    worker.writeMonth("2024-01");
    worker.writeMonth("2024-01");

    assertThat(harness.remote.calls()).containsExactly("put:2024-01");
  }

  @Test
  void queuesWhileOffline() {
    harness.connectivity.markOffline();

    worker.writeMonth("2024-01");

    assertThat(harness.remote.calls()).isEmpty();
    assertThat(worker.stateOf("2024-01")).isEqualTo(SyncState.QUEUED);
  }

  @Test
  void queuesBehindAnAlreadyQueuedEntry() {
    harness.queueLocal("2024-01");
    changeBalance("2024-01", "42");

    worker.writeMonth("2024-01");

    assertThat(harness.remote.calls()).isEmpty();
    assertThat(harness.codec.decode(harness.queue.upsert("2024-01").orElseThrow().payload())
        .getJointAccount().getInitialBalance()).isEqualByComparingTo("42");
  }

  @Test
  void connectivityLossQueuesAndGoesOffline() {
    harness.remote.failNext(new TransientRemoteException("refused", 0, true, null));

    worker.writeMonth("2024-01");

    assertThat(harness.queue.upsertKeys()).containsExactly("2024-01");
    assertThat(harness.connectivity.isOnline()).isFalse();
  }

  @Test
  void unauthorizedQueuesAndExpiresSession() {
    harness.remote.failNext(new UnauthorizedException("expired", null));

    worker.writeMonth("2024-01");

    assertThat(harness.queue.upsertKeys()).containsExactly("2024-01");
    assertThat(harness.session.getStatus()).isEqualTo(ClientSession.Status.EXPIRED);
  }

  @Test
  void rejectedWriteIsNotRetried() {
    harness.remote.failNext(new ClientRejectedException("invalid", 400, null));

    worker.writeMonth("2024-01");

    assertThat(harness.queue.isEmpty()).isTrue();
  }

  @Test
  void deleteIsQueuedWhenSignedOut() {
    harness.session.end();

    worker.deleteMonth("2024-02");

    assertThat(harness.queue.deleteKeys()).containsExactly("2024-02");
    assertThat(harness.remote.calls()).isEmpty();
  }

  @Test
  void deleteGoesStraightToRemoteWhileOnline() {
    harness.queueLocal("2024-02");

    worker.deleteMonth("2024-02");

    assertThat(harness.remote.calls()).containsExactly("delete:2024-02");
    assertThat(harness.queue.isEmpty()).isTrue();
  }

  @Test
  void pendingWritesAreHandedToTheQueue() {
    changeBalance("2024-01", "7");
    worker.scheduleWrite(List.of("2024-01"));
    assertThat(worker.stateOf("2024-01")).isEqualTo(SyncState.DIRTY);

    worker.handOffPendingWrites();

    assertThat(worker.dirtyCount()).isZero();
    assertThat(worker.stateOf("2024-01")).isEqualTo(SyncState.QUEUED);
    assertThat(harness.remote.calls()).isEmpty();
  }

  @Test
  void flushReportingConnectivityLossMarksOffline() {
    harness.queueLocal("2024-01");
    harness.remote.failNext(new TransientRemoteException("refused", 0, true, null));

    FlushReport report = worker.flushNow();

    assertThat(report.connectivityLost()).isTrue();
    assertThat(harness.connectivity.isOnline()).isFalse();
    assertThat(worker.isFlushInProgress()).isFalse();
  }

  @Test
  void flushDrainsQueueOnTheSyncThread() {
    harness.queueLocal("2024-01");

    FlushReport report = worker.flushAndWait();

    assertThat(report.pushed()).containsExactly("2024-01");
    assertThat(harness.queue.isEmpty()).isTrue();
  }

  @Test
  void disabledWorkerNeverFlushes() {
    SyncWorker disabled = harness.worker(false, 0);
    harness.queueLocal("2024-01");
    try {
      assertThat(disabled.flushNow().skipped()).isTrue();
      assertThat(harness.queue.upsertCount()).isEqualTo(1);
    } finally {
      disabled.shutdown();
    }
  }

  @Test
  void burstOfEditsIsWrittenOnceWithTheLatestValue() throws Exception {
    SyncWorker debounced = harness.worker(true, 200);
    try {
      changeBalance("2024-01", "10");
      debounced.scheduleWrite(List.of("2024-01"));
      changeBalance("2024-01", "20");
      debounced.scheduleWrite(List.of("2024-01"));

      long deadline = System.currentTimeMillis() + 5_000;
      while (harness.remote.calls().isEmpty() && System.currentTimeMillis() < deadline) {
        Thread.sleep(20);
      }
      Thread.sleep(400);

      assertThat(harness.remote.calls()).containsExactly("put:2024-01");
      assertThat(harness.remote.stored("2024-01").orElseThrow()
          .data().path("jointAccount").path("initialBalance").decimalValue()).isEqualByComparingTo("20");
      assertThat(debounced.dirtyCount()).isZero();
    } finally {
      debounced.shutdown();
    }
  }

  @Test
  void requestedFlushRunsOnTheScheduler() throws Exception {
    harness.queueLocal("2024-01");

    worker.requestFlush();

    long deadline = System.currentTimeMillis() + 5_000;
    while (!harness.queue.isEmpty() && System.currentTimeMillis() < deadline) {
      Thread.sleep(20);
    }
    assertThat(harness.queue.isEmpty()).isTrue();
    assertThat(harness.remote.calls()).containsExactly("get:2024-01", "put:2024-01");
  }

  private void changeBalance(String monthKey, String balance) {
    harness.store.mutate(months -> {
      months.get(monthKey).getJointAccount().setInitialBalance(new BigDecimal(balance));
      return null;
    });
  }
}
