package com.monthledger.sync;

import static org.assertj.core.api.Assertions.assertThat;

import com.monthledger.ledger.LedgerFixtures;
import com.monthledger.model.BudgetData;
import com.monthledger.remote.ClientRejectedException;
import com.monthledger.remote.TransientRemoteException;
import com.monthledger.remote.UnauthorizedException;
import com.monthledger.service.ClientSession;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.NavigableMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SyncReconcilerTest {
  private SyncHarness harness;

  @BeforeEach
  void setUp() {
    harness = new SyncHarness();
    NavigableMap<String, BudgetData> months = LedgerFixtures.emptyMonths("2024-01", "2024-02");
    months.get("2024-01").getJointAccount().setInitialBalance(new BigDecimal("100"));
    harness.open(months);
  }

  @AfterEach
  void tearDown() {
    harness.close();
  }

  @Test
  void pushesLocalValueWhenRemoteIsOlder() {
    harness.remote.seed("2024-01", remoteMonth("5"), SyncHarness.T0.minus(Duration.ofHours(1)));
    harness.queueLocal("2024-01");

    FlushReport report = harness.reconciler.flush();

    assertThat(report.pushed()).containsExactly("2024-01");
    assertThat(harness.queue.isEmpty()).isTrue();
    assertThat(remoteBalance("2024-01")).isEqualByComparingTo("100");
  }

  @Test
  void equalTimestampsPushRatherThanAdopt() {
    harness.remote.seed("2024-01", remoteMonth("5"), SyncHarness.T0);
    harness.queueLocal("2024-01");

    FlushReport report = harness.reconciler.flush();

    assertThat(report.pushed()).containsExactly("2024-01");
    assertThat(report.adopted()).isEmpty();
    assertThat(remoteBalance("2024-01")).isEqualByComparingTo("100");
  }

  @Test
  void strictlyNewerRemoteValueIsAdopted() {
    harness.queueLocal("2024-01");
    harness.remote.seed("2024-01", remoteMonth("500"), SyncHarness.T0.plusSeconds(60));

    FlushReport report = harness.reconciler.flush();

    assertThat(report.adopted()).containsExactly("2024-01");
    assertThat(harness.remote.calls()).doesNotContain("put:2024-01");
    assertThat(harness.store.month("2024-01").orElseThrow().getJointAccount().getInitialBalance())
        .isEqualByComparingTo("500");
    assertThat(harness.queue.isEmpty()).isTrue();
  }

  @Test
  void adoptionCarriesBalanceForwardAndReportsFollowUps() {
    harness.queueLocal("2024-01");
    harness.remote.seed("2024-01", remoteMonth("500"), SyncHarness.T0.plusSeconds(60));

    FlushReport report = harness.reconciler.flush();

    assertThat(report.followUpMonths()).containsExactly("2024-02");
    assertThat(harness.store.month("2024-02").orElseThrow().getJointAccount().getInitialBalance())
        .isEqualByComparingTo("500");
  }

  @Test
  void deletesRunBeforeWrites() {
    harness.remote.seed("2024-02", remoteMonth("0"), SyncHarness.T0.minus(Duration.ofDays(1)));
    harness.queueLocal("2024-01");
    harness.queue.enqueueDelete("2024-02");

    harness.reconciler.flush();

    assertThat(harness.remote.calls())
        .containsExactly("get:2024-02", "delete:2024-02", "get:2024-01", "put:2024-01");
    assertThat(harness.remote.stored("2024-02")).isEmpty();
  }

  @Test
  void deleteOfMonthMissingRemotelyJustClearsTheEntry() {
    harness.queue.enqueueDelete("2024-02");

    FlushReport report = harness.reconciler.flush();

    assertThat(report.pushed()).containsExactly("2024-02");
    assertThat(harness.remote.calls()).containsExactly("get:2024-02");
    assertThat(harness.queue.isEmpty()).isTrue();
  }

  @Test
  void unauthorizedAbortsAndExpiresSession() {
    harness.queueLocal("2024-01");
    harness.queueLocal("2024-02");
    harness.remote.failNext(new UnauthorizedException("token expired", null));

    FlushReport report = harness.reconciler.flush();

    assertThat(report.aborted()).isTrue();
    assertThat(harness.session.getStatus()).isEqualTo(ClientSession.Status.EXPIRED);
    assertThat(harness.queue.upsertKeys()).containsExactly("2024-01", "2024-02");
    assertThat(harness.remote.calls()).containsExactly("get:2024-01");
  }

  @Test
  void rejectedEntryIsDroppedAndFlushContinues() {
    harness.queueLocal("2024-01");
    harness.queueLocal("2024-02");
    harness.remote.failNext(new ClientRejectedException("bad payload", 422, null));

    FlushReport report = harness.reconciler.flush();

    assertThat(report.dropped()).containsExactly("2024-01");
    assertThat(report.pushed()).containsExactly("2024-02");
    assertThat(harness.queue.isEmpty()).isTrue();
  }

  @Test
  void transientFailureRetainsEntryAndContinues() {
    harness.queueLocal("2024-01");
    harness.queueLocal("2024-02");
    harness.remote.failNext(new TransientRemoteException("unavailable", 503, false, null));

    FlushReport report = harness.reconciler.flush();

    assertThat(report.retained()).containsExactly("2024-01");
    assertThat(report.pushed()).containsExactly("2024-02");
    assertThat(report.connectivityLost()).isFalse();
    assertThat(harness.queue.upsertKeys()).containsExactly("2024-01");
  }

  @Test
  void connectivityLossStopsTheFlush() {
    harness.queueLocal("2024-01");
    harness.queueLocal("2024-02");
    harness.remote.failNext(new TransientRemoteException("connection refused", 0, true, null));

    FlushReport report = harness.reconciler.flush();

    assertThat(report.connectivityLost()).isTrue();
    assertThat(harness.remote.calls()).containsExactly("get:2024-01");
    assertThat(harness.queue.upsertCount()).isEqualTo(2);
  }

  @Test
  void editQueuedDuringFlushSurvivesIt() {
    harness.queueLocal("2024-01");
    AtomicBoolean edited = new AtomicBoolean();
    harness.remote.onGet(key -> {
      if (key.equals("2024-01") && edited.compareAndSet(false, true)) {
        harness.clock.advance(Duration.ofSeconds(1));
        harness.store.mutate(months -> {
          months.get("2024-01").getJointAccount().setInitialBalance(new BigDecimal("250"));
          return null;
        });
        harness.queueLocal("2024-01");
      }
    });

    harness.reconciler.flush();

    assertThat(harness.queue.upsertKeys()).containsExactly("2024-01");
    assertThat(remoteBalance("2024-01")).isEqualByComparingTo("100");

    harness.clock.advance(Duration.ofSeconds(1));
    harness.reconciler.flush();

    assertThat(harness.queue.isEmpty()).isTrue();
    assertThat(remoteBalance("2024-01")).isEqualByComparingTo("250");
  }

  @Test
  void newerRemoteNeverReplacesAnUnqueuedLocalEdit() {
    SyncWorker worker = harness.worker(true, 60_000);
    try {
      harness.queueLocal("2024-01");
      harness.remote.seed("2024-01", remoteMonth("500"), SyncHarness.T0.plusSeconds(60));
      AtomicBoolean edited = new AtomicBoolean();
      harness.remote.onGet(key -> {
        if (key.equals("2024-01") && edited.compareAndSet(false, true)) {
          harness.clock.advance(Duration.ofSeconds(120));
          harness.store.mutate(months -> {
            months.get("2024-01").getJointAccount().setInitialBalance(new BigDecimal("777"));
            return null;
          });
          worker.scheduleWrite(List.of("2024-01"));
        }
      });

      FlushReport first = worker.flushNow();

      assertThat(first.adopted()).isEmpty();
      assertThat(first.retained()).containsExactly("2024-01");
      assertThat(localBalance("2024-01")).isEqualByComparingTo("777");

      worker.writeDirtyNow();
      worker.flushNow();

      assertThat(localBalance("2024-01")).isEqualByComparingTo("777");
      assertThat(remoteBalance("2024-01")).isEqualByComparingTo("777");
      assertThat(harness.queue.isEmpty()).isTrue();
    } finally {
      worker.shutdown();
    }
  }

  @Test
  void deleteDoesNotAdoptRemoteOverARecreatedMonth() {
    harness.queue.enqueueDelete("2024-02");
    harness.remote.seed("2024-02", remoteMonth("500"), SyncHarness.T0.plusSeconds(60));
    harness.clock.advance(Duration.ofSeconds(120));

    FlushReport report = harness.reconciler.flush();

    assertThat(report.adopted()).isEmpty();
    assertThat(harness.remote.calls()).containsExactly("get:2024-02", "get:2024-02", "put:2024-02");
    assertThat(remoteBalance("2024-02")).isEqualByComparingTo(localBalance("2024-02"));
    assertThat(harness.queue.isEmpty()).isTrue();
  }

  @Test
  void pendingSettingsArePushedAfterMonths() throws Exception {
    harness.queueLocal("2024-01");
    harness.queue.enqueueSettings(harness.objectMapper.readTree("{\"currency\":\"EUR\"}"));

    FlushReport report = harness.reconciler.flush();

    assertThat(report.settingsPushed()).isTrue();
    assertThat(harness.remote.calls()).endsWith("patchSettings");
    assertThat(harness.remote.storedSettings().get("currency").asText()).isEqualTo("EUR");
    assertThat(harness.queue.hasPendingSettings()).isFalse();
  }

  @Test
  void skipsWhenSessionIsNotActive() {
    harness.queueLocal("2024-01");
    harness.session.end();

    FlushReport report = harness.reconciler.flush();

    assertThat(report.skipped()).isTrue();
    assertThat(harness.remote.calls()).isEmpty();
    assertThat(harness.queue.upsertCount()).isEqualTo(1);
  }

  @Test
  void pushedPayloadBecomesTheSyncedBaseline() {
    String payload = harness.queueLocal("2024-01");

    harness.reconciler.flush();

    assertThat(harness.queue.differsFromSynced("2024-01", payload)).isFalse();
  }

  private BudgetData remoteMonth(String initialBalance) {
    BudgetData data = LedgerFixtures.materializer().emptyMonth();
    data.getJointAccount().setInitialBalance(new BigDecimal(initialBalance));
    return data;
  }

  private BigDecimal localBalance(String monthKey) {
    return harness.store.month(monthKey).orElseThrow().getJointAccount().getInitialBalance();
  }

  private BigDecimal remoteBalance(String monthKey) {
    return harness.remote.stored(monthKey).orElseThrow()
        .data().path("jointAccount").path("initialBalance").decimalValue();
  }
}
