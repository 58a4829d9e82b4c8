package com.monthledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.monthledger.dto.SessionResponse;
import com.monthledger.ledger.ConflictPolicy;
import com.monthledger.ledger.LedgerFixtures;
import com.monthledger.ledger.MonthEditor;
import com.monthledger.model.BudgetData;
import com.monthledger.remote.TransientRemoteException;
import com.monthledger.remote.UnauthorizedException;
import com.monthledger.sync.QueuedUpsert;
import com.monthledger.sync.SyncHarness;
import com.monthledger.sync.SyncWorker;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class SessionServiceTest {
  private static final Clock MARCH = Clock.fixed(Instant.parse("2024-03-15T09:00:00Z"), ZoneOffset.UTC);

  @Mock
  private SyncWorker syncWorker;

  private SyncHarness harness;
  private SessionService sessionService;

  @BeforeEach
  void setUp() {
    harness = new SyncHarness();
    harness.session.end();
    SettingsService settingsService = new SettingsService(harness.remote, harness.queue, syncWorker,
        harness.session, harness.objectMapper);
    LedgerService ledgerService = new LedgerService(harness.store, LedgerFixtures.engine(ConflictPolicy.NEVER_OVERWRITE),
        LedgerFixtures.materializer(), new MonthEditor(MARCH), syncWorker, harness.stateStore, harness.session,
        LedgerFixtures.LEDGER);
    sessionService = new SessionService(harness.session, harness.remote, harness.normalizer, harness.codec,
        harness.store, LedgerFixtures.materializer(), harness.queue, harness.stateStore, syncWorker,
        harness.connectivity,
        settingsService, ledgerService, MARCH);
  }

  @Test
  void opensRemoteMonthsAndCreatesCurrentMonth() {
    harness.remote.seed("2024-01", withBalance("100"), SyncHarness.T0);
    harness.remote.seed("2024-02", withBalance("100"), SyncHarness.T0);

    SessionResponse response = sessionService.open("user-1", "token");

    assertThat(response.isOffline()).isFalse();
    assertThat(response.getCurrentMonth()).isEqualTo("2024-03");
    assertThat(response.getMonths()).containsExactly("2024-01", "2024-02", "2024-03");
    assertThat(harness.store.month("2024-03").orElseThrow().getJointAccount().getInitialBalance())
        .isEqualByComparingTo("100");
    assertThat(harness.remote.calls()).containsExactly("list", "settings");
    verify(syncWorker).scheduleWrite(argThat(keys -> keys.contains("2024-03")));
    verify(syncWorker, never()).requestFlush();
  }

  @Test
  void fallsBackToSnapshotAndReplaysQueue() {
    harness.stateStore.saveMonths(Map.of(
        "2024-01", harness.codec.encode(withBalance("10")),
        "2024-02", harness.codec.encode(withBalance("10"))));
    harness.stateStore.saveQueuedUpsert("2024-02", new QueuedUpsert(harness.codec.encode(withBalance("77")),
        SyncHarness.T0));
    harness.stateStore.saveQueuedDelete("2024-01", SyncHarness.T0);
    harness.remote.failNext(new TransientRemoteException("refused", 0, true, null));

    SessionResponse response = sessionService.open("user-1", "token");

    assertThat(response.isOffline()).isTrue();
    assertThat(harness.connectivity.isOnline()).isFalse();
    assertThat(response.getMonths()).containsExactly("2024-02", "2024-03");
    assertThat(harness.store.month("2024-02").orElseThrow().getJointAccount().getInitialBalance())
        .isEqualByComparingTo("77");
    assertThat(harness.store.month("2024-03").orElseThrow().getJointAccount().getInitialBalance())
        .isEqualByComparingTo("77");
    assertThat(harness.remote.calls()).containsExactly("list");
  }

  @Test
  void pendingQueueIsFlushedAfterOnlineOpen() {
    harness.stateStore.saveQueuedDelete("2023-12", SyncHarness.T0);

    sessionService.open("user-1", "token");

    verify(syncWorker).requestFlush();
  }

  @Test
  void rejectedCredentialsExpireTheSession() {
    harness.remote.failNext(new UnauthorizedException("expired", null));

    assertThatThrownBy(() -> sessionService.open("user-1", "token"))
        .isInstanceOfSatisfying(ResponseStatusException.class,
            ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED));
    assertThat(harness.session.getStatus()).isEqualTo(ClientSession.Status.EXPIRED);
    assertThat(harness.store.isOpen()).isFalse();
  }

  @Test
  void closeHandsOffPendingWritesAndSignsOut() {
    sessionService.open("user-1", "token");

    sessionService.close();

    verify(syncWorker).handOffPendingWrites();
    assertThat(harness.store.isOpen()).isFalse();
    assertThat(harness.session.getStatus()).isEqualTo(ClientSession.Status.SIGNED_OUT);
    assertThat(sessionService.current().getMonths()).isEmpty();
  }

  @Test
  void anotherUsersLocalStateIsDiscardedOnOpen() {
    harness.stateStore.savePreference(SessionService.STATE_OWNER_KEY, "user-1");
    harness.stateStore.saveMonths(Map.of("2024-01", harness.codec.encode(withBalance("10"))));
    harness.stateStore.saveQueuedUpsert("2024-02", new QueuedUpsert(harness.codec.encode(withBalance("77")),
        SyncHarness.T0));
    harness.stateStore.saveQueuedDelete("2023-12", SyncHarness.T0);
    harness.remote.failNext(new TransientRemoteException("refused", 0, true, null));

    SessionResponse response = sessionService.open("user-2", "token");

    assertThat(response.getMonths()).containsExactly("2024-03");
    assertThat(harness.queue.upsertKeys()).isEmpty();
    assertThat(harness.queue.deleteKeys()).isEmpty();
    assertThat(harness.stateStore.loadQueuedUpserts()).isEmpty();
    assertThat(harness.stateStore.loadQueuedDeletes()).isEmpty();
    assertThat(harness.stateStore.loadSnapshot()).containsOnlyKeys("2024-03");
    assertThat(harness.stateStore.preference(SessionService.STATE_OWNER_KEY)).contains("user-2");
  }

  @Test
  void sameUserKeepsQueuedEditsAcrossSessions() {
    harness.stateStore.savePreference(SessionService.STATE_OWNER_KEY, "user-1");
    harness.stateStore.saveQueuedUpsert("2024-02", new QueuedUpsert(harness.codec.encode(withBalance("77")),
        SyncHarness.T0));
    harness.remote.failNext(new TransientRemoteException("refused", 0, true, null));

    sessionService.open("user-1", "token");

    assertThat(harness.queue.upsertKeys()).containsExactly("2024-02");
    assertThat(harness.store.month("2024-02").orElseThrow().getJointAccount().getInitialBalance())
        .isEqualByComparingTo("77");
  }

  private static BudgetData withBalance(String balance) {
    BudgetData data = LedgerFixtures.materializer().emptyMonth();
    data.getJointAccount().setInitialBalance(new BigDecimal(balance));
    return data;
  }
}
