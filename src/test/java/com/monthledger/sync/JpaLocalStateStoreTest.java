package com.monthledger.sync;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

@DataJpaTest
@Import(JpaLocalStateStore.class)
class JpaLocalStateStoreTest {
  private static final Instant QUEUED_AT = Instant.parse("2024-05-01T10:00:00Z");

  @Autowired
  private JpaLocalStateStore stateStore;

  @Test
  void snapshotRowsAreUpsertedAndRemoved() {
    stateStore.saveMonths(Map.of("2024-01", "{\"a\":1}", "2024-02", "{\"a\":2}"));
    stateStore.saveMonths(Map.of("2024-01", "{\"a\":3}"));
    stateStore.removeMonths(List.of("2024-02", "2030-01"));

    assertThat(stateStore.loadSnapshot()).containsExactly(Map.entry("2024-01", "{\"a\":3}"));
  }

  @Test
  void queuedWritesAndDeletesRoundTrip() {
    stateStore.saveQueuedUpsert("2024-03", new QueuedUpsert("{}", QUEUED_AT));
    stateStore.saveQueuedUpsert("2024-03", new QueuedUpsert("{\"v\":2}", QUEUED_AT.plusSeconds(5)));
    stateStore.saveQueuedDelete("2024-04", QUEUED_AT);

    assertThat(stateStore.loadQueuedUpserts())
        .containsExactly(Map.entry("2024-03", new QueuedUpsert("{\"v\":2}", QUEUED_AT.plusSeconds(5))));
    assertThat(stateStore.loadQueuedDeletes()).containsEntry("2024-04", QUEUED_AT);

    stateStore.removeQueuedUpsert("2024-03");
    stateStore.removeQueuedDelete("2024-04");

    assertThat(stateStore.loadQueuedUpserts()).isEmpty();
    assertThat(stateStore.loadQueuedDeletes()).isEmpty();
  }

  @Test
  void settingsPatchIsASingleRow() {
    stateStore.saveQueuedSettings(new QueuedSettings("{\"a\":1}", QUEUED_AT));
    stateStore.saveQueuedSettings(new QueuedSettings("{\"a\":2}", QUEUED_AT));

    assertThat(stateStore.loadQueuedSettings()).contains(new QueuedSettings("{\"a\":2}", QUEUED_AT));

    stateStore.clearQueuedSettings();

    assertThat(stateStore.loadQueuedSettings()).isEmpty();
  }

  @Test
  void preferencesAreOverwritten() {
    stateStore.savePreference("lastViewedMonth:user-1", "2024-01");
    stateStore.savePreference("lastViewedMonth:user-1", "2024-02");

    assertThat(stateStore.preference("lastViewedMonth:user-1")).contains("2024-02");
    assertThat(stateStore.preference("missing")).isEmpty();
  }
}
