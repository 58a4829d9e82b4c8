package com.monthledger.sync;

import com.monthledger.model.ClientPreference;
import com.monthledger.model.MonthSnapshot;
import com.monthledger.model.PendingMonthDelete;
import com.monthledger.model.PendingMonthWrite;
import com.monthledger.model.PendingSettingsWrite;
import com.monthledger.repository.ClientPreferenceRepository;
import com.monthledger.repository.MonthSnapshotRepository;
import com.monthledger.repository.PendingMonthDeleteRepository;
import com.monthledger.repository.PendingMonthWriteRepository;
import com.monthledger.repository.PendingSettingsWriteRepository;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class JpaLocalStateStore implements LocalStateStore {
  private final MonthSnapshotRepository snapshotRepository;
  private final PendingMonthWriteRepository writeRepository;
  private final PendingMonthDeleteRepository deleteRepository;
  private final PendingSettingsWriteRepository settingsRepository;
  private final ClientPreferenceRepository preferenceRepository;

  public JpaLocalStateStore(MonthSnapshotRepository snapshotRepository,
                            PendingMonthWriteRepository writeRepository,
                            PendingMonthDeleteRepository deleteRepository,
                            PendingSettingsWriteRepository settingsRepository,
                            ClientPreferenceRepository preferenceRepository) {
    this.snapshotRepository = snapshotRepository;
    this.writeRepository = writeRepository;
    this.deleteRepository = deleteRepository;
    this.settingsRepository = settingsRepository;
    this.preferenceRepository = preferenceRepository;
  }

  @Override
  @Transactional(readOnly = true)
  public SortedMap<String, String> loadSnapshot() {
    SortedMap<String, String> result = new TreeMap<>();
    for (MonthSnapshot snapshot : snapshotRepository.findAllByOrderByMonthKeyAsc()) {
      result.put(snapshot.getMonthKey(), snapshot.getPayload());
    }
    return result;
  }

  @Override
  public void saveMonths(Map<String, String> payloads) {
    for (Map.Entry<String, String> entry : payloads.entrySet()) {
      MonthSnapshot snapshot = snapshotRepository.findById(entry.getKey())
          .orElseGet(() -> new MonthSnapshot(entry.getKey(), entry.getValue()));
      snapshot.setPayload(entry.getValue());
      snapshotRepository.save(snapshot);
    }
  }

  @Override
  public void removeMonths(Collection<String> monthKeys) {
    for (String monthKey : monthKeys) {
      if (snapshotRepository.existsById(monthKey)) {
        snapshotRepository.deleteById(monthKey);
      }
    }
  }

  @Override
  @Transactional(readOnly = true)
  public SortedMap<String, QueuedUpsert> loadQueuedUpserts() {
    SortedMap<String, QueuedUpsert> result = new TreeMap<>();
    for (PendingMonthWrite write : writeRepository.findAllByOrderByMonthKeyAsc()) {
      result.put(write.getMonthKey(), new QueuedUpsert(write.getPayload(), write.getQueuedAt()));
    }
    return result;
  }

  @Override
  @Transactional(readOnly = true)
  public SortedMap<String, Instant> loadQueuedDeletes() {
    SortedMap<String, Instant> result = new TreeMap<>();
    for (PendingMonthDelete delete : deleteRepository.findAllByOrderByMonthKeyAsc()) {
      result.put(delete.getMonthKey(), delete.getQueuedAt());
    }
    return result;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<QueuedSettings> loadQueuedSettings() {
    return settingsRepository.findById(PendingSettingsWrite.SINGLETON_ID)
        .map(write -> new QueuedSettings(write.getPayload(), write.getQueuedAt()));
  }

  @Override
  public void saveQueuedUpsert(String monthKey, QueuedUpsert upsert) {
    PendingMonthWrite write = writeRepository.findById(monthKey)
        .orElseGet(() -> new PendingMonthWrite(monthKey, upsert.payload(), upsert.queuedAt()));
    write.setPayload(upsert.payload());
    write.setQueuedAt(upsert.queuedAt());
    writeRepository.save(write);
  }

  @Override
  public void removeQueuedUpsert(String monthKey) {
    if (writeRepository.existsById(monthKey)) {
      writeRepository.deleteById(monthKey);
    }
  }

  @Override
  public void saveQueuedDelete(String monthKey, Instant queuedAt) {
    PendingMonthDelete delete = deleteRepository.findById(monthKey)
        .orElseGet(() -> new PendingMonthDelete(monthKey, queuedAt));
    delete.setQueuedAt(queuedAt);
    deleteRepository.save(delete);
  }

  @Override
  public void removeQueuedDelete(String monthKey) {
    if (deleteRepository.existsById(monthKey)) {
      deleteRepository.deleteById(monthKey);
    }
  }

  @Override
  public void saveQueuedSettings(QueuedSettings settings) {
    PendingSettingsWrite write = settingsRepository.findById(PendingSettingsWrite.SINGLETON_ID)
        .orElseGet(() -> new PendingSettingsWrite(settings.payload(), settings.queuedAt()));
    write.setPayload(settings.payload());
    write.setQueuedAt(settings.queuedAt());
    settingsRepository.save(write);
  }

  @Override
  public void clearQueuedSettings() {
    if (settingsRepository.existsById(PendingSettingsWrite.SINGLETON_ID)) {
      settingsRepository.deleteById(PendingSettingsWrite.SINGLETON_ID);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<String> preference(String key) {
    return preferenceRepository.findById(key).map(ClientPreference::getValue);
  }

  @Override
  public void savePreference(String key, String value) {
    ClientPreference preference = preferenceRepository.findById(key)
        .orElseGet(() -> new ClientPreference(key, value));
    preference.setValue(value);
    preferenceRepository.save(preference);
  }
}
