package com.monthledger.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Single-row table: at most one merged settings patch waits for the remote store.
 */
@Entity
@Table(name = "pending_settings_writes")
@Getter
@Setter
@NoArgsConstructor
public class PendingSettingsWrite {
  public static final int SINGLETON_ID = 1;

  @Id
  private Integer id = SINGLETON_ID;

  @Lob
  @Column(nullable = false)
  private String payload;

  @Column(name = "queued_at", nullable = false)
  private Instant queuedAt;

  public PendingSettingsWrite(String payload, Instant queuedAt) {
    this.payload = payload;
    this.queuedAt = queuedAt;
  }
}
