package com.monthledger.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "month_snapshots")
@Getter
@Setter
@NoArgsConstructor
public class MonthSnapshot {
  @Id
  @Column(name = "month_key", length = 7)
  private String monthKey;

  @Lob
  @Column(nullable = false)
  private String payload;

  @Column(name = "saved_at")
  private Instant savedAt;

  public MonthSnapshot(String monthKey, String payload) {
    this.monthKey = monthKey;
    this.payload = payload;
  }

  @PrePersist
  @PreUpdate
  void touch() {
    savedAt = Instant.now();
  }
}
