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

@Entity
@Table(name = "pending_month_writes")
@Getter
@Setter
@NoArgsConstructor
public class PendingMonthWrite {
  @Id
  @Column(name = "month_key", length = 7)
  private String monthKey;

  @Lob
  @Column(nullable = false)
  private String payload;

  @Column(name = "queued_at", nullable = false)
  private Instant queuedAt;

  public PendingMonthWrite(String monthKey, String payload, Instant queuedAt) {
    this.monthKey = monthKey;
    this.payload = payload;
    this.queuedAt = queuedAt;
  }
}
