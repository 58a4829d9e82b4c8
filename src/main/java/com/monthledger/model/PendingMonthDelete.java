package com.monthledger.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "pending_month_deletes")
@Getter
@Setter
@NoArgsConstructor
public class PendingMonthDelete {
  @Id
  @Column(name = "month_key", length = 7)
  private String monthKey;

  @Column(name = "queued_at", nullable = false)
  private Instant queuedAt;

  public PendingMonthDelete(String monthKey, Instant queuedAt) {
    this.monthKey = monthKey;
    this.queuedAt = queuedAt;
  }
}
