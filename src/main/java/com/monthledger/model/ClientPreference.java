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
@Table(name = "client_preferences")
@Getter
@Setter
@NoArgsConstructor
public class ClientPreference {
  @Id
  @Column(name = "pref_key", length = 200)
  private String key;

  @Lob
  @Column(name = "pref_value")
  private String value;

  @Column(name = "updated_at")
  private Instant updatedAt;

  public ClientPreference(String key, String value) {
    this.key = key;
    this.value = value;
  }

  @PrePersist
  @PreUpdate
  void touch() {
    updatedAt = Instant.now();
  }
}
