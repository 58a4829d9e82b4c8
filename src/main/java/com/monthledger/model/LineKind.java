package com.monthledger.model;

import java.util.Locale;

public enum LineKind {
  INCOME("income"),
  FIXED_EXPENSE("fixed"),
  CATEGORY("category");

  private final String key;

  LineKind(String key) {
    this.key = key;
  }

  public String getKey() {
    return key;
  }

  public static LineKind fromKey(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Missing line kind");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (LineKind kind : values()) {
      if (kind.key.equals(normalized) || kind.name().toLowerCase(Locale.ROOT).equals(normalized)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown line kind: " + value);
  }
}
