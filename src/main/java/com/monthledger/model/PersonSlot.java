package com.monthledger.model;

import java.util.Locale;

public enum PersonSlot {
  PERSON1("person1"),
  PERSON2("person2");

  private final String key;

  PersonSlot(String key) {
    this.key = key;
  }

  public String getKey() {
    return key;
  }

  public static PersonSlot fromKey(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Missing person slot");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (PersonSlot slot : values()) {
      if (slot.key.equals(normalized)) {
        return slot;
      }
    }
    throw new IllegalArgumentException("Unknown person slot: " + value);
  }
}
