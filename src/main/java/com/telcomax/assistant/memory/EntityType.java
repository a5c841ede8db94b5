package com.telcomax.assistant.memory;

import java.util.Arrays;

public enum EntityType {
  ACCOUNT_ID("account_id", "Account"),
  CUSTOMER_NAME("customer_name", "Customer"),
  BILLING_PERIOD("billing_period", "Discussing"),
  TOPIC("topic", "Topic");

  private final String key;
  private final String label;

  EntityType(String key, String label) {
    this.key = key;
    this.label = label;
  }

  /** Stable identifier used in the persisted layouts. */
  public String key() {
    return key;
  }

  String label() {
    return label;
  }

  public static EntityType fromKey(String key) {
    return Arrays.stream(values())
        .filter(t -> t.key.equals(key))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown entity type " + key));
  }
}
