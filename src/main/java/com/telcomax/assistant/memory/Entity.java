package com.telcomax.assistant.memory;

import java.util.Objects;

public record Entity(EntityType type, String value, double confidence) {

  public Entity {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(value, "value");
    if (confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("confidence must be in [0,1]: " + confidence);
    }
  }

  /**
   * Whether this newly extracted entity replaces {@code stored}. Equal confidence overwrites.
   */
  public boolean supersedes(Entity stored) {
    return stored == null || confidence >= stored.confidence();
  }
}
