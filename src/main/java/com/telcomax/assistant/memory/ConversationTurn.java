package com.telcomax.assistant.memory;

import com.telcomax.assistant.model.ResponderType;
import java.time.Instant;
import java.util.Objects;

/**
 * One appended message of a session. {@code responder} is null for user turns.
 */
public record ConversationTurn(
    TurnRole role,
    String text,
    Instant timestamp,
    ResponderType responder
) {

  public ConversationTurn {
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(timestamp, "timestamp");
  }

  public static ConversationTurn user(String text, Instant at) {
    return new ConversationTurn(TurnRole.USER, text, at, null);
  }

  public static ConversationTurn system(String text, Instant at, ResponderType responder) {
    return new ConversationTurn(TurnRole.SYSTEM, text, at, responder);
  }
}
