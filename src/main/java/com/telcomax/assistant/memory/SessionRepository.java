package com.telcomax.assistant.memory;

import java.util.Optional;

/**
 * Storage seam for sessions. Implementations need not be thread-safe per session id;
 * {@link SessionMemory} serializes access.
 */
public interface SessionRepository {
  Optional<Session> find(String sessionId);
  Session create(String sessionId);
  void appendTurn(String sessionId, ConversationTurn turn);
  void saveEntity(String sessionId, Entity entity);
}
