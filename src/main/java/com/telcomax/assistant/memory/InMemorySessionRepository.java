package com.telcomax.assistant.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemorySessionRepository implements SessionRepository {

  private final ConcurrentMap<String, Record> store = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemorySessionRepository() {
    this(Clock.systemUTC());
  }

  public InMemorySessionRepository(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Optional<Session> find(String sessionId) {
    return Optional.ofNullable(store.get(sessionId)).map(r -> r.snapshot(sessionId));
  }

  @Override
  public Session create(String sessionId) {
    return store.computeIfAbsent(sessionId, id -> new Record(clock.instant()))
        .snapshot(sessionId);
  }

  @Override
  public void appendTurn(String sessionId, ConversationTurn turn) {
    Record record = require(sessionId);
    synchronized (record) {
      record.turns.add(turn);
    }
  }

  @Override
  public void saveEntity(String sessionId, Entity entity) {
    Record record = require(sessionId);
    synchronized (record) {
      record.entities.put(entity.type(), entity);
    }
  }

  private Record require(String sessionId) {
    Record record = store.get(sessionId);
    if (record == null) {
      throw new IllegalStateException("Unknown session " + sessionId);
    }
    return record;
  }

  private static final class Record {
    private final Instant createdAt;
    private final List<ConversationTurn> turns = new ArrayList<>();
    private final Map<EntityType, Entity> entities = new EnumMap<>(EntityType.class);

    private Record(Instant createdAt) {
      this.createdAt = createdAt;
    }

    private synchronized Session snapshot(String id) {
      return new Session(id, createdAt, turns, entities.values());
    }
  }
}
