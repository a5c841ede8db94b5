package com.telcomax.assistant.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only snapshot of a session. Stores hand out fresh snapshots; mutations go through
 * {@link SessionMemory}.
 */
public final class Session {

  private final String id;
  private final Instant createdAt;
  private final List<ConversationTurn> turns;
  private final Map<EntityType, Entity> entities;

  public Session(
      String id,
      Instant createdAt,
      List<ConversationTurn> turns,
      Collection<Entity> entities) {
    this.id = id;
    this.createdAt = createdAt;
    this.turns = List.copyOf(turns);
    Map<EntityType, Entity> byType = new EnumMap<>(EntityType.class);
    for (Entity entity : entities) {
      byType.put(entity.type(), entity);
    }
    this.entities = byType;
  }

  public static Session empty(String id, Instant createdAt) {
    return new Session(id, createdAt, List.of(), List.of());
  }

  public String id() {
    return id;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public List<ConversationTurn> turns() {
    return turns;
  }

  public Map<EntityType, Entity> entities() {
    return Map.copyOf(entities);
  }

  public Optional<Entity> entity(EntityType type) {
    return Optional.ofNullable(entities.get(type));
  }

  public boolean hasAccountId() {
    return entities.containsKey(EntityType.ACCOUNT_ID);
  }

  public List<ConversationTurn> recentTurns(int n) {
    int from = Math.max(0, turns.size() - n);
    return new ArrayList<>(turns.subList(from, turns.size()));
  }

  /**
   * Prompt-ready summary of the entity memory, empty when nothing has been extracted yet.
   */
  public String contextSummary() {
    if (entities.isEmpty()) {
      return "";
    }
    return entities.values().stream()
        .map(e -> e.type().label() + ": " + e.value())
        .collect(Collectors.joining(" | ", "Session Context: ", ""));
  }

  @Override
  public String toString() {
    return "Session{id=" + id + ", turns=" + turns.size() + ", entities=" + entities.keySet() + "}";
  }
}
