package com.telcomax.assistant.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telcomax.assistant.model.ResponderType;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis layout per session: {@code <prefix><id>} holds the creation instant,
 * {@code <prefix><id>:turns} is a list of turn JSON in append order and
 * {@code <prefix><id>:entities} a hash of entity type to entity JSON. Nothing expires.
 */
public class RedisSessionRepository implements SessionRepository {

  private final StringRedisTemplate redis;
  private final ObjectMapper mapper;
  private final String keyPrefix;
  private final Clock clock;

  public RedisSessionRepository(StringRedisTemplate redis, ObjectMapper mapper, String keyPrefix) {
    this(redis, mapper, keyPrefix, Clock.systemUTC());
  }

  public RedisSessionRepository(
      StringRedisTemplate redis,
      ObjectMapper mapper,
      String keyPrefix,
      Clock clock) {
    this.redis = redis;
    this.mapper = mapper;
    this.keyPrefix = keyPrefix;
    this.clock = clock;
  }

  @Override
  public Optional<Session> find(String sessionId) {
    String created = redis.opsForValue().get(key(sessionId));
    if (created == null || created.isBlank()) {
      return Optional.empty();
    }

    List<ConversationTurn> turns = new ArrayList<>();
    List<String> rawTurns = redis.opsForList().range(turnsKey(sessionId), 0, -1);
    if (rawTurns != null) {
      for (String raw : rawTurns) {
        turns.add(read(raw, StoredTurn.class, sessionId).toTurn());
      }
    }

    List<Entity> entities = new ArrayList<>();
    Map<Object, Object> rawEntities = redis.opsForHash().entries(entitiesKey(sessionId));
    for (Object raw : rawEntities.values()) {
      entities.add(read(raw.toString(), StoredEntity.class, sessionId).toEntity());
    }

    return Optional.of(new Session(
        sessionId, Instant.ofEpochMilli(Long.parseLong(created)), turns, entities));
  }

  @Override
  public Session create(String sessionId) {
    Instant now = clock.instant();
    redis.opsForValue().setIfAbsent(key(sessionId), Long.toString(now.toEpochMilli()));
    return Session.empty(sessionId, now);
  }

  @Override
  public void appendTurn(String sessionId, ConversationTurn turn) {
    redis.opsForList().rightPush(turnsKey(sessionId), write(StoredTurn.of(turn), sessionId));
  }

  @Override
  public void saveEntity(String sessionId, Entity entity) {
    redis.opsForHash().put(
        entitiesKey(sessionId),
        entity.type().key(),
        write(new StoredEntity(entity.type().key(), entity.value(), entity.confidence()), sessionId));
  }

  private <T> T read(String json, Class<T> type, String sessionId) {
    try {
      return mapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to deserialize session data for " + sessionId, e);
    }
  }

  private String write(Object value, String sessionId) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize session data for " + sessionId, e);
    }
  }

  private String key(String sessionId) {
    return keyPrefix + sessionId;
  }

  private String turnsKey(String sessionId) {
    return key(sessionId) + ":turns";
  }

  private String entitiesKey(String sessionId) {
    return key(sessionId) + ":entities";
  }

  record StoredTurn(String role, String text, long timestamp, String responder) {

    static StoredTurn of(ConversationTurn turn) {
      return new StoredTurn(
          turn.role().name(),
          turn.text(),
          turn.timestamp().toEpochMilli(),
          turn.responder() == null ? null : turn.responder().name());
    }

    ConversationTurn toTurn() {
      return new ConversationTurn(
          TurnRole.valueOf(role),
          text,
          Instant.ofEpochMilli(timestamp),
          responder == null ? null : ResponderType.valueOf(responder));
    }
  }

  record StoredEntity(String type, String value, double confidence) {

    Entity toEntity() {
      return new Entity(EntityType.fromKey(type), value, confidence);
    }
  }
}
