package com.telcomax.assistant.memory;

import com.telcomax.assistant.model.ResponderType;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Durable store over three tables: {@code assistant_session}, {@code session_turn} keyed by
 * (session_id, turn_index) and {@code session_entity} keyed by (session_id, entity_type).
 */
public class JdbcSessionRepository implements SessionRepository {

  private final JdbcTemplate jdbcTemplate;
  private final Clock clock;

  public JdbcSessionRepository(JdbcTemplate jdbcTemplate) {
    this(jdbcTemplate, Clock.systemUTC());
  }

  public JdbcSessionRepository(JdbcTemplate jdbcTemplate, Clock clock) {
    this.jdbcTemplate = jdbcTemplate;
    this.clock = clock;
  }

  @Override
  public Optional<Session> find(String sessionId) {
    Instant createdAt;
    try {
      createdAt = jdbcTemplate.queryForObject(
          "SELECT created_at FROM assistant_session WHERE session_id = ?",
          (rs, rowNum) -> rs.getTimestamp("created_at").toInstant(),
          sessionId);
    } catch (EmptyResultDataAccessException e) {
      return Optional.empty();
    }

    List<ConversationTurn> turns = jdbcTemplate.query("""
            SELECT role, text, responder, created_at
            FROM session_turn
            WHERE session_id = ?
            ORDER BY turn_index
            """,
        (rs, rowNum) -> {
          String responder = rs.getString("responder");
          return new ConversationTurn(
              TurnRole.valueOf(rs.getString("role")),
              rs.getString("text"),
              rs.getTimestamp("created_at").toInstant(),
              responder == null ? null : ResponderType.valueOf(responder));
        },
        sessionId);

    List<Entity> entities = jdbcTemplate.query(
        "SELECT entity_type, entity_value, confidence FROM session_entity WHERE session_id = ?",
        (rs, rowNum) -> new Entity(
            EntityType.fromKey(rs.getString("entity_type")),
            rs.getString("entity_value"),
            rs.getDouble("confidence")),
        sessionId);

    return Optional.of(new Session(sessionId, createdAt, turns, entities));
  }

  @Override
  public Session create(String sessionId) {
    Instant now = clock.instant();
    jdbcTemplate.update(
        "INSERT INTO assistant_session (session_id, created_at) VALUES (?, ?)",
        sessionId, Timestamp.from(now));
    return Session.empty(sessionId, now);
  }

  @Override
  public void appendTurn(String sessionId, ConversationTurn turn) {
    Integer next = jdbcTemplate.queryForObject(
        "SELECT COALESCE(MAX(turn_index) + 1, 0) FROM session_turn WHERE session_id = ?",
        Integer.class,
        sessionId);
    jdbcTemplate.update("""
            INSERT INTO session_turn (session_id, turn_index, role, text, responder, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """,
        sessionId,
        next == null ? 0 : next,
        turn.role().name(),
        turn.text(),
        turn.responder() == null ? null : turn.responder().name(),
        Timestamp.from(turn.timestamp()));
  }

  @Override
  public void saveEntity(String sessionId, Entity entity) {
    int rows = jdbcTemplate.update("""
            UPDATE session_entity SET entity_value = ?, confidence = ?
            WHERE session_id = ? AND entity_type = ?
            """,
        entity.value(), entity.confidence(), sessionId, entity.type().key());
    if (rows == 0) {
      jdbcTemplate.update("""
              INSERT INTO session_entity (session_id, entity_type, entity_value, confidence)
              VALUES (?, ?, ?, ?)
              """,
          sessionId, entity.type().key(), entity.value(), entity.confidence());
    }
  }
}
