package com.telcomax.assistant.memory;

import com.google.common.util.concurrent.Striped;
import java.util.Collection;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Session operations over the configured {@link SessionRepository}. Calls for the same session
 * id run one at a time. Ids map onto a fixed number of lazily created, weakly held lock stripes,
 * so the lock table stays bounded however many sessions are seen.
 */
@Service
public class SessionMemory {

  private static final Logger log = LoggerFactory.getLogger(SessionMemory.class);

  private final SessionRepository repository;
  static final int LOCK_STRIPES = 1024;

  private final Striped<Lock> locks = Striped.lazyWeakLock(LOCK_STRIPES);

  public SessionMemory(SessionRepository repository) {
    this.repository = repository;
  }

  public Session getOrCreate(String sessionId) {
    return locked(sessionId, () -> load(sessionId));
  }

  public void appendTurn(String sessionId, ConversationTurn turn) {
    locked(sessionId, () -> {
      load(sessionId);
      repository.appendTurn(sessionId, turn);
      return null;
    });
  }

  /**
   * Applies the overwrite rule to each extracted entity and returns the updated session.
   */
  public Session mergeEntities(String sessionId, Collection<Entity> extracted) {
    return locked(sessionId, () -> {
      Session session = load(sessionId);
      boolean changed = false;
      for (Entity candidate : extracted) {
        Entity stored = session.entity(candidate.type()).orElse(null);
        if (candidate.supersedes(stored)) {
          repository.saveEntity(sessionId, candidate);
          changed = true;
        } else {
          log.debug("Kept stored entity sessionId={} type={} storedConfidence={} newConfidence={}",
              sessionId, candidate.type(), stored.confidence(), candidate.confidence());
        }
      }
      return changed ? load(sessionId) : session;
    });
  }

  private Session load(String sessionId) {
    return repository.find(sessionId).orElseGet(() -> {
      log.info("Creating session sessionId={}", sessionId);
      return repository.create(sessionId);
    });
  }

  private <T> T locked(String sessionId, Supplier<T> action) {
    if (sessionId == null || sessionId.isBlank()) {
      throw new IllegalArgumentException("sessionId must not be blank");
    }
    Lock lock = lockFor(sessionId);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  Lock lockFor(String sessionId) {
    return locks.get(sessionId);
  }

  int lockStripes() {
    return locks.size();
  }
}
