package com.telcomax.assistant.memory;

import static org.junit.jupiter.api.Assertions.*;

import com.telcomax.assistant.model.ResponderType;
import com.telcomax.assistant.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class SessionMemoryTest {

  private static final Instant START = Instant.parse("2026-01-15T10:00:00Z");

  private MutableClock clock;
  private SessionMemory memory;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    memory = new SessionMemory(new InMemorySessionRepository(clock));
  }

  @Test
  void unknownSessionIsCreatedEmpty() {
    Session session = memory.getOrCreate("s-1");

    assertEquals("s-1", session.id());
    assertEquals(START, session.createdAt());
    assertTrue(session.turns().isEmpty());
    assertTrue(session.entities().isEmpty());
    assertEquals("", session.contextSummary());
  }

  @Test
  void existingSessionKeepsItsCreationTime() {
    memory.getOrCreate("s-1");
    clock.advance(Duration.ofMinutes(5));

    assertEquals(START, memory.getOrCreate("s-1").createdAt());
  }

  @Test
  void turnsAreKeptInAppendOrder() {
    memory.appendTurn("s-1", ConversationTurn.user("What is my bill?", clock.instant()));
    memory.appendTurn("s-1",
        ConversationTurn.system("Your bill is $137.14.", clock.instant(), ResponderType.ACCOUNT_SPECIFIC));
    memory.appendTurn("s-1", ConversationTurn.user("Thanks", clock.instant()));

    List<ConversationTurn> turns = memory.getOrCreate("s-1").turns();
    assertEquals(3, turns.size());
    assertEquals(TurnRole.USER, turns.get(0).role());
    assertEquals(ResponderType.ACCOUNT_SPECIFIC, turns.get(1).responder());
    assertEquals("Thanks", turns.get(2).text());
    assertEquals(List.of(turns.get(1), turns.get(2)), memory.getOrCreate("s-1").recentTurns(2));
  }

  @Test
  void higherOrEqualConfidenceOverwrites() {
    memory.mergeEntities("s-1", List.of(new Entity(EntityType.ACCOUNT_ID, "ACC-OLD-1", 0.7)));
    memory.mergeEntities("s-1", List.of(new Entity(EntityType.ACCOUNT_ID, "ACC-NEW-2", 0.7)));
    assertEquals("ACC-NEW-2", memory.getOrCreate("s-1").entity(EntityType.ACCOUNT_ID).get().value());

    memory.mergeEntities("s-1", List.of(new Entity(EntityType.ACCOUNT_ID, "ACC-NEW-3", 0.95)));
    assertEquals("ACC-NEW-3", memory.getOrCreate("s-1").entity(EntityType.ACCOUNT_ID).get().value());
  }

  @Test
  void lowerConfidenceDoesNotOverwrite() {
    memory.mergeEntities("s-1", List.of(new Entity(EntityType.ACCOUNT_ID, "ACC-DEMO-001", 0.95)));

    Session session = memory.mergeEntities("s-1",
        List.of(new Entity(EntityType.ACCOUNT_ID, "12345678", 0.7)));

    Entity stored = session.entity(EntityType.ACCOUNT_ID).orElseThrow();
    assertEquals("ACC-DEMO-001", stored.value());
    assertEquals(0.95, stored.confidence());
  }

  @Test
  void contextSummaryListsEntitiesInFixedOrder() {
    Session session = memory.mergeEntities("s-1", List.of(
        new Entity(EntityType.TOPIC, "billing", 0.5),
        new Entity(EntityType.BILLING_PERIOD, "January 2026", 0.9),
        new Entity(EntityType.ACCOUNT_ID, "ACC-DEMO-001", 0.95)));

    assertTrue(session.hasAccountId());
    assertEquals("Session Context: Account: ACC-DEMO-001 | Discussing: January 2026 | Topic: billing",
        session.contextSummary());
  }

  @Test
  void blankSessionIdIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> memory.getOrCreate(" "));
    assertThrows(IllegalArgumentException.class, () -> memory.mergeEntities(null, List.of()));
  }

  @Test
  void concurrentAppendsToOneSessionAreAllKept() throws Exception {
    int threads = 8;
    int perThread = 25;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      for (int t = 0; t < threads; t++) {
        int thread = t;
        pool.submit(() -> {
          start.await();
          for (int i = 0; i < perThread; i++) {
            memory.appendTurn("shared", ConversationTurn.user("t" + thread + "-" + i, clock.instant()));
          }
          return null;
        });
      }
      start.countDown();
    } finally {
      pool.shutdown();
    }
    assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

    assertEquals(threads * perThread, memory.getOrCreate("shared").turns().size());
  }

  @Test
  void lockTableStaysBoundedAcrossManySessions() {
    Lock first = memory.lockFor("s-1");
    for (int i = 0; i < 5_000; i++) {
      memory.getOrCreate(UUID.randomUUID().toString());
    }

    assertEquals(SessionMemory.LOCK_STRIPES, memory.lockStripes());
    assertSame(first, memory.lockFor("s-1"));
  }

  @Test
  void entityConfidenceMustBeWithinUnitInterval() {
    assertThrows(IllegalArgumentException.class,
        () -> new Entity(EntityType.TOPIC, "billing", 1.5));
  }
}
