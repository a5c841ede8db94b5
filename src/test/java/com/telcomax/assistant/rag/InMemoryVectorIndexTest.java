package com.telcomax.assistant.rag;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class InMemoryVectorIndexTest {

  private final InMemoryVectorIndex index = new InMemoryVectorIndex();

  @Test
  void matchesComeBackBestFirstAndLimited() {
    index.upsert("ns", "a", new float[] {1f, 0f}, Map.of(VectorIndex.META_DOC_ID, "a"));
    index.upsert("ns", "b", new float[] {1f, 1f}, Map.of(VectorIndex.META_DOC_ID, "b"));
    index.upsert("ns", "c", new float[] {0f, 1f}, Map.of(VectorIndex.META_DOC_ID, "c"));

    List<VectorMatch> matches = index.query("ns", new float[] {1f, 0.1f}, 2);

    assertEquals(2, matches.size());
    assertEquals("a", matches.get(0).id());
    assertEquals("b", matches.get(1).id());
    assertTrue(matches.get(0).score() >= matches.get(1).score());
    assertEquals("a", matches.get(0).metadata().get(VectorIndex.META_DOC_ID));
  }

  @Test
  void namespacesAreIsolated() {
    index.upsert("customer-docs", "x", new float[] {1f, 0f}, Map.of());
    index.upsert("eval-fixed_size", "y", new float[] {1f, 0f}, Map.of());

    index.deleteNamespace("eval-fixed_size");

    assertEquals(1, index.size("customer-docs"));
    assertEquals(0, index.size("eval-fixed_size"));
    assertTrue(index.query("eval-fixed_size", new float[] {1f, 0f}, 4).isEmpty());
  }

  @Test
  void upsertReplacesById() {
    index.upsert("ns", "a", new float[] {1f, 0f}, Map.of(VectorIndex.META_TEXT, "old"));
    index.upsert("ns", "a", new float[] {1f, 0f}, Map.of(VectorIndex.META_TEXT, "new"));

    assertEquals(1, index.size("ns"));
    assertEquals("new", index.query("ns", new float[] {1f, 0f}, 1).get(0).metadata().get(VectorIndex.META_TEXT));
  }

  @Test
  void oppositeVectorsScoreZero() {
    index.upsert("ns", "a", new float[] {-1f, 0f}, Map.of());

    assertEquals(0.0, index.query("ns", new float[] {1f, 0f}, 1).get(0).score());
  }

  @Test
  void dimensionMismatchIsRejected() {
    index.upsert("ns", "a", new float[] {1f, 0f, 0f}, Map.of());

    assertThrows(IllegalArgumentException.class, () -> index.query("ns", new float[] {1f, 0f}, 1));
  }
}
