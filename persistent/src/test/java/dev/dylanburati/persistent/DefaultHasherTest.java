package dev.dylanburati.persistent;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static dev.dylanburati.persistent.Helpers.*;

class DefaultHasherTest {
  private final DefaultHasher hasher = DefaultHasher.instance();

  @ParameterizedTest
  @ValueSource(strings = {"", "a", "33", "1699"})
  void testEqualKeysHashEqually(String key) {
    assertEquals(hasher.hash(key), hasher.hash(new String(key)));
    assertTrue(hasher.equivalent(key, new String(key)));
  }

  @Test void testEquivalence() {
    assertTrue(hasher.equivalent(List.of(1), List.of(1)));
    assertFalse(hasher.equivalent(List.of(1), List.of(2)));
    assertFalse(hasher.equivalent("a", null));
  }

  @Test void testRejectsNullAndArrays() {
    assertThrows(NullPointerException.class, () -> hasher.hash(null));
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> hasher.hash(new byte[]{1}));
    assertEquals("unhashable key type: byte[]", e.getMessage());
  }

  @Test void testSpreadsSequentialKeys() {
    // sequential integers should not all share their lowest chunk
    Set<Integer> lowChunks = new HashSet<>();
    for (int i = 0; i < 32; i++) {
      lowChunks.add(TrieNode.chunk(hasher.hash(i * 32), 0));
    }
    assertTrue(lowChunks.size() > 1);
  }

  @Test void testSerializationKeepsSingleton() throws Exception {
    assertSame(hasher, deserialize(serialize(hasher)));
  }
}
