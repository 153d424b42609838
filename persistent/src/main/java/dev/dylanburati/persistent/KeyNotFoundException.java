package dev.dylanburati.persistent;

import java.util.NoSuchElementException;

/**
 * Thrown by {@link HashTrieMap#get}, {@link HashTrieMap#remove} and {@link HashTrieSet#remove}
 * when the key is absent.
 */
public class KeyNotFoundException extends NoSuchElementException {
  private static final long serialVersionUID = 1L;
  private final transient Object key;

  public KeyNotFoundException(Object key) {
    super(String.valueOf(key));
    this.key = key;
  }

  /** The key that was looked up, or {@code null} after the exception was deserialized. */
  public Object getKey() {
    return this.key;
  }
}
