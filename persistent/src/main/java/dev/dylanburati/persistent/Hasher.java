package dev.dylanburati.persistent;

/**
 * Computes hashes and key equivalence for the trie-backed collections. The rules of
 * {@link Object#hashCode} also apply here: keys that are equivalent must hash identically.
 *
 * A hasher has to be {@link java.io.Serializable} for the collections using it to be serialized.
 * Collections only compare equal when their hashers are equal, so a serializable hasher that is
 * not a singleton should override {@link Object#equals}.
 */
public interface Hasher<T> {
  int hash(T value);
  boolean equivalent(T a, T b);
}
