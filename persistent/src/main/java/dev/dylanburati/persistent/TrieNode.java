package dev.dylanburati.persistent;

import java.util.Arrays;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Node of a hash array mapped trie. Nodes are immutable and shared between collections, so
 * every update copies the path from the root to the changed node and reuses everything else.
 *
 * The variant is closed: a node is a {@link Branch}, a {@link Leaf} or a {@link Collision}.
 * Hashes are consumed {@value #BITS} bits per level, least significant chunk first.
 */
/* package-private */ abstract class TrieNode<K, V> {
  static final int BITS = 5;
  static final int MASK = (1 << BITS) - 1;

  private TrieNode() {}

  /** Returns the leaf holding {@code key}, or {@code null}. */
  abstract Leaf<K, V> find(int shift, int hash, K key, Hasher<? super K> hasher);

  /**
   * Returns a node which also maps {@code leaf.key}. Returns {@code this} when the key is
   * already mapped to the identical value object.
   */
  abstract TrieNode<K, V> insert(int shift, Leaf<K, V> leaf, Hasher<? super K> hasher);

  /**
   * Returns a node without {@code key}: {@code this} when the key is absent, {@code null} when
   * nothing would remain.
   */
  abstract TrieNode<K, V> remove(int shift, int hash, K key, Hasher<? super K> hasher);

  /** Number of leaves reachable from this node. */
  abstract int size();

  abstract void forEachLeaf(Consumer<? super Leaf<K, V>> action);

  /** Pushes the direct children so that the first child is popped first. */
  abstract void pushChildren(Deque<TrieNode<K, V>> stack);

  static int chunk(int hash, int shift) {
    return (hash >>> shift) & MASK;
  }

  /**
   * Builds the smallest subtree holding two non-branch nodes whose hashes differ. Terminates
   * by the last chunk at the latest, since the hashes differ in at least one bit.
   */
  static <K, V> TrieNode<K, V> pair(int shift, TrieNode<K, V> a, int hashA, TrieNode<K, V> b, int hashB) {
    int chunkA = chunk(hashA, shift);
    int chunkB = chunk(hashB, shift);
    if (chunkA == chunkB) {
      TrieNode<K, V> child = pair(shift + BITS, a, hashA, b, hashB);
      return new Branch<>(1 << chunkA, newArray(child), child.size());
    }
    int bitmap = (1 << chunkA) | (1 << chunkB);
    TrieNode<K, V>[] children = chunkA < chunkB ? newArray(a, b) : newArray(b, a);
    return new Branch<>(bitmap, children, a.size() + b.size());
  }

  @SafeVarargs
  private static <K, V> TrieNode<K, V>[] newArray(TrieNode<K, V>... nodes) {
    return nodes;
  }

  static final class Branch<K, V> extends TrieNode<K, V> {
    // INVARIANT 0: bitCount(bitmap) == children.length
    // INVARIANT 1: children are sorted by chunk
    // INVARIANT 2: no child is null, and a lone child is always a Branch
    private final int bitmap;
    private final TrieNode<K, V>[] children;
    private final int size;

    Branch(int bitmap, TrieNode<K, V>[] children, int size) {
      this.bitmap = bitmap;
      this.children = children;
      this.size = size;
    }

    private int index(int bit) {
      return Integer.bitCount(this.bitmap & (bit - 1));
    }

    @Override
    Leaf<K, V> find(int shift, int hash, K key, Hasher<? super K> hasher) {
      int bit = 1 << chunk(hash, shift);
      if ((this.bitmap & bit) == 0) {
        return null;
      }
      return this.children[this.index(bit)].find(shift + BITS, hash, key, hasher);
    }

    @Override
    TrieNode<K, V> insert(int shift, Leaf<K, V> leaf, Hasher<? super K> hasher) {
      int bit = 1 << chunk(leaf.hash, shift);
      int idx = this.index(bit);
      if ((this.bitmap & bit) == 0) {
        TrieNode<K, V>[] next = Arrays.copyOf(this.children, this.children.length + 1);
        System.arraycopy(this.children, idx, next, idx + 1, this.children.length - idx);
        next[idx] = leaf;
        return new Branch<>(this.bitmap | bit, next, this.size + 1);
      }
      TrieNode<K, V> child = this.children[idx];
      TrieNode<K, V> updated = child.insert(shift + BITS, leaf, hasher);
      if (updated == child) {
        return this;
      }
      return this.withChild(idx, updated, this.size - child.size() + updated.size());
    }

    @Override
    TrieNode<K, V> remove(int shift, int hash, K key, Hasher<? super K> hasher) {
      int bit = 1 << chunk(hash, shift);
      if ((this.bitmap & bit) == 0) {
        return this;
      }
      int idx = this.index(bit);
      TrieNode<K, V> child = this.children[idx];
      TrieNode<K, V> updated = child.remove(shift + BITS, hash, key, hasher);
      if (updated == child) {
        return this;
      }
      if (updated == null) {
        if (this.children.length == 1) {
          return null;
        }
        if (this.children.length == 2) {
          TrieNode<K, V> sibling = this.children[1 - idx];
          if (!(sibling instanceof Branch)) {
            // INVARIANT 2: pull the survivor up a level
            return sibling;
          }
        }
        TrieNode<K, V>[] next = newChildren(this.children.length - 1);
        System.arraycopy(this.children, 0, next, 0, idx);
        System.arraycopy(this.children, idx + 1, next, idx, this.children.length - idx - 1);
        return new Branch<>(this.bitmap ^ bit, next, this.size - 1);
      }
      if (this.children.length == 1 && !(updated instanceof Branch)) {
        return updated;
      }
      return this.withChild(idx, updated, this.size - child.size() + updated.size());
    }

    private Branch<K, V> withChild(int idx, TrieNode<K, V> child, int size) {
      TrieNode<K, V>[] next = this.children.clone();
      next[idx] = child;
      return new Branch<>(this.bitmap, next, size);
    }

    @SuppressWarnings("unchecked")
    private static <K, V> TrieNode<K, V>[] newChildren(int length) {
      return (TrieNode<K, V>[]) new TrieNode<?, ?>[length];
    }

    @Override
    int size() {
      return this.size;
    }

    @Override
    void forEachLeaf(Consumer<? super Leaf<K, V>> action) {
      for (TrieNode<K, V> child : this.children) {
        child.forEachLeaf(action);
      }
    }

    @Override
    void pushChildren(Deque<TrieNode<K, V>> stack) {
      for (int i = this.children.length - 1; i >= 0; i--) {
        stack.push(this.children[i]);
      }
    }

    int bitmap() {
      return this.bitmap;
    }

    TrieNode<K, V> child(int idx) {
      return this.children[idx];
    }
  }

  /** A single mapping. Iteration hands leaves out directly as map entries. */
  static final class Leaf<K, V> extends TrieNode<K, V> implements Map.Entry<K, V> {
    final int hash;
    final K key;
    final V value;

    Leaf(int hash, K key, V value) {
      this.hash = hash;
      this.key = key;
      this.value = value;
    }

    @Override
    Leaf<K, V> find(int shift, int hash, K key, Hasher<? super K> hasher) {
      if (hash == this.hash && hasher.equivalent(key, this.key)) {
        return this;
      }
      return null;
    }

    @Override
    TrieNode<K, V> insert(int shift, Leaf<K, V> leaf, Hasher<? super K> hasher) {
      if (leaf.hash != this.hash) {
        return pair(shift, this, this.hash, leaf, leaf.hash);
      }
      if (hasher.equivalent(leaf.key, this.key)) {
        if (leaf.value == this.value) {
          return this;
        }
        // the key object first inserted stays
        return new Leaf<>(this.hash, this.key, leaf.value);
      }
      return new Collision<>(this.hash, Collision.newLeaves(this, leaf));
    }

    @Override
    TrieNode<K, V> remove(int shift, int hash, K key, Hasher<? super K> hasher) {
      return this.find(shift, hash, key, hasher) != null ? null : this;
    }

    @Override
    int size() {
      return 1;
    }

    @Override
    void forEachLeaf(Consumer<? super Leaf<K, V>> action) {
      action.accept(this);
    }

    @Override
    void pushChildren(Deque<TrieNode<K, V>> stack) {
    }

    @Override
    public K getKey() {
      return this.key;
    }

    @Override
    public V getValue() {
      return this.value;
    }

    @Override
    public V setValue(V value) {
      throw new UnsupportedOperationException("entries of a persistent map are read-only");
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Map.Entry<?, ?>)) {
        return false;
      }
      Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
      return Objects.equals(this.key, e.getKey()) && Objects.equals(this.value, e.getValue());
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(this.key) ^ Objects.hashCode(this.value);
    }

    @Override
    public String toString() {
      return this.key + "=" + this.value;
    }
  }

  /** Two or more leaves whose keys have the same full hash, in insertion order. */
  static final class Collision<K, V> extends TrieNode<K, V> {
    // INVARIANT: leaves.length >= 2, all leaves have hash == this.hash
    final int hash;
    private final Leaf<K, V>[] leaves;

    Collision(int hash, Leaf<K, V>[] leaves) {
      this.hash = hash;
      this.leaves = leaves;
    }

    @SafeVarargs
    static <K, V> Leaf<K, V>[] newLeaves(Leaf<K, V>... leaves) {
      return leaves;
    }

    private int indexOf(K key, Hasher<? super K> hasher) {
      for (int i = 0; i < this.leaves.length; i++) {
        if (hasher.equivalent(key, this.leaves[i].key)) {
          return i;
        }
      }
      return -1;
    }

    @Override
    Leaf<K, V> find(int shift, int hash, K key, Hasher<? super K> hasher) {
      if (hash != this.hash) {
        return null;
      }
      int idx = this.indexOf(key, hasher);
      return idx >= 0 ? this.leaves[idx] : null;
    }

    @Override
    TrieNode<K, V> insert(int shift, Leaf<K, V> leaf, Hasher<? super K> hasher) {
      if (leaf.hash != this.hash) {
        return pair(shift, this, this.hash, leaf, leaf.hash);
      }
      int idx = this.indexOf(leaf.key, hasher);
      if (idx >= 0) {
        Leaf<K, V> current = this.leaves[idx];
        if (current.value == leaf.value) {
          return this;
        }
        Leaf<K, V>[] next = this.leaves.clone();
        next[idx] = new Leaf<>(this.hash, current.key, leaf.value);
        return new Collision<>(this.hash, next);
      }
      Leaf<K, V>[] next = Arrays.copyOf(this.leaves, this.leaves.length + 1);
      next[this.leaves.length] = leaf;
      return new Collision<>(this.hash, next);
    }

    @Override
    TrieNode<K, V> remove(int shift, int hash, K key, Hasher<? super K> hasher) {
      if (hash != this.hash) {
        return this;
      }
      int idx = this.indexOf(key, hasher);
      if (idx < 0) {
        return this;
      }
      if (this.leaves.length == 2) {
        return this.leaves[1 - idx];
      }
      Leaf<K, V>[] next = Arrays.copyOf(this.leaves, this.leaves.length - 1);
      System.arraycopy(this.leaves, idx + 1, next, idx, this.leaves.length - idx - 1);
      return new Collision<>(this.hash, next);
    }

    @Override
    int size() {
      return this.leaves.length;
    }

    @Override
    void forEachLeaf(Consumer<? super Leaf<K, V>> action) {
      for (Leaf<K, V> leaf : this.leaves) {
        action.accept(leaf);
      }
    }

    @Override
    void pushChildren(Deque<TrieNode<K, V>> stack) {
      for (int i = this.leaves.length - 1; i >= 0; i--) {
        stack.push(this.leaves[i]);
      }
    }
  }
}
