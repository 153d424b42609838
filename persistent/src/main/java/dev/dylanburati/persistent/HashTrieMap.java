package dev.dylanburati.persistent;

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.AbstractCollection;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.function.Consumer;

import dev.dylanburati.persistent.TrieNode.Leaf;

/**
 * Persistent hash map backed by a hash array mapped trie.
 *
 * Every update returns a new map and leaves the receiver untouched. The new map shares all
 * nodes off the updated path with the old one, so {@link #insert}, {@link #remove} and
 * {@link #discard} cost O(log32 n) time and space.
 *
 * Keys are hashed and compared with a {@link Hasher}; the default one uses
 * {@link Object#hashCode} and {@link Object#equals}, and rejects {@code null} and array keys.
 * Values may be {@code null}.
 *
 * Two maps are equal when they hold equal mappings, regardless of insertion order. A map is
 * never equal to a {@link java.util.Map}; use {@link #asMap()} for that. Maps are not hashable:
 * {@link #hashCode()} throws.
 */
public final class HashTrieMap<K, V> implements Iterable<Map.Entry<K, V>>, Serializable {
  private static final long serialVersionUID = 1L;
  private static final HashTrieMap<?, ?> EMPTY = new HashTrieMap<>(DefaultHasher.instance(), null);

  private final Hasher<? super K> hasher;
  // null when empty
  private final TrieNode<K, V> root;

  private HashTrieMap(final Hasher<? super K> hasher, TrieNode<K, V> root) {
    this.hasher = hasher;
    this.root = root;
  }

  public static <K, V> HashTrieMap<K, V> empty() {
    return castUnsafe(EMPTY);
  }

  public static <K, V> HashTrieMap<K, V> empty(final Hasher<? super K> hasher) {
    return new HashTrieMap<>(Objects.requireNonNull(hasher), null);
  }

  public static <K, V> HashTrieMap<K, V> of(K k1, V v1) {
    return HashTrieMap.<K, V>empty().insert(k1, v1);
  }

  public static <K, V> HashTrieMap<K, V> of(K k1, V v1, K k2, V v2) {
    return HashTrieMap.<K, V>empty().insert(k1, v1).insert(k2, v2);
  }

  public static <K, V> HashTrieMap<K, V> of(K k1, V v1, K k2, V v2, K k3, V v3) {
    return HashTrieMap.<K, V>empty().insert(k1, v1).insert(k2, v2).insert(k3, v3);
  }

  public static <K, V> HashTrieMap<K, V> from(Map<? extends K, ? extends V> source) {
    return HashTrieMap.<K, V>empty().update(source);
  }

  public static <K, V> HashTrieMap<K, V> from(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
    return HashTrieMap.<K, V>empty().update(entries);
  }

  /** Maps every key in {@code keys} to {@code value}. */
  public static <K, V> HashTrieMap<K, V> fromKeys(Iterable<? extends K> keys, V value) {
    HashTrieMap<K, V> result = empty();
    for (K key : keys) {
      result = result.insert(key, value);
    }
    return result;
  }

  /** Returns {@code source} itself; it is already persistent. */
  public static <K, V> HashTrieMap<K, V> convert(HashTrieMap<K, V> source) {
    return Objects.requireNonNull(source);
  }

  /** Copies the mappings of a native map into a new persistent map. */
  public static <K, V> HashTrieMap<K, V> convert(Map<? extends K, ? extends V> source) {
    return from(source);
  }

  @SuppressWarnings("unchecked")
  private static <V> V castUnsafe(Object v) {
    return (V) v;
  }

  private HashTrieMap<K, V> withRoot(TrieNode<K, V> root) {
    if (root == this.root) {
      return this;
    }
    return new HashTrieMap<>(this.hasher, root);
  }

  private Leaf<K, V> findLeaf(Object key) {
    if (this.root == null || key == null) {
      return null;
    }
    K k = castUnsafe(key);
    return this.root.find(0, this.hasher.hash(k), k, this.hasher);
  }

  public int size() {
    return this.root == null ? 0 : this.root.size();
  }

  public boolean isEmpty() {
    return this.root == null;
  }

  public boolean containsKey(Object key) {
    return this.findLeaf(key) != null;
  }

  private boolean containsEntry(Object key, Object value) {
    Leaf<K, V> leaf = this.findLeaf(key);
    return leaf != null && Objects.equals(leaf.value, value);
  }

  /**
   * Returns the value mapped to {@code key}.
   *
   * @throws KeyNotFoundException if the key is absent
   */
  public V get(Object key) {
    Leaf<K, V> leaf = this.findLeaf(key);
    if (leaf == null) {
      throw new KeyNotFoundException(key);
    }
    return leaf.value;
  }

  public V getOrDefault(Object key, V defaultValue) {
    Leaf<K, V> leaf = this.findLeaf(key);
    return leaf == null ? defaultValue : leaf.value;
  }

  /**
   * Returns a map which also maps {@code key} to {@code value}. Returns this map when the key
   * is already mapped to the same value object.
   */
  public HashTrieMap<K, V> insert(K key, V value) {
    return this.withRoot(this.insertInto(this.root, key, value));
  }

  private TrieNode<K, V> insertInto(TrieNode<K, V> node, K key, V value) {
    Objects.requireNonNull(key, "key");
    Leaf<K, V> leaf = new Leaf<>(this.hasher.hash(key), key, value);
    if (node == null) {
      return leaf;
    }
    return node.insert(0, leaf, this.hasher);
  }

  /**
   * Returns a map without {@code key}.
   *
   * @throws KeyNotFoundException if the key is absent
   */
  public HashTrieMap<K, V> remove(Object key) {
    if (!this.containsKey(key)) {
      throw new KeyNotFoundException(key);
    }
    return this.discard(key);
  }

  /** Returns a map without {@code key}, or this map if the key is absent. */
  public HashTrieMap<K, V> discard(Object key) {
    if (this.root == null || key == null) {
      return this;
    }
    K k = castUnsafe(key);
    return this.withRoot(this.root.remove(0, this.hasher.hash(k), k, this.hasher));
  }

  public HashTrieMap<K, V> update(Map<? extends K, ? extends V> source) {
    return this.update(source.entrySet());
  }

  /**
   * Returns a map with the mappings of every source added, from left to right, so the last
   * source wins when several map the same key. Any {@link HashTrieMap} is a valid source.
   */
  @SafeVarargs
  public final HashTrieMap<K, V> update(Iterable<? extends Map.Entry<? extends K, ? extends V>>... sources) {
    if (sources.length == 1 && this.root == null && sources[0] instanceof HashTrieMap<?, ?>) {
      HashTrieMap<?, ?> source = (HashTrieMap<?, ?>) sources[0];
      if (source.hasher.equals(this.hasher)) {
        return castUnsafe(source);
      }
    }
    TrieNode<K, V> next = this.root;
    for (Iterable<? extends Map.Entry<? extends K, ? extends V>> source : sources) {
      for (Map.Entry<? extends K, ? extends V> e : source) {
        next = this.insertInto(next, e.getKey(), e.getValue());
      }
    }
    return this.withRoot(next);
  }

  /** Read-only view of the keys. */
  public Set<K> keys() {
    return new KeySet<>(this);
  }

  /** Read-only view of the values. */
  public Collection<V> values() {
    return new Values<>(this);
  }

  /** Read-only view of the mappings. */
  public Set<Map.Entry<K, V>> items() {
    return new EntrySet<>(this);
  }

  /** Read-only {@link java.util.Map} view, for passing to APIs that expect one. */
  public Map<K, V> asMap() {
    return new MapView<>(this);
  }

  @Override
  public Iterator<Map.Entry<K, V>> iterator() {
    return new EntryIterator<>(this);
  }

  @Override
  public void forEach(Consumer<? super Map.Entry<K, V>> action) {
    Objects.requireNonNull(action);
    if (this.root != null) {
      this.root.forEachLeaf(action::accept);
    }
  }

  /**
   * Two maps are equal when they use equal hashers and hold the same mappings, whatever the
   * insertion order.
   */
  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof HashTrieMap<?, ?>)) {
      return false;
    }
    HashTrieMap<?, ?> other = (HashTrieMap<?, ?>) o;
    if (this.size() != other.size() || !this.hasher.equals(other.hasher)) {
      return false;
    }
    if (this.root == other.root) {
      return true;
    }
    for (Map.Entry<K, V> e : this) {
      if (!other.containsEntry(e.getKey(), e.getValue())) {
        return false;
      }
    }
    return true;
  }

  /**
   * Always throws. A map with update methods is not hashable, even though every update
   * produces a new map.
   *
   * @throws UnsupportedOperationException always
   */
  @Override
  public int hashCode() {
    throw new UnsupportedOperationException("HashTrieMap is not hashable");
  }

  @Override
  public String toString() {
    StringJoiner joiner = new StringJoiner(", ", "HashTrieMap({", "})");
    for (Map.Entry<K, V> e : this) {
      joiner.add(e.getKey() + ": " + e.getValue());
    }
    return joiner.toString();
  }

  Hasher<? super K> hasher() {
    return this.hasher;
  }

  TrieNode<K, V> root() {
    return this.root;
  }

  // start of section adapted from
  // https://github.com/apache/commons-collections/blob/master/src/main/java/org/apache/commons/collections4/map/AbstractHashedMap.java

  protected static class KeySet<K> extends AbstractSet<K> {
    private final HashTrieMap<K, ?> owner;
    protected KeySet(final HashTrieMap<K, ?> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size();
    }
    public final Iterator<K> iterator() {
      return new KeyIterator<>(owner);
    }
    public final boolean contains(Object o) {
      return owner.containsKey(o);
    }

    public final void forEach(Consumer<? super K> action) {
      Objects.requireNonNull(action);
      if (owner.root != null) {
        owner.root.forEachLeaf(leaf -> action.accept(leaf.key));
      }
    }
  }

  protected static class Values<V> extends AbstractCollection<V> {
    private final HashTrieMap<?, V> owner;
    protected Values(final HashTrieMap<?, V> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size();
    }
    public final Iterator<V> iterator() {
      return new ValueIterator<>(owner);
    }

    public final void forEach(Consumer<? super V> action) {
      Objects.requireNonNull(action);
      if (owner.root != null) {
        owner.root.forEachLeaf(leaf -> action.accept(leaf.value));
      }
    }
  }

  protected static class EntrySet<K, V> extends AbstractSet<Map.Entry<K, V>> {
    private final HashTrieMap<K, V> owner;
    protected EntrySet(final HashTrieMap<K, V> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size();
    }
    public final Iterator<Map.Entry<K, V>> iterator() {
      return new EntryIterator<>(owner);
    }

    public final boolean contains(Object o) {
      if (!(o instanceof Map.Entry<?, ?>)) {
        return false;
      }
      Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
      return owner.containsEntry(e.getKey(), e.getValue());
    }
    public final void forEach(Consumer<? super Map.Entry<K, V>> action) {
      owner.forEach(action);
    }
  }

  protected static abstract class TrieIterator<K, V> {
    // pending nodes, the next one to visit on top
    private final Deque<TrieNode<K, V>> stack;

    protected TrieIterator(final HashTrieMap<K, V> owner) {
      this.stack = new ArrayDeque<>();
      if (owner.root != null) {
        this.stack.push(owner.root);
      }
    }

    // every pending node holds at least one leaf
    public final boolean hasNext() {
      return !this.stack.isEmpty();
    }

    protected Leaf<K, V> advance() {
      while (!this.stack.isEmpty()) {
        TrieNode<K, V> node = this.stack.pop();
        if (node instanceof Leaf<?, ?>) {
          return castUnsafe(node);
        }
        node.pushChildren(this.stack);
      }
      throw new NoSuchElementException();
    }
  }

  protected static class KeyIterator<K> extends TrieIterator<K, Object> implements Iterator<K> {
    protected KeyIterator(final HashTrieMap<K, ?> owner) {
      super(castUnsafe(owner));
    }
    public final K next() {
      return this.advance().key;
    }
  }

  protected static class ValueIterator<V> extends TrieIterator<Object, V> implements Iterator<V> {
    protected ValueIterator(final HashTrieMap<?, V> owner) {
      super(castUnsafe(owner));
    }
    public final V next() {
      return this.advance().value;
    }
  }

  protected static class EntryIterator<K, V> extends TrieIterator<K, V> implements Iterator<Map.Entry<K, V>> {
    protected EntryIterator(final HashTrieMap<K, V> owner) {
      super(owner);
    }
    public final Map.Entry<K, V> next() {
      return this.advance();
    }
  }

  // end section adapted from
  // https://github.com/apache/commons-collections/blob/master/src/main/java/org/apache/commons/collections4/map/AbstractHashedMap.java

  protected static class MapView<K, V> extends AbstractMap<K, V> {
    private final HashTrieMap<K, V> inner;

    protected MapView(final HashTrieMap<K, V> inner) {
      this.inner = inner;
    }

    @Override
    public int size() {
      return inner.size();
    }

    @Override
    public boolean isEmpty() {
      return inner.isEmpty();
    }

    @Override
    public boolean containsKey(Object key) {
      return inner.containsKey(key);
    }

    @Override
    public V get(Object key) {
      return inner.getOrDefault(key, null);
    }

    @Override
    public V getOrDefault(Object key, V defaultValue) {
      return inner.getOrDefault(key, defaultValue);
    }

    @Override
    public Set<K> keySet() {
      return inner.keys();
    }

    @Override
    public Collection<V> values() {
      return inner.values();
    }

    @Override
    public Set<Entry<K, V>> entrySet() {
      return inner.items();
    }
  }

  private Object writeReplace() {
    return new SerializationProxy<>(this);
  }

  private void readObject(ObjectInputStream in) throws InvalidObjectException {
    throw new InvalidObjectException("HashTrieMap must be read through its serialization proxy");
  }

  /** Writes the hasher, the size, then each key and value. The trie layout is not kept. */
  private static final class SerializationProxy<K, V> implements Serializable {
    private static final long serialVersionUID = 1L;
    private transient HashTrieMap<K, V> map;

    SerializationProxy(HashTrieMap<K, V> map) {
      this.map = map;
    }

    private void writeObject(ObjectOutputStream out) throws IOException {
      out.defaultWriteObject();
      out.writeObject(this.map.hasher);
      out.writeInt(this.map.size());
      for (Map.Entry<K, V> e : this.map) {
        out.writeObject(e.getKey());
        out.writeObject(e.getValue());
      }
    }

    private void readObject(ObjectInputStream in) throws IOException, ClassNotFoundException {
      in.defaultReadObject();
      Object hasher = in.readObject();
      if (!(hasher instanceof Hasher<?>)) {
        throw new InvalidObjectException("expected a Hasher, found " + hasher);
      }
      int size = in.readInt();
      if (size < 0) {
        throw new InvalidObjectException("negative size " + size);
      }
      Hasher<? super K> keyHasher = castUnsafe(hasher);
      HashTrieMap<K, V> result = empty(keyHasher);
      for (int i = 0; i < size; i++) {
        K key = castUnsafe(in.readObject());
        V value = castUnsafe(in.readObject());
        if (key == null) {
          throw new InvalidObjectException("null key at entry " + i);
        }
        result = result.insert(key, value);
      }
      if (result.size() != size) {
        throw new InvalidObjectException("duplicate keys: expected " + size + " entries, found " + result.size());
      }
      this.map = result;
    }

    private Object readResolve() {
      return this.map;
    }
  }
}
