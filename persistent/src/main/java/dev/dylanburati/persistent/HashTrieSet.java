package dev.dylanburati.persistent;

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Persistent hash set, stored as the keys of a {@link HashTrieMap}.
 *
 * Unlike the map, a set is hashable: its hash is the sum of its elements' hashes under the
 * set's {@link Hasher}. Sets with different hashers are never equal.
 */
public final class HashTrieSet<E> implements Iterable<E>, Serializable {
  private static final long serialVersionUID = 1L;
  private static final HashTrieSet<?> EMPTY = new HashTrieSet<>(HashTrieMap.empty());

  private final HashTrieMap<E, Boolean> map;

  private HashTrieSet(HashTrieMap<E, Boolean> map) {
    this.map = map;
  }

  @SuppressWarnings("unchecked")
  public static <E> HashTrieSet<E> empty() {
    return (HashTrieSet<E>) EMPTY;
  }

  public static <E> HashTrieSet<E> empty(final Hasher<? super E> hasher) {
    return new HashTrieSet<>(HashTrieMap.empty(hasher));
  }

  @SafeVarargs
  public static <E> HashTrieSet<E> of(E... elements) {
    HashTrieSet<E> result = empty();
    for (E e : elements) {
      result = result.insert(e);
    }
    return result;
  }

  public static <E> HashTrieSet<E> from(Iterable<? extends E> elements) {
    HashTrieSet<E> result = empty();
    for (E e : elements) {
      result = result.insert(e);
    }
    return result;
  }

  private HashTrieSet<E> withMap(HashTrieMap<E, Boolean> map) {
    return map == this.map ? this : new HashTrieSet<>(map);
  }

  public int size() {
    return this.map.size();
  }

  public boolean isEmpty() {
    return this.map.isEmpty();
  }

  public boolean contains(Object element) {
    return this.map.containsKey(element);
  }

  public HashTrieSet<E> insert(E element) {
    return this.withMap(this.map.insert(element, Boolean.TRUE));
  }

  /**
   * @throws KeyNotFoundException if the element is absent
   */
  public HashTrieSet<E> remove(Object element) {
    return this.withMap(this.map.remove(element));
  }

  public HashTrieSet<E> discard(Object element) {
    return this.withMap(this.map.discard(element));
  }

  /** Elements of either set. Uses this set's hasher. */
  public HashTrieSet<E> union(HashTrieSet<? extends E> other) {
    HashTrieMap<E, Boolean> result = this.map;
    for (E e : other) {
      result = result.insert(e, Boolean.TRUE);
    }
    return this.withMap(result);
  }

  /** Elements of this set that {@code other} also contains. */
  public HashTrieSet<E> intersection(HashTrieSet<?> other) {
    HashTrieMap<E, Boolean> result = HashTrieMap.empty(this.map.hasher());
    for (E e : this) {
      if (other.contains(e)) {
        result = result.insert(e, Boolean.TRUE);
      }
    }
    return result.size() == this.size() ? this : new HashTrieSet<>(result);
  }

  /** Elements of this set that {@code other} does not contain. */
  public HashTrieSet<E> difference(HashTrieSet<?> other) {
    HashTrieMap<E, Boolean> result = this.map;
    if (other.size() < this.size() && this.map.hasher().equals(other.map.hasher())) {
      for (Object e : other) {
        result = result.discard(e);
      }
    } else {
      for (E e : this) {
        if (other.contains(e)) {
          result = result.discard(e);
        }
      }
    }
    return this.withMap(result);
  }

  @Override
  public Iterator<E> iterator() {
    return this.map.keys().iterator();
  }

  /** Read-only {@link java.util.Set} view. */
  public Set<E> asSet() {
    return this.map.keys();
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof HashTrieSet<?>)) {
      return false;
    }
    HashTrieSet<?> other = (HashTrieSet<?>) o;
    if (this.size() != other.size() || !this.map.hasher().equals(other.map.hasher())) {
      return false;
    }
    for (E e : this) {
      if (!other.contains(e)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    Hasher<? super E> hasher = this.map.hasher();
    int h = 0;
    for (E e : this) {
      h += hasher.hash(e);
    }
    return h;
  }

  @Override
  public String toString() {
    StringJoiner joiner = new StringJoiner(", ", "HashTrieSet({", "})");
    for (E e : this) {
      joiner.add(String.valueOf(e));
    }
    return joiner.toString();
  }

  private Object writeReplace() {
    return new SerializationProxy<>(this);
  }

  private void readObject(ObjectInputStream in) throws InvalidObjectException {
    throw new InvalidObjectException("HashTrieSet must be read through its serialization proxy");
  }

  private static final class SerializationProxy<E> implements Serializable {
    private static final long serialVersionUID = 1L;
    private transient HashTrieSet<E> set;

    SerializationProxy(HashTrieSet<E> set) {
      this.set = set;
    }

    private void writeObject(ObjectOutputStream out) throws IOException {
      out.defaultWriteObject();
      out.writeObject(this.set.map.hasher());
      out.writeInt(this.set.size());
      for (E e : this.set) {
        out.writeObject(e);
      }
    }

    @SuppressWarnings("unchecked")
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
      HashTrieSet<E> result = empty((Hasher<? super E>) hasher);
      for (int i = 0; i < size; i++) {
        Object e = in.readObject();
        if (e == null) {
          throw new InvalidObjectException("null element at position " + i);
        }
        result = result.insert((E) e);
      }
      if (result.size() != size) {
        throw new InvalidObjectException("duplicate elements: expected " + size + ", found " + result.size());
      }
      this.set = result;
    }

    private Object readResolve() {
      return this.set;
    }
  }
}
