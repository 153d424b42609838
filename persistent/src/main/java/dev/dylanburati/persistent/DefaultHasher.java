package dev.dylanburati.persistent;

import java.io.Serializable;
import java.util.Objects;

/* package-private */ final class DefaultHasher implements Hasher<Object>, Serializable {
  private static final long serialVersionUID = 1L;
  private static final DefaultHasher INSTANCE = new DefaultHasher();

  private DefaultHasher() {}

  static DefaultHasher instance() {
    return INSTANCE;
  }

  @Override
  public int hash(Object value) {
    Objects.requireNonNull(value, "key");
    if (value.getClass().isArray()) {
      // arrays hash by identity, so equal contents would land in different slots
      throw new IllegalArgumentException("unhashable key type: " + value.getClass().getSimpleName());
    }
    return spread(value.hashCode());
  }

  @Override
  public boolean equivalent(Object a, Object b) {
    return a == b || (a != null && a.equals(b));
  }

  static int spread(int h) {
    // https://github.com/aappleby/smhasher/blob/master/src/MurmurHash3.cpp (fmix32)
    h ^= h >>> 16;
    h *= 0x85ebca6b;
    h ^= h >>> 13;
    h *= 0xc2b2ae35;
    h ^= h >>> 16;
    return h;
  }

  private Object readResolve() {
    return INSTANCE;
  }
}
