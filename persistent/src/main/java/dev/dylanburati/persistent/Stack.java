package dev.dylanburati.persistent;

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Persistent LIFO stack, a singly linked list whose tails are shared between every stack
 * derived from them.
 *
 * Iteration starts at the top. Equality and hashing are order-sensitive. Elements may be
 * {@code null}.
 */
public final class Stack<E> implements Iterable<E>, Serializable {
  private static final long serialVersionUID = 1L;
  private static final Stack<?> EMPTY = new Stack<>(null, 0);

  private final Cons<E> head;
  private final int size;
  // cached, 0 until computed
  private transient int hash;

  private static final class Cons<E> {
    final E value;
    final Cons<E> rest;

    Cons(E value, Cons<E> rest) {
      this.value = value;
      this.rest = rest;
    }
  }

  private Stack(Cons<E> head, int size) {
    this.head = head;
    this.size = size;
  }

  @SuppressWarnings("unchecked")
  public static <E> Stack<E> empty() {
    return (Stack<E>) EMPTY;
  }

  /** Pushes the elements in order, so the last one ends up on top. */
  @SafeVarargs
  public static <E> Stack<E> of(E... elements) {
    Stack<E> result = empty();
    for (E e : elements) {
      result = result.push(e);
    }
    return result;
  }

  /** Pushes the elements in iteration order, so the last one ends up on top. */
  public static <E> Stack<E> from(Iterable<? extends E> elements) {
    Stack<E> result = empty();
    for (E e : elements) {
      result = result.push(e);
    }
    return result;
  }

  public Stack<E> push(E value) {
    return new Stack<>(new Cons<>(value, this.head), this.size + 1);
  }

  /**
   * Returns the stack below the top element.
   *
   * @throws NoSuchElementException if the stack is empty
   */
  public Stack<E> pop() {
    if (this.head == null) {
      throw new NoSuchElementException("Stack is empty");
    }
    if (this.head.rest == null) {
      return empty();
    }
    return new Stack<>(this.head.rest, this.size - 1);
  }

  /**
   * Returns the top element.
   *
   * @throws NoSuchElementException if the stack is empty
   */
  public E peek() {
    if (this.head == null) {
      throw new NoSuchElementException("Stack is empty");
    }
    return this.head.value;
  }

  public int size() {
    return this.size;
  }

  public boolean isEmpty() {
    return this.head == null;
  }

  /** Returns a stack with the same elements, the current bottom on top. */
  public Stack<E> reverse() {
    Stack<E> result = empty();
    for (E e : this) {
      result = result.push(e);
    }
    return result;
  }

  @Override
  public Iterator<E> iterator() {
    return new Iterator<E>() {
      private Cons<E> next = head;

      @Override
      public boolean hasNext() {
        return this.next != null;
      }

      @Override
      public E next() {
        if (this.next == null) {
          throw new NoSuchElementException();
        }
        E value = this.next.value;
        this.next = this.next.rest;
        return value;
      }
    };
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof Stack<?>)) {
      return false;
    }
    Stack<?> other = (Stack<?>) o;
    if (this.size != other.size) {
      return false;
    }
    Cons<?> a = this.head;
    Cons<?> b = other.head;
    // stop early once both share a tail
    while (a != b) {
      if (!Objects.equals(a.value, b.value)) {
        return false;
      }
      a = a.rest;
      b = b.rest;
    }
    return true;
  }

  @Override
  public int hashCode() {
    int h = this.hash;
    if (h == 0 && this.head != null) {
      h = 1;
      for (Cons<E> c = this.head; c != null; c = c.rest) {
        h = 31 * h + Objects.hashCode(c.value);
      }
      this.hash = h;
    }
    return this.head == null ? 1 : h;
  }

  /** Renders the elements bottom to top, the order they were pushed in. */
  @Override
  public String toString() {
    List<E> elements = new ArrayList<>(this.size);
    for (E e : this) {
      elements.add(e);
    }
    Collections.reverse(elements);
    return "Stack(" + elements + ")";
  }

  private Object writeReplace() {
    return new SerializationProxy<>(this);
  }

  private void readObject(ObjectInputStream in) throws InvalidObjectException {
    throw new InvalidObjectException("Stack must be read through its serialization proxy");
  }

  /** Writes the size, then the elements bottom to top. */
  private static final class SerializationProxy<E> implements Serializable {
    private static final long serialVersionUID = 1L;
    private transient Stack<E> stack;

    SerializationProxy(Stack<E> stack) {
      this.stack = stack;
    }

    private void writeObject(ObjectOutputStream out) throws IOException {
      out.defaultWriteObject();
      out.writeInt(this.stack.size);
      for (E e : this.stack.reverse()) {
        out.writeObject(e);
      }
    }

    @SuppressWarnings("unchecked")
    private void readObject(ObjectInputStream in) throws IOException, ClassNotFoundException {
      in.defaultReadObject();
      int size = in.readInt();
      if (size < 0) {
        throw new InvalidObjectException("negative size " + size);
      }
      Stack<E> result = empty();
      for (int i = 0; i < size; i++) {
        result = result.push((E) in.readObject());
      }
      this.stack = result;
    }

    private Object readResolve() {
      return this.stack;
    }
  }
}
