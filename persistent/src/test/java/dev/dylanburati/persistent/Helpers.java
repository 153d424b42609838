package dev.dylanburati.persistent;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.ObjectStreamClass;
import java.io.ObjectStreamConstants;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class Helpers {
  public static <T> List<T> reversed(List<T> original) {
    List<T> result = new ArrayList<>(original);
    Collections.reverse(result);
    return result;
  }

  public static byte[] serialize(Object value) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
      out.writeObject(value);
    }
    return bytes.toByteArray();
  }

  public static Object deserialize(byte[] data) throws IOException, ClassNotFoundException {
    try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(data))) {
      return in.readObject();
    }
  }

  /**
   * A stream holding an instance of {@code cls} itself, with no field data, as if it had been
   * written without a serialization proxy.
   */
  public static byte[] streamWithoutProxy(Class<?> cls) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(bytes)) {
      out.writeShort(ObjectStreamConstants.STREAM_MAGIC);
      out.writeShort(ObjectStreamConstants.STREAM_VERSION);
      out.writeByte(ObjectStreamConstants.TC_OBJECT);
      out.writeByte(ObjectStreamConstants.TC_CLASSDESC);
      out.writeUTF(cls.getName());
      out.writeLong(ObjectStreamClass.lookup(cls).getSerialVersionUID());
      out.writeByte(ObjectStreamConstants.SC_SERIALIZABLE);
      out.writeShort(0);
      out.writeByte(ObjectStreamConstants.TC_ENDBLOCKDATA);
      out.writeByte(ObjectStreamConstants.TC_NULL);
    }
    return bytes.toByteArray();
  }

  /**
   * Rewrites the size of a serialized empty collection. The size is the last int its proxy
   * writes, so the stream ends with a 4-byte data block and the end marker.
   */
  public static byte[] withEmptySizeReplaced(byte[] data, int size) {
    int end = data.length - 1;
    byte[] expectedTail = {ObjectStreamConstants.TC_BLOCKDATA, 4, 0, 0, 0, 0, ObjectStreamConstants.TC_ENDBLOCKDATA};
    if (!Arrays.equals(expectedTail, Arrays.copyOfRange(data, data.length - expectedTail.length, data.length))) {
      throw new IllegalArgumentException("not a serialized empty collection");
    }
    byte[] result = data.clone();
    result[end - 4] = (byte) (size >>> 24);
    result[end - 3] = (byte) (size >>> 16);
    result[end - 2] = (byte) (size >>> 8);
    result[end - 1] = (byte) size;
    return result;
  }

  /** Hashes like the string "33" but only equals itself. */
  public static final class Collider implements Serializable {
    private static final long serialVersionUID = 1L;
    private final String name;

    public Collider(String name) {
      this.name = name;
    }

    @Override
    public int hashCode() {
      return "33".hashCode();
    }

    @Override
    public String toString() {
      return "Collider(" + this.name + ")";
    }
  }
}
