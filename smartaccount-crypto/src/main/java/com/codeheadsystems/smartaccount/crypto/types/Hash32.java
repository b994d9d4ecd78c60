package com.codeheadsystems.smartaccount.crypto.types;

import com.codeheadsystems.smartaccount.crypto.common.ByteUtils;
import java.util.Arrays;

/**
 * A 32-byte digest or derived identifier.
 *
 * @param bytes the raw 32 bytes
 */
public record Hash32(byte[] bytes) {

  public static final int LENGTH = 32;

  public static final Hash32 ZERO = new Hash32(new byte[LENGTH]);

  public Hash32 {
    if (bytes == null || bytes.length != LENGTH) {
      throw new IllegalArgumentException("Hash must be " + LENGTH + " bytes");
    }
    bytes = bytes.clone();
  }

  public static Hash32 of(String hex) {
    return new Hash32(ByteUtils.fromHex(hex));
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  public String toHex() {
    return ByteUtils.toHex(bytes);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Hash32 other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return toHex();
  }
}
