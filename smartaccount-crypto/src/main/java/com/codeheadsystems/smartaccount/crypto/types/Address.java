package com.codeheadsystems.smartaccount.crypto.types;

import com.codeheadsystems.smartaccount.crypto.common.ByteUtils;
import java.util.Arrays;

/**
 * A 20-byte account or module identifier.
 * <p>
 * Compares by content so it can be used as a map key. {@link #ZERO} is never a valid
 * authority, delegatee or validator.
 *
 * @param bytes the raw 20 bytes
 */
public record Address(byte[] bytes) implements Comparable<Address> {

  public static final int LENGTH = 20;

  public static final Address ZERO = new Address(new byte[LENGTH]);

  public Address {
    if (bytes == null || bytes.length != LENGTH) {
      throw new IllegalArgumentException("Address must be " + LENGTH + " bytes");
    }
    bytes = bytes.clone();
  }

  /**
   * Parses a hex address with or without the {@code 0x} prefix.
   *
   * @param hex the hex string
   * @return the address
   */
  public static Address of(String hex) {
    return new Address(ByteUtils.fromHex(hex));
  }

  /**
   * Takes the low-order 20 bytes of a 32-byte word, as ABI-encoded addresses are laid out.
   *
   * @param word the 32-byte word
   * @return the address
   */
  public static Address fromWord(byte[] word) {
    if (word.length != ByteUtils.WORD) {
      throw new IllegalArgumentException("Address word must be " + ByteUtils.WORD + " bytes");
    }
    return new Address(Arrays.copyOfRange(word, ByteUtils.WORD - LENGTH, ByteUtils.WORD));
  }

  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  public boolean isZero() {
    return equals(ZERO);
  }

  public byte[] toWord() {
    return ByteUtils.leftPad(bytes, ByteUtils.WORD);
  }

  public String toHex() {
    return ByteUtils.toHex(bytes);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Address other && Arrays.equals(bytes, other.bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public int compareTo(Address other) {
    return Arrays.compareUnsigned(bytes, other.bytes);
  }

  @Override
  public String toString() {
    return toHex();
  }
}
