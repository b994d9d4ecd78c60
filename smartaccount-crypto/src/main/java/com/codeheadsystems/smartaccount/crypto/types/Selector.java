package com.codeheadsystems.smartaccount.crypto.types;

import com.codeheadsystems.smartaccount.crypto.Keccak;
import com.codeheadsystems.smartaccount.crypto.common.ByteUtils;
import java.util.Arrays;
import java.util.Optional;

/**
 * The 4-byte method identifier at the head of call data.
 *
 * @param bytes the raw 4 bytes
 */
public record Selector(byte[] bytes) {

  public static final int LENGTH = 4;

  public Selector {
    if (bytes == null || bytes.length != LENGTH) {
      throw new IllegalArgumentException("Selector must be " + LENGTH + " bytes");
    }
    bytes = bytes.clone();
  }

  /**
   * Derives the selector from a canonical signature such as {@code transfer(address,uint256)}.
   *
   * @param signature the canonical method signature
   * @return the selector
   */
  public static Selector fromSignature(String signature) {
    return new Selector(Arrays.copyOf(Keccak.keccak256(signature), LENGTH));
  }

  public static Selector of(String hex) {
    return new Selector(ByteUtils.fromHex(hex));
  }

  /**
   * Reads the selector from call data, if the call data is long enough to carry one.
   *
   * @param callData the call data
   * @return the selector or empty for plain value transfers
   */
  public static Optional<Selector> fromCallData(byte[] callData) {
    if (callData == null || callData.length < LENGTH) {
      return Optional.empty();
    }
    return Optional.of(new Selector(Arrays.copyOf(callData, LENGTH)));
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
    return o instanceof Selector other && Arrays.equals(bytes, other.bytes);
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
