package com.codeheadsystems.smartaccount.crypto.common;

import java.math.BigInteger;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

/**
 * Utility methods for fixed-width big-endian encoding and hex conversion.
 */
public class ByteUtils {

  /**
   * Width of one ABI word in bytes.
   */
  public static final int WORD = 32;

  private static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

  private ByteUtils() {
  }

  /**
   * Encodes a non-negative integer as a big-endian octet string of the given length.
   *
   * @param value  the value
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] toFixedLength(BigInteger value, int length) {
    if (value.signum() < 0) {
      throw new IllegalArgumentException("Negative values cannot be encoded: " + value);
    }
    byte[] raw = value.toByteArray();
    int start = (raw.length > 1 && raw[0] == 0) ? 1 : 0;
    int size = raw.length - start;
    if (size > length) {
      throw new IllegalArgumentException("Value too large for specified length");
    }
    byte[] result = new byte[length];
    System.arraycopy(raw, start, result, length - size, size);
    return result;
  }

  /**
   * Encodes a uint256 as a 32-byte word.
   *
   * @param value the value, 0 ≤ value &lt; 2^256
   * @return the byte [ ]
   */
  public static byte[] uint256(BigInteger value) {
    if (value.compareTo(MAX_UINT256) > 0) {
      throw new IllegalArgumentException("Value exceeds uint256: " + value);
    }
    return toFixedLength(value, WORD);
  }

  /**
   * Encodes a non-negative long as a 32-byte word.
   *
   * @param value the value
   * @return the byte [ ]
   */
  public static byte[] uint256(long value) {
    return uint256(BigInteger.valueOf(value));
  }

  /**
   * Left-pads the input with zero bytes up to the given length.
   *
   * @param input  the input
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] leftPad(byte[] input, int length) {
    if (input.length > length) {
      throw new IllegalArgumentException("Input longer than pad length: " + input.length + " > " + length);
    }
    byte[] out = new byte[length];
    System.arraycopy(input, 0, out, length - input.length, input.length);
    return out;
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Hex encodes with a {@code 0x} prefix.
   *
   * @param bytes the bytes
   * @return the string
   */
  public static String toHex(byte[] bytes) {
    return "0x" + Hex.toHexString(bytes);
  }

  /**
   * Decodes hex with or without a {@code 0x} prefix.
   *
   * @param hex the hex string
   * @return the byte [ ]
   */
  public static byte[] fromHex(String hex) {
    if (hex == null) {
      throw new IllegalArgumentException("Missing hex value");
    }
    String stripped = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    if (stripped.length() % 2 != 0) {
      throw new IllegalArgumentException("Odd-length hex value: " + hex);
    }
    try {
      return Hex.decode(stripped);
    } catch (DecoderException e) {
      throw new IllegalArgumentException("Invalid hex value: " + hex, e);
    }
  }
}
