package com.codeheadsystems.smartaccount.crypto.ecdsa;

import com.codeheadsystems.smartaccount.crypto.common.ByteUtils;
import java.math.BigInteger;
import java.util.Arrays;

/**
 * A recoverable secp256k1 signature in the 65-byte {@code r ‖ s ‖ v} layout.
 *
 * @param r the r component
 * @param s the s component
 * @param v the recovery byte, 27 or 28
 */
public record EcdsaSignature(BigInteger r, BigInteger s, int v) {

  public static final int LENGTH = 65;

  /**
   * Parses the 65-byte layout. A recovery byte of 0 or 1 is normalized to 27 or 28.
   *
   * @param bytes the encoded signature
   * @return the signature
   */
  public static EcdsaSignature fromBytes(byte[] bytes) {
    if (bytes == null || bytes.length != LENGTH) {
      throw new IllegalArgumentException("Signature must be " + LENGTH + " bytes");
    }
    BigInteger r = new BigInteger(1, Arrays.copyOfRange(bytes, 0, 32));
    BigInteger s = new BigInteger(1, Arrays.copyOfRange(bytes, 32, 64));
    int v = bytes[64] & 0xFF;
    if (v < 27) {
      v += 27;
    }
    return new EcdsaSignature(r, s, v);
  }

  public byte[] toBytes() {
    return ByteUtils.concat(
        ByteUtils.toFixedLength(r, 32),
        ByteUtils.toFixedLength(s, 32),
        new byte[]{(byte) v});
  }

  /**
   * The recovery id in {0, 1}.
   */
  public int recoveryId() {
    return v - 27;
  }
}
