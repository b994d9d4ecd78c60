package com.codeheadsystems.smartaccount.crypto;

import com.codeheadsystems.smartaccount.crypto.types.Hash32;
import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.digests.KeccakDigest;

/**
 * Keccak-256 as used for account identifiers, selectors and signed digests.
 * This is the original Keccak padding, not FIPS-202 SHA3-256.
 */
public class Keccak {

  private Keccak() {
  }

  /**
   * Hashes the concatenation of the given inputs.
   *
   * @param inputs the inputs
   * @return the 32-byte digest
   */
  public static byte[] keccak256(byte[]... inputs) {
    KeccakDigest digest = new KeccakDigest(256);
    for (byte[] input : inputs) {
      digest.update(input, 0, input.length);
    }
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return out;
  }

  public static byte[] keccak256(String utf8) {
    return keccak256(utf8.getBytes(StandardCharsets.UTF_8));
  }

  public static Hash32 hash(byte[]... inputs) {
    return new Hash32(keccak256(inputs));
  }
}
