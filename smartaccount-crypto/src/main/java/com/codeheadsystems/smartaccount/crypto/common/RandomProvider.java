package com.codeheadsystems.smartaccount.crypto.common;

import java.security.SecureRandom;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random byte generation.
 * Used for key generation and for salts in tests that need reproducible identities.
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }
}
