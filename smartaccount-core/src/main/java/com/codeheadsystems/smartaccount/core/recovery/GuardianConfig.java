package com.codeheadsystems.smartaccount.core.recovery;

import com.codeheadsystems.smartaccount.crypto.abi.AbiWords;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Guardian set of one account. Structural only; policy bounds are checked by
 * {@link GuardianRecoveryValidator}.
 * <p>
 * Install data layout, one 32-byte word each: threshold, recovery delay in seconds, guardian
 * count, then the guardian addresses.
 *
 * @param guardians     guardian identities in the order they were added
 * @param threshold     approvals required to execute a recovery
 * @param recoveryDelay time that must pass after initiation
 */
public record GuardianConfig(List<Address> guardians, int threshold, Duration recoveryDelay) {

  private static final int HEADER_WORDS = 3;

  public GuardianConfig {
    guardians = List.copyOf(guardians);
  }

  public static GuardianConfig decode(byte[] initData) {
    int words = AbiWords.wordCount(initData);
    if (words < HEADER_WORDS) {
      throw new IllegalArgumentException("Guardian config too short");
    }
    int threshold = smallInt(AbiWords.wordAt(initData, 0), "threshold");
    long delaySeconds = new BigInteger(1, AbiWords.wordAt(initData, 1)).longValueExact();
    int count = smallInt(AbiWords.wordAt(initData, 2), "guardian count");
    if (words != HEADER_WORDS + count) {
      throw new IllegalArgumentException("Guardian count does not match data length");
    }
    List<Address> guardians = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      guardians.add(Address.fromWord(AbiWords.wordAt(initData, HEADER_WORDS + i)));
    }
    return new GuardianConfig(guardians, threshold, Duration.ofSeconds(delaySeconds));
  }

  private static int smallInt(byte[] word, String name) {
    try {
      return new BigInteger(1, word).intValueExact();
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Guardian config " + name + " out of range", e);
    }
  }

  public byte[] encode() {
    List<byte[]> words = new ArrayList<>();
    words.add(AbiWords.word(BigInteger.valueOf(threshold)));
    words.add(AbiWords.word(BigInteger.valueOf(recoveryDelay.toSeconds())));
    words.add(AbiWords.word(BigInteger.valueOf(guardians.size())));
    guardians.forEach(g -> words.add(AbiWords.word(g)));
    return AbiWords.encodeWords(words.toArray(new byte[0][]));
  }

  public boolean isGuardian(Address identity) {
    return guardians.contains(identity);
  }

  public GuardianConfig withGuardians(List<Address> newGuardians) {
    return new GuardianConfig(newGuardians, threshold, recoveryDelay);
  }

  public GuardianConfig withThreshold(int newThreshold) {
    return new GuardianConfig(guardians, newThreshold, recoveryDelay);
  }

  public GuardianConfig withRecoveryDelay(Duration newDelay) {
    return new GuardianConfig(guardians, threshold, newDelay);
  }
}
