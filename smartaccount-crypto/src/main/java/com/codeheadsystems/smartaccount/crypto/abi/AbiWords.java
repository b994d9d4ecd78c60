package com.codeheadsystems.smartaccount.crypto.abi;

import com.codeheadsystems.smartaccount.crypto.common.ByteUtils;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import com.codeheadsystems.smartaccount.crypto.types.Selector;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.Arrays;

/**
 * Static-type ABI word encoding: call data is a selector followed by 32-byte words.
 * Dynamic types are not supported.
 */
public class AbiWords {

  private AbiWords() {
  }

  /**
   * Builds call data from a selector and pre-encoded words.
   *
   * @param selector the selector
   * @param words    the 32-byte argument words
   * @return the call data
   */
  public static byte[] callData(Selector selector, byte[]... words) {
    return ByteUtils.concat(selector.bytes(), encodeWords(words));
  }

  /**
   * Concatenates 32-byte words without a selector, as used for module init data.
   *
   * @param words the words
   * @return the encoding
   */
  public static byte[] encodeWords(byte[]... words) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (byte[] word : words) {
      if (word.length != ByteUtils.WORD) {
        throw new IllegalArgumentException("ABI words must be " + ByteUtils.WORD + " bytes");
      }
      out.writeBytes(word);
    }
    return out.toByteArray();
  }

  public static int wordCount(byte[] data) {
    if (data == null || data.length % ByteUtils.WORD != 0) {
      throw new IllegalArgumentException("Data is not a whole number of words");
    }
    return data.length / ByteUtils.WORD;
  }

  /**
   * Reads the word at the given index of selector-less data.
   *
   * @param data  the encoded words
   * @param index zero-based word index
   * @return the 32-byte word
   */
  public static byte[] wordAt(byte[] data, int index) {
    int start = index * ByteUtils.WORD;
    if (data == null || index < 0 || data.length < start + ByteUtils.WORD) {
      throw new IllegalArgumentException("Data too short for word " + index);
    }
    return Arrays.copyOfRange(data, start, start + ByteUtils.WORD);
  }

  public static byte[] word(Address address) {
    return address.toWord();
  }

  public static byte[] word(BigInteger value) {
    return ByteUtils.uint256(value);
  }

  /**
   * Reads the argument word at the given index, skipping the selector.
   *
   * @param callData the call data
   * @param index    zero-based argument index
   * @return the 32-byte word
   */
  public static byte[] argument(byte[] callData, int index) {
    int start = Selector.LENGTH + index * ByteUtils.WORD;
    int end = start + ByteUtils.WORD;
    if (callData == null || callData.length < end) {
      throw new IllegalArgumentException("Call data too short for argument " + index);
    }
    return Arrays.copyOfRange(callData, start, end);
  }

  public static Address addressArgument(byte[] callData, int index) {
    return Address.fromWord(argument(callData, index));
  }

  public static BigInteger uintArgument(byte[] callData, int index) {
    return new BigInteger(1, argument(callData, index));
  }
}
