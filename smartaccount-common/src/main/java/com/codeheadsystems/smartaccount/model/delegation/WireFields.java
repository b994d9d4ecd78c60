package com.codeheadsystems.smartaccount.model.delegation;

import com.codeheadsystems.smartaccount.crypto.common.ByteUtils;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.math.BigInteger;

/**
 * Field decoding shared by the wire records. Missing or malformed fields become
 * {@link IllegalArgumentException} naming the field.
 */
final class WireFields {

  private WireFields() {
  }

  static String required(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + fieldName);
    }
    return value;
  }

  static byte[] hex(String value, String fieldName) {
    String present = required(value, fieldName);
    try {
      return ByteUtils.fromHex(present);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid hex in field: " + fieldName, e);
    }
  }

  static Address address(String value, String fieldName) {
    byte[] bytes = hex(value, fieldName);
    if (bytes.length != Address.LENGTH) {
      throw new IllegalArgumentException("Invalid address in field: " + fieldName);
    }
    return new Address(bytes);
  }

  static BigInteger amount(String value, String fieldName) {
    String present = required(value, fieldName);
    BigInteger amount;
    try {
      amount = new BigInteger(present);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid amount in field: " + fieldName, e);
    }
    if (amount.signum() < 0) {
      throw new IllegalArgumentException("Negative amount in field: " + fieldName);
    }
    return amount;
  }
}
