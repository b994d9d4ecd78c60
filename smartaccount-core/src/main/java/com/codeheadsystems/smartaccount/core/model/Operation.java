package com.codeheadsystems.smartaccount.core.model;

import com.codeheadsystems.smartaccount.crypto.Keccak;
import com.codeheadsystems.smartaccount.crypto.common.ByteUtils;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import com.codeheadsystems.smartaccount.crypto.types.Hash32;
import com.codeheadsystems.smartaccount.crypto.types.Selector;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Optional;

/**
 * A single call the account is asked to make.
 *
 * @param target   the callee
 * @param value    native value sent with the call
 * @param callData selector and arguments, empty for a plain value transfer
 */
public record Operation(Address target, BigInteger value, byte[] callData) {

  private static final byte[] DOMAIN = Keccak.keccak256("SmartAccountOperation(address account,"
      + "address target,uint256 value,bytes32 callDataHash,address validationId,uint256 nonce)");

  public Operation {
    if (target == null) {
      throw new IllegalArgumentException("Operation target is required");
    }
    if (value == null || value.signum() < 0) {
      throw new IllegalArgumentException("Operation value must be non-negative");
    }
    callData = callData == null ? new byte[0] : callData.clone();
  }

  public static Operation transfer(Address to, BigInteger value) {
    return new Operation(to, value, new byte[0]);
  }

  public static Operation call(Address target, byte[] callData) {
    return new Operation(target, BigInteger.ZERO, callData);
  }

  @Override
  public byte[] callData() {
    return callData.clone();
  }

  public Optional<Selector> selector() {
    return Selector.fromCallData(callData);
  }

  /**
   * The digest a validator signs to authorize this operation for one account, validator and nonce.
   *
   * @param account      the account that will make the call
   * @param validationId the validator the signature is meant for
   * @param nonce        the account's operation nonce
   * @return the digest
   */
  public Hash32 hash(Address account, ValidationId validationId, long nonce) {
    return Keccak.hash(
        DOMAIN,
        account.toWord(),
        target.toWord(),
        ByteUtils.uint256(value),
        Keccak.keccak256(callData),
        validationId.address().toWord(),
        ByteUtils.uint256(nonce));
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Operation other
        && target.equals(other.target)
        && value.equals(other.value)
        && Arrays.equals(callData, other.callData);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * target.hashCode() + value.hashCode()) + Arrays.hashCode(callData);
  }

  @Override
  public String toString() {
    return "Operation[target=" + target + ", value=" + value + ", callData=" + ByteUtils.toHex(callData) + "]";
  }
}
