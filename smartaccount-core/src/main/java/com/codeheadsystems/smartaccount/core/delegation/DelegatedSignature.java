package com.codeheadsystems.smartaccount.core.delegation;

import com.codeheadsystems.smartaccount.crypto.common.ByteUtils;
import com.codeheadsystems.smartaccount.crypto.ecdsa.EcdsaSignature;
import com.codeheadsystems.smartaccount.crypto.types.Hash32;
import java.util.Arrays;
import java.util.Optional;

/**
 * Signature bytes accepted by the registry as validator: the 32-byte delegation id followed by
 * the delegatee's 65-byte ECDSA signature.
 *
 * @param delegationId the delegation being exercised
 * @param signature    the delegatee's signature
 */
public record DelegatedSignature(Hash32 delegationId, byte[] signature) {

  public static final int LENGTH = Hash32.LENGTH + EcdsaSignature.LENGTH;

  public DelegatedSignature {
    signature = signature.clone();
  }

  public static Optional<DelegatedSignature> decode(byte[] encoded) {
    if (encoded == null || encoded.length != LENGTH) {
      return Optional.empty();
    }
    return Optional.of(new DelegatedSignature(
        new Hash32(Arrays.copyOf(encoded, Hash32.LENGTH)),
        Arrays.copyOfRange(encoded, Hash32.LENGTH, LENGTH)));
  }

  public byte[] encode() {
    return ByteUtils.concat(delegationId.bytes(), signature);
  }

  @Override
  public byte[] signature() {
    return signature.clone();
  }
}
