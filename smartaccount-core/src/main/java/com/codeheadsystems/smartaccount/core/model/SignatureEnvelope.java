package com.codeheadsystems.smartaccount.core.model;

import com.codeheadsystems.smartaccount.crypto.common.ByteUtils;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.util.Arrays;

/**
 * Off-band signature presented to {@code isValidSignature}: the 20-byte validation id followed by
 * the validator-specific signature.
 *
 * @param validationId the validator that should judge the signature
 * @param signature    the validator-specific signature
 */
public record SignatureEnvelope(ValidationId validationId, byte[] signature) {

  public SignatureEnvelope {
    signature = signature == null ? new byte[0] : signature.clone();
  }

  public static SignatureEnvelope root(byte[] signature) {
    return new SignatureEnvelope(ValidationId.ROOT, signature);
  }

  /**
   * Splits an encoded envelope.
   *
   * @param encoded validation id followed by signature
   * @return the envelope
   * @throws IllegalArgumentException if the encoding is shorter than a validation id
   */
  public static SignatureEnvelope decode(byte[] encoded) {
    if (encoded == null || encoded.length < Address.LENGTH) {
      throw new IllegalArgumentException("Signature envelope too short");
    }
    Address id = new Address(Arrays.copyOf(encoded, Address.LENGTH));
    return new SignatureEnvelope(new ValidationId(id),
        Arrays.copyOfRange(encoded, Address.LENGTH, encoded.length));
  }

  public byte[] encode() {
    return ByteUtils.concat(validationId.address().bytes(), signature);
  }

  @Override
  public byte[] signature() {
    return signature.clone();
  }
}
