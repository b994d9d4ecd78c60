package com.codeheadsystems.smartaccount.core.model;

/**
 * An operation as submitted by the outer dispatcher: what to do, which validator should
 * authorize it, the account nonce it was signed for, and the validator-specific signature.
 *
 * @param operation    the call
 * @param validationId the validator the caller intends to satisfy
 * @param nonce        the account operation nonce
 * @param signature    validator-specific authorization bytes
 */
public record SignedOperation(Operation operation, ValidationId validationId, long nonce, byte[] signature) {

  public SignedOperation {
    if (operation == null) {
      throw new IllegalArgumentException("Operation is required");
    }
    signature = signature == null ? new byte[0] : signature.clone();
  }

  @Override
  public byte[] signature() {
    return signature.clone();
  }
}
