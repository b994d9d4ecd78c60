package com.codeheadsystems.smartaccount.core.model;

import com.codeheadsystems.smartaccount.crypto.types.Address;
import com.codeheadsystems.smartaccount.crypto.types.Hash32;

/**
 * Everything a validator sees when asked to authorize an operation.
 *
 * @param account       the account the operation runs on
 * @param operation     the call
 * @param validationId  the validator the operation declared
 * @param operationHash the digest covering account, call, validator and nonce
 * @param signature     validator-specific authorization bytes
 */
public record OperationContext(
    Address account,
    Operation operation,
    ValidationId validationId,
    Hash32 operationHash,
    byte[] signature) {

  public OperationContext {
    signature = signature == null ? new byte[0] : signature.clone();
  }

  public static OperationContext of(Address account, SignedOperation signed) {
    return new OperationContext(account, signed.operation(), signed.validationId(),
        signed.operation().hash(account, signed.validationId(), signed.nonce()), signed.signature());
  }

  @Override
  public byte[] signature() {
    return signature.clone();
  }
}
