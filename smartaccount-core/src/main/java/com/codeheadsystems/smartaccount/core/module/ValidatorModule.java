package com.codeheadsystems.smartaccount.core.module;

import com.codeheadsystems.smartaccount.core.model.OperationContext;
import com.codeheadsystems.smartaccount.core.model.ValidationResult;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import com.codeheadsystems.smartaccount.crypto.types.Hash32;

/**
 * A module that can authorize operations and judge off-band signatures for an account.
 */
public interface ValidatorModule extends Module {

  /**
   * Decides whether the operation in the context is authorized. May record state, such as
   * delegated spend, which is rolled back if the surrounding operation is rejected.
   *
   * @param context the operation context
   * @return the decision
   */
  ValidationResult validateOperation(OperationContext context);

  /**
   * Off-band signature check.
   *
   * @param account   the account
   * @param hash      the signed digest
   * @param signature validator-specific signature bytes
   * @return true if the signature is acceptable for the account
   */
  boolean isValidSignature(Address account, Hash32 hash, byte[] signature);

  /**
   * Whether this validator is a recovery path allowed to replace the account's root authority.
   *
   * @return true for recovery validators
   */
  default boolean isRecoveryModule() {
    return false;
  }
}
