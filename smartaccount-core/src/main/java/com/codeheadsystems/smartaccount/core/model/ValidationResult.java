package com.codeheadsystems.smartaccount.core.model;

import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.util.Optional;

/**
 * Whether a validator authorized an operation, and on whose behalf.
 *
 * @param authorized   true if the operation may proceed
 * @param validationId the validator that decided
 * @param signer       the identity that signed, when one was recovered
 */
public record ValidationResult(boolean authorized, ValidationId validationId, Optional<Address> signer) {

  public static ValidationResult authorized(ValidationId validationId, Address signer) {
    return new ValidationResult(true, validationId, Optional.of(signer));
  }

  public static ValidationResult rejected(ValidationId validationId) {
    return new ValidationResult(false, validationId, Optional.empty());
  }
}
