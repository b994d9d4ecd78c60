package com.codeheadsystems.smartaccount.core.model;

import com.codeheadsystems.smartaccount.crypto.types.Address;

/**
 * Names the validator an operation intends to satisfy. {@link #ROOT} (zero) is reserved for the
 * account's root authority; every other id is the address of an installed validator module.
 *
 * @param address the validator module address, or zero for root
 */
public record ValidationId(Address address) {

  public static final ValidationId ROOT = new ValidationId(Address.ZERO);

  public ValidationId {
    if (address == null) {
      throw new IllegalArgumentException("ValidationId address is required");
    }
  }

  public static ValidationId of(Address moduleAddress) {
    return new ValidationId(moduleAddress);
  }

  public boolean isRoot() {
    return address.isZero();
  }
}
