package com.codeheadsystems.smartaccount.core.validation;

import com.codeheadsystems.smartaccount.crypto.types.Address;

/**
 * The one question signature validation asks of the delegation registry.
 */
@FunctionalInterface
public interface DelegationLookup {

  /**
   * Whether {@code delegatee} holds an active, unexpired delegation from {@code delegator} of a
   * kind that may sign on its behalf (full or executor).
   *
   * @param delegator the granting identity
   * @param delegatee the signer
   * @return true if the signer may stand in for the delegator
   */
  boolean hasSigningDelegation(Address delegator, Address delegatee);
}
