package com.codeheadsystems.smartaccount.core.store;

import com.codeheadsystems.smartaccount.core.delegation.Delegation;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import com.codeheadsystems.smartaccount.crypto.types.Hash32;
import java.util.List;
import java.util.Optional;

/**
 * Storage of delegations, owned by their delegator and addressed by derived identifier.
 * Also holds each delegator's id sequence and signed-grant nonce.
 */
public interface DelegationStore extends AccountScopedStore {

  Optional<Delegation> load(Hash32 id);

  /**
   * Inserts or replaces a delegation under its delegator.
   *
   * @param delegation the delegation
   */
  void store(Delegation delegation);

  /**
   * All delegations of the delegator, in creation order, with persisted status.
   *
   * @param delegator the delegator
   * @return the delegations
   */
  List<Delegation> byDelegator(Address delegator);

  /**
   * Returns the delegator's current id sequence and advances it.
   *
   * @param delegator the delegator
   * @return the sequence value to use
   */
  long nextSequence(Address delegator);

  long grantNonce(Address delegator);

  void incrementGrantNonce(Address delegator);
}
