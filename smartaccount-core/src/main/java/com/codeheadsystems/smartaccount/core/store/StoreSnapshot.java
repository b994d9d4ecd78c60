package com.codeheadsystems.smartaccount.core.store;

/**
 * A captured copy of one account's slice of a store.
 */
@FunctionalInterface
public interface StoreSnapshot {

  /**
   * Puts the account's slice back exactly as it was when captured.
   */
  void restore();
}
