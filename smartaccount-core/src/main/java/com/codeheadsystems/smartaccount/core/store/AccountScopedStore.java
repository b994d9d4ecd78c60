package com.codeheadsystems.smartaccount.core.store;

import com.codeheadsystems.smartaccount.crypto.types.Address;

/**
 * A store whose state is partitioned by owning account. Every store taking part in account
 * transactions implements this so a rejected operation can be rolled back.
 * <p>
 * Implementations must be thread-safe. Snapshots are taken and restored while the account's
 * transaction lock is held.
 */
public interface AccountScopedStore {

  /**
   * Captures everything this store holds for the account.
   *
   * @param account the owning account
   * @return a snapshot that restores the captured state
   */
  StoreSnapshot snapshot(Address account);
}
