package com.codeheadsystems.smartaccount.core.store;

import com.codeheadsystems.smartaccount.core.hook.SpendingLimitConfig;
import com.codeheadsystems.smartaccount.core.hook.SpendingPolicy;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.util.Optional;

/**
 * Spending limits keyed by (account, asset), plus each account's policy switches.
 */
public interface SpendingLimitStore extends AccountScopedStore {

  Optional<SpendingLimitConfig> load(Address account, Address asset);

  void store(Address account, SpendingLimitConfig config);

  void remove(Address account, Address asset);

  SpendingPolicy policy(Address account);

  void storePolicy(Address account, SpendingPolicy policy);

  /**
   * Drops all limits and the policy of the account.
   *
   * @param account the account
   */
  void clear(Address account);
}
