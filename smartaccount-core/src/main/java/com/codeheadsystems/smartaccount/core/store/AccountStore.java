package com.codeheadsystems.smartaccount.core.store;

import com.codeheadsystems.smartaccount.core.model.AccountState;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.util.Optional;

/**
 * Storage of account aggregates, keyed by account address.
 */
public interface AccountStore extends AccountScopedStore {

  Optional<AccountState> load(Address account);

  /**
   * Stores or replaces the aggregate under its own address.
   *
   * @param state the account state
   */
  void store(AccountState state);
}
