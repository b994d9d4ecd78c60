package com.codeheadsystems.smartaccount.core.store;

import com.codeheadsystems.smartaccount.core.model.AccountState;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.util.Optional;

public class InMemoryAccountStore extends InMemoryAccountScopedStore<AccountState> implements AccountStore {

  @Override
  public Optional<AccountState> load(Address account) {
    return get(account);
  }

  @Override
  public void store(AccountState state) {
    put(state.address(), state);
  }
}
