package com.codeheadsystems.smartaccount.core.store;

import com.codeheadsystems.smartaccount.core.hook.SpendingLimitConfig;
import com.codeheadsystems.smartaccount.core.hook.SpendingPolicy;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class InMemorySpendingLimitStore
    extends InMemoryAccountScopedStore<InMemorySpendingLimitStore.AccountLimits>
    implements SpendingLimitStore {

  record AccountLimits(Map<Address, SpendingLimitConfig> limits, SpendingPolicy policy) {

    static final AccountLimits EMPTY = new AccountLimits(Map.of(), SpendingPolicy.DEFAULT);

    AccountLimits withLimit(Address asset, SpendingLimitConfig config) {
      Map<Address, SpendingLimitConfig> copy = new HashMap<>(limits);
      if (config == null) {
        copy.remove(asset);
      } else {
        copy.put(asset, config);
      }
      return new AccountLimits(Map.copyOf(copy), policy);
    }
  }

  @Override
  public Optional<SpendingLimitConfig> load(Address account, Address asset) {
    return get(account).map(limits -> limits.limits().get(asset));
  }

  @Override
  public void store(Address account, SpendingLimitConfig config) {
    update(account, AccountLimits.EMPTY, limits -> limits.withLimit(config.asset(), config));
  }

  @Override
  public void remove(Address account, Address asset) {
    update(account, AccountLimits.EMPTY, limits -> limits.withLimit(asset, null));
  }

  @Override
  public SpendingPolicy policy(Address account) {
    return get(account).map(AccountLimits::policy).orElse(SpendingPolicy.DEFAULT);
  }

  @Override
  public void storePolicy(Address account, SpendingPolicy policy) {
    update(account, AccountLimits.EMPTY, limits -> new AccountLimits(limits.limits(), policy));
  }

  @Override
  public void clear(Address account) {
    remove(account);
  }
}
