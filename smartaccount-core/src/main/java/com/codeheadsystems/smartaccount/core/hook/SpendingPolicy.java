package com.codeheadsystems.smartaccount.core.hook;

import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.util.HashSet;
import java.util.Set;

/**
 * Account-wide switches of the spending-limit hook.
 *
 * @param paused    when true every non-whitelisted operation is rejected
 * @param whitelist callers and targets exempt from accounting
 */
public record SpendingPolicy(boolean paused, Set<Address> whitelist) {

  public static final SpendingPolicy DEFAULT = new SpendingPolicy(false, Set.of());

  public SpendingPolicy {
    whitelist = Set.copyOf(whitelist);
  }

  public boolean isWhitelisted(Address identity) {
    return whitelist.contains(identity);
  }

  public SpendingPolicy withPaused(boolean newPaused) {
    return new SpendingPolicy(newPaused, whitelist);
  }

  public SpendingPolicy withWhitelisted(Address identity, boolean whitelisted) {
    Set<Address> updated = new HashSet<>(whitelist);
    if (whitelisted) {
      updated.add(identity);
    } else {
      updated.remove(identity);
    }
    return new SpendingPolicy(paused, updated);
  }
}
