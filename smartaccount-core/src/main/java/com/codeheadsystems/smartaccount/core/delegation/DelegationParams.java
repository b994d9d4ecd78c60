package com.codeheadsystems.smartaccount.core.delegation;

import com.codeheadsystems.smartaccount.crypto.types.Address;
import com.codeheadsystems.smartaccount.crypto.types.Selector;
import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

/**
 * What a delegator asks for when creating a delegation.
 *
 * @param delegatee        the identity receiving authority
 * @param type             the delegation type
 * @param duration         lifetime from creation
 * @param spendingLimit    cap on spend recorded against the delegation, zero for unlimited
 * @param allowedSelectors permitted selectors; required for {@link DelegationType#LIMITED} only
 */
public record DelegationParams(
    Address delegatee,
    DelegationType type,
    Duration duration,
    BigInteger spendingLimit,
    List<Selector> allowedSelectors) {

  public DelegationParams {
    if (delegatee == null || type == null || duration == null) {
      throw new IllegalArgumentException("delegatee, type and duration are required");
    }
    spendingLimit = spendingLimit == null ? BigInteger.ZERO : spendingLimit;
    if (spendingLimit.signum() < 0) {
      throw new IllegalArgumentException("spendingLimit must be non-negative");
    }
    allowedSelectors = allowedSelectors == null ? List.of() : List.copyOf(allowedSelectors);
  }

  public static DelegationParams of(Address delegatee, DelegationType type, Duration duration) {
    return new DelegationParams(delegatee, type, duration, BigInteger.ZERO, List.of());
  }

  public static DelegationParams limited(Address delegatee, Duration duration, BigInteger spendingLimit,
                                         List<Selector> allowedSelectors) {
    return new DelegationParams(delegatee, DelegationType.LIMITED, duration, spendingLimit, allowedSelectors);
  }

  public DelegationParams withSpendingLimit(BigInteger limit) {
    return new DelegationParams(delegatee, type, duration, limit, allowedSelectors);
  }
}
