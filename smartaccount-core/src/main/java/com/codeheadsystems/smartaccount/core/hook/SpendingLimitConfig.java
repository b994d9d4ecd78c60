package com.codeheadsystems.smartaccount.core.hook;

import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

/**
 * Rolling-period quota of one asset for one account.
 *
 * @param asset        the asset, {@link Address#ZERO} for the native currency
 * @param limit        maximum spend per period
 * @param periodLength period length
 * @param spent        spend recorded in the current period
 * @param periodStart  start of the current period
 * @param enabled      whether the quota is enforced
 */
public record SpendingLimitConfig(
    Address asset,
    BigInteger limit,
    Duration periodLength,
    BigInteger spent,
    Instant periodStart,
    boolean enabled) {

  public boolean periodElapsed(Instant now) {
    return Duration.between(periodStart, now).compareTo(periodLength) >= 0;
  }

  /**
   * The config as of {@code now}: once the period has elapsed the spend is cleared and a new
   * period starts at {@code now}, however many periods went by.
   *
   * @param now the current time
   * @return this config, or a reset copy
   */
  public SpendingLimitConfig resetIfElapsed(Instant now) {
    return periodElapsed(now) ? new SpendingLimitConfig(asset, limit, periodLength, BigInteger.ZERO, now, enabled) : this;
  }

  public BigInteger remaining() {
    return limit.subtract(spent).max(BigInteger.ZERO);
  }

  public SpendingLimitConfig withSpent(BigInteger newSpent) {
    return new SpendingLimitConfig(asset, limit, periodLength, newSpent, periodStart, enabled);
  }
}
