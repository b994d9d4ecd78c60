package com.codeheadsystems.smartaccount.core.exception;

import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.math.BigInteger;

/**
 * Quota rejection from the spending-limit hook, carrying what was asked for and what was left.
 */
public class SpendingLimitExceededException extends SmartAccountException {

  private final Address asset;
  private final BigInteger amount;
  private final BigInteger remaining;

  public SpendingLimitExceededException(final Address asset, final BigInteger amount,
                                        final BigInteger remaining) {
    super(ErrorCode.SPENDING_LIMIT_EXCEEDED,
        "asset=" + asset + " amount=" + amount + " remaining=" + remaining);
    this.asset = asset;
    this.amount = amount;
    this.remaining = remaining;
  }

  public Address asset() {
    return asset;
  }

  public BigInteger amount() {
    return amount;
  }

  public BigInteger remaining() {
    return remaining;
  }
}
