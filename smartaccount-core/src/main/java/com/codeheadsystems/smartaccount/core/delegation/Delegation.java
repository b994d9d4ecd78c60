package com.codeheadsystems.smartaccount.core.delegation;

import com.codeheadsystems.smartaccount.crypto.types.Address;
import com.codeheadsystems.smartaccount.crypto.types.Hash32;
import com.codeheadsystems.smartaccount.crypto.types.Selector;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Set;

/**
 * A stored delegation. {@link #status()} is the persisted status; use {@link #effectiveStatus}
 * to see it as of a given time.
 *
 * @param id               derived identifier
 * @param delegator        the account granting authority
 * @param delegatee        the identity receiving authority
 * @param type             the delegation type
 * @param status           persisted status
 * @param startTime        creation time
 * @param endTime          last instant the delegation is active
 * @param spendingLimit    cap on recorded spend, zero for unlimited
 * @param spentAmount      recorded spend
 * @param allowedSelectors permitted selectors for limited delegations
 */
public record Delegation(
    Hash32 id,
    Address delegator,
    Address delegatee,
    DelegationType type,
    DelegationStatus status,
    Instant startTime,
    Instant endTime,
    BigInteger spendingLimit,
    BigInteger spentAmount,
    Set<Selector> allowedSelectors) {

  public Delegation {
    allowedSelectors = Set.copyOf(allowedSelectors);
  }

  public boolean isExpiredAt(Instant now) {
    return now.isAfter(endTime);
  }

  /**
   * The status as of {@code now}: an active delegation past its end time reads as expired even
   * before the flip is persisted.
   *
   * @param now the current time
   * @return the effective status
   */
  public DelegationStatus effectiveStatus(Instant now) {
    if (status == DelegationStatus.ACTIVE && isExpiredAt(now)) {
      return DelegationStatus.EXPIRED;
    }
    return status;
  }

  public boolean isActiveAt(Instant now) {
    return effectiveStatus(now) == DelegationStatus.ACTIVE;
  }

  public boolean hasSpendingLimit() {
    return spendingLimit.signum() > 0;
  }

  /**
   * What can still be spent. Meaningless without a limit; check {@link #hasSpendingLimit()} first.
   *
   * @return limit minus spent, or zero when unlimited
   */
  public BigInteger remaining() {
    return hasSpendingLimit() ? spendingLimit.subtract(spentAmount) : BigInteger.ZERO;
  }

  public boolean permits(Selector selector) {
    return type != DelegationType.LIMITED || allowedSelectors.contains(selector);
  }

  public Delegation withStatus(DelegationStatus newStatus) {
    return new Delegation(id, delegator, delegatee, type, newStatus, startTime, endTime,
        spendingLimit, spentAmount, allowedSelectors);
  }

  public Delegation withSpentAmount(BigInteger newSpent) {
    return new Delegation(id, delegator, delegatee, type, status, startTime, endTime,
        spendingLimit, newSpent, allowedSelectors);
  }
}
