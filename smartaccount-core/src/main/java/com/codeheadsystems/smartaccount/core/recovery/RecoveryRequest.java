package com.codeheadsystems.smartaccount.core.recovery;

import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The single outstanding recovery proposal of an account.
 *
 * @param newRootAuthority proposed root authority
 * @param initiatedAt      when the proposal was made
 * @param approvals        guardians that approved, in approval order
 * @param nonce            per-account request sequence number
 */
public record RecoveryRequest(Address newRootAuthority, Instant initiatedAt, Set<Address> approvals, long nonce) {

  public RecoveryRequest {
    approvals = Collections.unmodifiableSet(new LinkedHashSet<>(approvals));
  }

  public int approvalCount() {
    return approvals.size();
  }

  public boolean hasApproved(Address guardian) {
    return approvals.contains(guardian);
  }

  public Instant executableAt(Duration recoveryDelay) {
    return initiatedAt.plus(recoveryDelay);
  }

  public RecoveryRequest withApproval(Address guardian) {
    Set<Address> updated = new LinkedHashSet<>(approvals);
    updated.add(guardian);
    return new RecoveryRequest(newRootAuthority, initiatedAt, updated, nonce);
  }
}
