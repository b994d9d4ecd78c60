package com.codeheadsystems.smartaccount.model.delegation;

import com.codeheadsystems.smartaccount.crypto.types.Hash32;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire view of a delegation as evaluated at response time; {@code status} already reflects lazy
 * expiry.
 *
 * @param delegationIdHex hex 32-byte delegation identifier
 * @param delegator       hex delegator address
 * @param delegatee       hex delegatee address
 * @param delegationType  the delegation type name
 * @param status          the effective status name
 * @param startTime       epoch seconds the delegation became active
 * @param endTime         epoch seconds after which it expires
 * @param spendingLimit   base-10 cap, {@code "0"} for unlimited
 * @param spentAmount     base-10 amount already consumed
 */
public record DelegationResponse(
    @JsonProperty("delegationId") String delegationIdHex,
    @JsonProperty("delegator") String delegator,
    @JsonProperty("delegatee") String delegatee,
    @JsonProperty("delegationType") String delegationType,
    @JsonProperty("status") String status,
    @JsonProperty("startTime") long startTime,
    @JsonProperty("endTime") long endTime,
    @JsonProperty("spendingLimit") String spendingLimit,
    @JsonProperty("spentAmount") String spentAmount) {

  public Hash32 delegationId() {
    return new Hash32(WireFields.hex(delegationIdHex, "delegationId"));
  }
}
