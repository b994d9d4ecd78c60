package com.codeheadsystems.smartaccount.model.delegation;

import com.codeheadsystems.smartaccount.crypto.common.ByteUtils;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import com.codeheadsystems.smartaccount.crypto.types.Selector;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigInteger;
import java.util.List;

/**
 * Wire model for a delegation grant signed off-line by the delegator and submitted by a relay.
 * <p>
 * The relay never holds the delegator's key: the registry recomputes the grant digest from these
 * fields plus the nonce and accepts the grant only if the signature recovers to the delegator.
 * Binary fields are {@code 0x}-prefixed hex; amounts are base-10 strings so that values above
 * 2^53 survive JSON parsers that read numbers as doubles.
 *
 * @param delegatorHex      hex address of the account granting authority
 * @param delegateeHex      hex address of the identity receiving authority
 * @param delegationType    one of {@code FULL}, {@code EXECUTOR}, {@code VALIDATOR}, {@code LIMITED}
 * @param durationSeconds   lifetime of the delegation in seconds
 * @param spendingLimit     base-10 spending cap; {@code "0"} means unlimited
 * @param allowedSelectors  hex selectors, required for {@code LIMITED} and empty otherwise
 * @param nonce             the delegator's next grant nonce
 * @param signatureHex      hex 65-byte {@code r ‖ s ‖ v} signature over the grant digest
 */
public record DelegationGrantRequest(
    @JsonProperty("delegator") String delegatorHex,
    @JsonProperty("delegatee") String delegateeHex,
    @JsonProperty("delegationType") String delegationType,
    @JsonProperty("durationSeconds") long durationSeconds,
    @JsonProperty("spendingLimit") String spendingLimit,
    @JsonProperty("allowedSelectors") List<String> allowedSelectors,
    @JsonProperty("nonce") long nonce,
    @JsonProperty("signature") String signatureHex) {

  public DelegationGrantRequest {
    allowedSelectors = allowedSelectors == null ? List.of() : List.copyOf(allowedSelectors);
  }

  public DelegationGrantRequest(Address delegator, Address delegatee, String delegationType,
                                long durationSeconds, BigInteger spendingLimit,
                                List<Selector> allowedSelectors, long nonce, byte[] signature) {
    this(delegator.toHex(), delegatee.toHex(), delegationType, durationSeconds,
        spendingLimit.toString(),
        allowedSelectors.stream().map(Selector::toHex).toList(),
        nonce, ByteUtils.toHex(signature));
  }

  public Address delegator() {
    return WireFields.address(delegatorHex, "delegator");
  }

  public Address delegatee() {
    return WireFields.address(delegateeHex, "delegatee");
  }

  public String type() {
    return WireFields.required(delegationType, "delegationType");
  }

  public BigInteger limit() {
    return WireFields.amount(spendingLimit, "spendingLimit");
  }

  public List<Selector> selectors() {
    return allowedSelectors.stream()
        .map(s -> {
          byte[] bytes = WireFields.hex(s, "allowedSelectors");
          if (bytes.length != Selector.LENGTH) {
            throw new IllegalArgumentException("Invalid selector in field: allowedSelectors");
          }
          return new Selector(bytes);
        })
        .toList();
  }

  public byte[] signature() {
    return WireFields.hex(signatureHex, "signature");
  }
}
