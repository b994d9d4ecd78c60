package com.codeheadsystems.smartaccount.core.delegation;

import static com.codeheadsystems.smartaccount.core.testing.Rejections.assertRejected;
import static com.codeheadsystems.smartaccount.core.testing.SmartAccountFixture.ACCOUNT;
import static com.codeheadsystems.smartaccount.core.testing.SmartAccountFixture.DELEGATE;
import static com.codeheadsystems.smartaccount.core.testing.SmartAccountFixture.ENTRY_POINT;
import static com.codeheadsystems.smartaccount.core.testing.SmartAccountFixture.OWNER;
import static com.codeheadsystems.smartaccount.core.testing.SmartAccountFixture.START;
import static com.codeheadsystems.smartaccount.core.testing.SmartAccountFixture.STRANGER;
import static com.codeheadsystems.smartaccount.core.testing.SmartAccountFixture.TARGET;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

import com.codeheadsystems.smartaccount.core.config.SmartAccountConfig;
import com.codeheadsystems.smartaccount.core.exception.ErrorCode;
import com.codeheadsystems.smartaccount.core.exception.SpendingLimitExceededException;
import com.codeheadsystems.smartaccount.core.model.ModuleType;
import com.codeheadsystems.smartaccount.core.model.Operation;
import com.codeheadsystems.smartaccount.core.model.SignedOperation;
import com.codeheadsystems.smartaccount.core.model.ValidationId;
import com.codeheadsystems.smartaccount.core.store.InMemoryDelegationStore;
import com.codeheadsystems.smartaccount.core.testing.MutableClock;
import com.codeheadsystems.smartaccount.core.testing.SmartAccountFixture;
import com.codeheadsystems.smartaccount.core.transaction.AccountTransactions;
import com.codeheadsystems.smartaccount.crypto.abi.AbiWords;
import com.codeheadsystems.smartaccount.crypto.ecdsa.Secp256k1;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import com.codeheadsystems.smartaccount.crypto.types.Hash32;
import com.codeheadsystems.smartaccount.crypto.types.Selector;
import com.codeheadsystems.smartaccount.model.delegation.DelegationGrantRequest;
import com.codeheadsystems.smartaccount.model.delegation.DelegationResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DelegationRegistryTest {

  private static final Selector S1 = Selector.fromSignature("transfer(address,uint256)");
  private static final Selector S2 = Selector.fromSignature("approve(address,uint256)");
  private static final Duration DAY = Duration.ofDays(1);

  private final ObjectMapper mapper = new ObjectMapper();
  private SmartAccountFixture fixture;
  private DelegationRegistry registry;

  @BeforeEach
  void setUp() {
    fixture = new SmartAccountFixture();
    registry = fixture.engine.delegationRegistry();
    fixture.createAccount();
  }

  private Delegation full(BigInteger limit) {
    return registry.createDelegation(ACCOUNT,
        DelegationParams.of(DELEGATE.address(), DelegationType.FULL, DAY).withSpendingLimit(limit));
  }

  private Delegation limited(Selector... selectors) {
    return registry.createDelegation(ACCOUNT,
        DelegationParams.limited(DELEGATE.address(), DAY, BigInteger.ZERO, List.of(selectors)));
  }

  private static byte[] callWith(Selector selector) {
    return AbiWords.callData(selector, AbiWords.word(TARGET), AbiWords.word(BigInteger.TEN));
  }

  // ── Creation ──────────────────────────────────────────────────────────────

  @Test
  void createDelegation_storesAnActiveDelegation() {
    Delegation delegation = full(BigInteger.valueOf(100));

    assertThat(delegation.status()).isEqualTo(DelegationStatus.ACTIVE);
    assertThat(delegation.startTime()).isEqualTo(START);
    assertThat(delegation.endTime()).isEqualTo(START.plus(DAY));
    assertThat(delegation.spentAmount()).isZero();
    assertThat(registry.getDelegation(delegation.id())).contains(delegation);
    assertThat(registry.hasDelegation(ACCOUNT, DELEGATE.address())).isTrue();
    assertThat(registry.hasDelegation(ACCOUNT, STRANGER.address())).isFalse();
  }

  @Test
  void createDelegation_sameSecondYieldsDistinctIds() {
    Delegation first = full(BigInteger.ZERO);
    Delegation second = full(BigInteger.ZERO);

    assertThat(first.id()).isNotEqualTo(second.id());
    assertThat(registry.getDelegations(ACCOUNT)).extracting(Delegation::id).containsExactly(first.id(), second.id());
  }

  @Test
  void createDelegation_validatesDelegatee() {
    assertRejected(() -> registry.createDelegation(ACCOUNT,
        DelegationParams.of(Address.ZERO, DelegationType.FULL, DAY)), ErrorCode.INVALID_DELEGATEE);
    assertRejected(() -> registry.createDelegation(ACCOUNT,
        DelegationParams.of(ACCOUNT, DelegationType.FULL, DAY)), ErrorCode.INVALID_DELEGATEE);
  }

  @Test
  void createDelegation_validatesDurationBounds() {
    assertRejected(() -> registry.createDelegation(ACCOUNT,
        DelegationParams.of(DELEGATE.address(), DelegationType.FULL, Duration.ofMinutes(59))), ErrorCode.INVALID_DURATION);
    assertRejected(() -> registry.createDelegation(ACCOUNT,
        DelegationParams.of(DELEGATE.address(), DelegationType.FULL, Duration.ofDays(366))), ErrorCode.INVALID_DURATION);

    assertThat(registry.createDelegation(ACCOUNT,
        DelegationParams.of(DELEGATE.address(), DelegationType.FULL, Duration.ofHours(1)))).isNotNull();
    assertThat(registry.createDelegation(ACCOUNT,
        DelegationParams.of(DELEGATE.address(), DelegationType.FULL, Duration.ofDays(365)))).isNotNull();
  }

  @Test
  void createDelegation_selectorsOnlyForLimited() {
    assertRejected(() -> registry.createDelegation(ACCOUNT,
        DelegationParams.limited(DELEGATE.address(), DAY, BigInteger.ZERO, List.of())), ErrorCode.INVALID_CONFIG);
    assertRejected(() -> registry.createDelegation(ACCOUNT,
        new DelegationParams(DELEGATE.address(), DelegationType.FULL, DAY, BigInteger.ZERO, List.of(S1))),
        ErrorCode.INVALID_CONFIG);
  }

  @Test
  void createDelegation_idCollisionIsRejected() {
    InMemoryDelegationStore store = spy(new InMemoryDelegationStore());
    DelegationRegistry isolated = new DelegationRegistry(SmartAccountConfig.DEFAULT, new MutableClock(START), store,
        new AccountTransactions(List.of(store)), () -> null);
    Delegation existing = isolated.createDelegation(ACCOUNT, DelegationParams.of(DELEGATE.address(), DelegationType.FULL, DAY));
    doReturn(Optional.of(existing)).when(store).load(any(Hash32.class));

    assertRejected(() -> isolated.createDelegation(ACCOUNT,
        DelegationParams.of(DELEGATE.address(), DelegationType.FULL, DAY)), ErrorCode.DELEGATION_ALREADY_EXISTS);
    assertThat(store.byDelegator(ACCOUNT)).hasSize(1);
  }

  // ── Signed grants ─────────────────────────────────────────────────────────

  @Nested
  class SignedGrants {

    private final DelegationParams params = DelegationParams.of(DELEGATE.address(), DelegationType.EXECUTOR, DAY);

    private byte[] signGrant(long nonce, Secp256k1.KeyPair signer) {
      return Secp256k1.sign(registry.delegationDigest(OWNER.address(), params, nonce), signer).toBytes();
    }

    @Test
    void acceptsTheDelegatorsSignatureOnce() {
      Delegation delegation = registry.createDelegationWithSignature(OWNER.address(), params, 0, signGrant(0, OWNER));

      assertThat(delegation.delegator()).isEqualTo(OWNER.address());
      assertThat(registry.nonce(OWNER.address())).isEqualTo(1);
      assertRejected(() -> registry.createDelegationWithSignature(OWNER.address(), params, 0, signGrant(0, OWNER)),
          ErrorCode.INVALID_NONCE);
    }

    @Test
    void rejectsOtherSigners() {
      assertRejected(() -> registry.createDelegationWithSignature(OWNER.address(), params, 0, signGrant(0, STRANGER)),
          ErrorCode.INVALID_SIGNATURE);
      assertThat(registry.nonce(OWNER.address())).isZero();
      assertThat(registry.getDelegations(OWNER.address())).isEmpty();
    }

    @Test
    void rejectsSkippedNonce() {
      assertRejected(() -> registry.createDelegationWithSignature(OWNER.address(), params, 1, signGrant(1, OWNER)),
          ErrorCode.INVALID_NONCE);
    }

    @Test
    void acceptsRelayedWireRequest() {
      DelegationGrantRequest request = new DelegationGrantRequest(OWNER.address(), DELEGATE.address(), "EXECUTOR",
          DAY.toSeconds(), BigInteger.ZERO, List.of(), 0, signGrant(0, OWNER));

      Delegation delegation = registry.createDelegationWithSignature(request);

      assertThat(delegation.type()).isEqualTo(DelegationType.EXECUTOR);
      assertThat(delegation.delegatee()).isEqualTo(DELEGATE.address());
    }

    @Test
    void acceptsRequestReadFromJson() throws Exception {
      DelegationGrantRequest sent = new DelegationGrantRequest(OWNER.address(), DELEGATE.address(), "EXECUTOR",
          DAY.toSeconds(), BigInteger.ZERO, List.of(), 0, signGrant(0, OWNER));
      String json = mapper.writeValueAsString(sent);

      Delegation delegation = registry.createDelegationWithSignature(
          mapper.readValue(json, DelegationGrantRequest.class));

      assertThat(delegation.delegator()).isEqualTo(OWNER.address());
      assertThat(registry.nonce(OWNER.address())).isEqualTo(1);
    }

    @Test
    void malformedWireRequestIsAConfigError() {
      DelegationGrantRequest unknownType = new DelegationGrantRequest(OWNER.address().toHex(),
          DELEGATE.address().toHex(), "EVERYTHING", DAY.toSeconds(), "0", List.of(), 0, "0x00");
      DelegationGrantRequest badHex = new DelegationGrantRequest("0xnothex", DELEGATE.address().toHex(),
          "FULL", DAY.toSeconds(), "0", List.of(), 0, "0x00");

      assertRejected(() -> registry.createDelegationWithSignature(unknownType), ErrorCode.INVALID_CONFIG);
      assertRejected(() -> registry.createDelegationWithSignature(badHex), ErrorCode.INVALID_CONFIG);
    }
  }

  // ── Revocation ────────────────────────────────────────────────────────────

  @Test
  void revokeDelegation_deactivatesForGood() {
    Delegation delegation = full(BigInteger.ZERO);

    registry.revokeDelegation(ACCOUNT, delegation.id());

    assertThat(registry.hasDelegation(ACCOUNT, DELEGATE.address())).isFalse();
    assertThat(registry.getDelegation(delegation.id())).get()
        .extracting(Delegation::status).isEqualTo(DelegationStatus.REVOKED);
    assertRejected(() -> registry.useDelegation(DELEGATE.address(), delegation.id(), BigInteger.ONE),
        ErrorCode.DELEGATION_NOT_ACTIVE);
    assertRejected(() -> registry.revokeDelegation(ACCOUNT, delegation.id()), ErrorCode.DELEGATION_NOT_ACTIVE);
  }

  @Test
  void revokeDelegation_onlyDelegatorOrAdministrator() {
    Delegation delegation = full(BigInteger.ZERO);

    assertRejected(() -> registry.revokeDelegation(DELEGATE.address(), delegation.id()), ErrorCode.UNAUTHORIZED);
    assertRejected(() -> registry.revokeDelegation(ACCOUNT, Hash32.ZERO), ErrorCode.DELEGATION_NOT_FOUND);
  }

  @Test
  void revokeDelegation_administratorMayRevoke() {
    Address administrator = Address.of("0xad00000000000000000000000000000000000001");
    SmartAccountFixture adminFixture = new SmartAccountFixture(SmartAccountConfig.DEFAULT.withAdministrator(administrator));
    DelegationRegistry adminRegistry = adminFixture.engine.delegationRegistry();
    Delegation delegation = adminRegistry.createDelegation(ACCOUNT,
        DelegationParams.of(DELEGATE.address(), DelegationType.FULL, DAY));

    adminRegistry.revokeDelegation(administrator, delegation.id());

    assertThat(adminRegistry.hasDelegation(ACCOUNT, DELEGATE.address())).isFalse();
  }

  @Test
  void revokeDelegation_expiredOneIsNotActive() {
    Delegation delegation = full(BigInteger.ZERO);
    fixture.clock.advance(DAY.plusSeconds(1));

    assertRejected(() -> registry.revokeDelegation(ACCOUNT, delegation.id()), ErrorCode.DELEGATION_NOT_ACTIVE);
  }

  @Test
  void revokeAllDelegations_skipsInactive() {
    Delegation revoked = full(BigInteger.ZERO);
    registry.revokeDelegation(ACCOUNT, revoked.id());
    full(BigInteger.ZERO);
    limited(S1);

    assertThat(registry.revokeAllDelegations(ACCOUNT)).isEqualTo(2);
    assertThat(registry.revokeAllDelegations(ACCOUNT)).isZero();
    assertThat(registry.getDelegations(ACCOUNT)).extracting(Delegation::status).containsOnly(DelegationStatus.REVOKED);
  }

  // ── Use ───────────────────────────────────────────────────────────────────

  @Test
  void useDelegation_recordsSpendUpToTheLimit() {
    Delegation delegation = full(BigInteger.valueOf(10));

    registry.useDelegation(DELEGATE.address(), delegation.id(), BigInteger.valueOf(4));
    registry.useDelegation(DELEGATE.address(), delegation.id(), BigInteger.valueOf(6));

    assertThat(registry.remainingAllowance(delegation.id())).contains(BigInteger.ZERO);
    SpendingLimitExceededException e = (SpendingLimitExceededException) assertRejected(
        () -> registry.useDelegation(DELEGATE.address(), delegation.id(), BigInteger.ONE),
        ErrorCode.SPENDING_LIMIT_EXCEEDED);
    assertThat(e.amount()).isEqualTo(BigInteger.ONE);
    assertThat(e.remaining()).isZero();
    assertThat(registry.getDelegation(delegation.id()).orElseThrow().spentAmount()).isEqualTo(BigInteger.TEN);
  }

  @Test
  void useDelegation_unlimitedHasNoAllowance() {
    Delegation delegation = full(BigInteger.ZERO);

    registry.useDelegation(DELEGATE.address(), delegation.id(), BigInteger.valueOf(1_000_000));

    assertThat(registry.remainingAllowance(delegation.id())).isEmpty();
  }

  @Test
  void useDelegation_checksCallerBeforeStatus() {
    Delegation delegation = full(BigInteger.ZERO);
    registry.revokeDelegation(ACCOUNT, delegation.id());

    assertRejected(() -> registry.useDelegation(STRANGER.address(), delegation.id(), BigInteger.ONE),
        ErrorCode.UNAUTHORIZED);
    assertRejected(() -> registry.useDelegation(DELEGATE.address(), Hash32.ZERO, BigInteger.ONE),
        ErrorCode.DELEGATION_NOT_FOUND);
  }

  @Test
  void useDelegation_persistsExpiryBeforeFailing() {
    Delegation delegation = full(BigInteger.ZERO);

    fixture.clock.advance(DAY);
    registry.useDelegation(DELEGATE.address(), delegation.id(), BigInteger.ONE);

    fixture.clock.advance(Duration.ofSeconds(1));
    assertThat(registry.getDelegation(delegation.id()).orElseThrow().status()).isEqualTo(DelegationStatus.EXPIRED);
    assertRejected(() -> registry.useDelegation(DELEGATE.address(), delegation.id(), BigInteger.ONE),
        ErrorCode.DELEGATION_EXPIRED);

    fixture.clock.set(START);
    assertThat(registry.getDelegation(delegation.id()).orElseThrow().status()).isEqualTo(DelegationStatus.EXPIRED);
  }

  // ── Selectors ─────────────────────────────────────────────────────────────

  @Test
  void isValidForSelector_limitedFollowsItsSetUntilExpiry() {
    Delegation delegation = limited(S1);

    assertThat(registry.isValidForSelector(delegation.id(), S1)).isTrue();
    assertThat(registry.isValidForSelector(delegation.id(), S2)).isFalse();

    fixture.clock.advance(DAY.plusSeconds(1));

    assertThat(registry.isValidForSelector(delegation.id(), S1)).isFalse();
    assertThat(registry.isValidForSelector(delegation.id(), S2)).isFalse();
  }

  @Test
  void isValidForSelector_byType() {
    Delegation full = full(BigInteger.ZERO);
    Delegation executor = registry.createDelegation(ACCOUNT,
        DelegationParams.of(DELEGATE.address(), DelegationType.EXECUTOR, DAY));
    Delegation validator = registry.createDelegation(ACCOUNT,
        DelegationParams.of(DELEGATE.address(), DelegationType.VALIDATOR, DAY));

    assertThat(registry.isValidForSelector(full.id(), S2)).isTrue();
    assertThat(registry.isValidForSelector(executor.id(), S2)).isTrue();
    assertThat(registry.isValidForSelector(validator.id(), S2)).isFalse();
    assertThat(registry.isValidForSelector(Hash32.ZERO, S1)).isFalse();
  }

  // ── As a module ───────────────────────────────────────────────────────────

  @Test
  void executeDelegated_runsThroughTheAccount() {
    fixture.accounts().installModule(ACCOUNT, ACCOUNT, ModuleType.EXECUTOR, DelegationRegistry.ADDRESS, new byte[0]);
    Delegation delegation = limited(S1);
    Operation allowed = Operation.call(TARGET, callWith(S1));

    registry.executeDelegated(DELEGATE.address(), delegation.id(), allowed);

    assertThat(fixture.dispatched).containsExactly(allowed);
    assertRejected(() -> registry.executeDelegated(DELEGATE.address(), delegation.id(),
        Operation.call(TARGET, callWith(S2))), ErrorCode.UNAUTHORIZED);
    assertRejected(() -> registry.executeDelegated(STRANGER.address(), delegation.id(), allowed),
        ErrorCode.UNAUTHORIZED);
  }

  @Test
  void executeDelegated_requiresTheExecutorInstall() {
    Delegation delegation = full(BigInteger.ZERO);

    assertRejected(() -> registry.executeDelegated(DELEGATE.address(), delegation.id(),
        Operation.transfer(TARGET, BigInteger.ONE)), ErrorCode.UNAUTHORIZED);
    assertThat(registry.getDelegation(delegation.id()).orElseThrow().spentAmount()).isZero();
  }

  @Test
  void executeDelegated_validatorDelegationCannotExecute() {
    fixture.accounts().installModule(ACCOUNT, ACCOUNT, ModuleType.EXECUTOR, DelegationRegistry.ADDRESS, new byte[0]);
    Delegation delegation = registry.createDelegation(ACCOUNT,
        DelegationParams.of(DELEGATE.address(), DelegationType.VALIDATOR, DAY));

    assertRejected(() -> registry.executeDelegated(DELEGATE.address(), delegation.id(),
        Operation.transfer(TARGET, BigInteger.ONE)), ErrorCode.UNAUTHORIZED);
    assertThat(fixture.dispatched).isEmpty();
  }

  @Test
  void validateOperation_authorizesDelegateeSignedOperations() {
    fixture.accounts().installModule(ACCOUNT, ACCOUNT, ModuleType.VALIDATOR, DelegationRegistry.ADDRESS, new byte[0]);
    Delegation delegation = full(BigInteger.valueOf(10));
    ValidationId validationId = ValidationId.of(DelegationRegistry.ADDRESS);

    fixture.accounts().handleOperation(ACCOUNT, ENTRY_POINT, delegatedSign(Operation.transfer(TARGET, BigInteger.valueOf(4)),
        validationId, delegation.id(), DELEGATE));

    assertThat(registry.remainingAllowance(delegation.id())).contains(BigInteger.valueOf(6));
    assertRejected(() -> fixture.accounts().handleOperation(ACCOUNT, ENTRY_POINT,
        delegatedSign(Operation.transfer(TARGET, BigInteger.valueOf(7)), validationId, delegation.id(), DELEGATE)),
        ErrorCode.SPENDING_LIMIT_EXCEEDED);
    assertRejected(() -> fixture.accounts().handleOperation(ACCOUNT, ENTRY_POINT,
        delegatedSign(Operation.transfer(TARGET, BigInteger.ONE), validationId, delegation.id(), STRANGER)),
        ErrorCode.UNAUTHORIZED);
    assertThat(fixture.dispatched).hasSize(1);
  }

  private SignedOperation delegatedSign(Operation operation, ValidationId validationId, Hash32 delegationId,
                                        Secp256k1.KeyPair signer) {
    long nonce = fixture.accounts().getAccount(ACCOUNT).orElseThrow().operationNonce();
    byte[] raw = Secp256k1.sign(operation.hash(ACCOUNT, validationId, nonce), signer).toBytes();
    return new SignedOperation(operation, validationId, nonce, new DelegatedSignature(delegationId, raw).encode());
  }

  @Test
  void uninstallRevokesActiveDelegations() {
    fixture.accounts().installModule(ACCOUNT, ACCOUNT, ModuleType.EXECUTOR, DelegationRegistry.ADDRESS, new byte[0]);
    Delegation delegation = full(BigInteger.ZERO);

    fixture.accounts().uninstallModule(ACCOUNT, ACCOUNT, ModuleType.EXECUTOR, DelegationRegistry.ADDRESS, new byte[0]);

    assertThat(registry.getDelegation(delegation.id()).orElseThrow().status()).isEqualTo(DelegationStatus.REVOKED);
  }

  @Test
  void toResponse_reportsTheEffectiveStatus() {
    Delegation delegation = full(BigInteger.valueOf(10));
    fixture.clock.advance(DAY.plusSeconds(1));

    DelegationResponse response = registry.toResponse(delegation);

    assertThat(response.delegationId()).isEqualTo(delegation.id());
    assertThat(response.status()).isEqualTo("EXPIRED");
    assertThat(response.delegationType()).isEqualTo("FULL");
    assertThat(response.startTime()).isEqualTo(START.getEpochSecond());
    assertThat(response.spendingLimit()).isEqualTo("10");
    assertThat(response.spentAmount()).isEqualTo("0");
  }

  @Test
  void toResponse_serializesForRelays() throws Exception {
    Delegation delegation = full(BigInteger.valueOf(10));
    registry.useDelegation(DELEGATE.address(), delegation.id(), BigInteger.valueOf(4));

    String json = mapper.writeValueAsString(registry.toResponse(registry.getDelegation(delegation.id()).orElseThrow()));
    DelegationResponse read = mapper.readValue(json, DelegationResponse.class);

    assertThat(json).contains(delegation.id().toHex());
    assertThat(read.delegationId()).isEqualTo(delegation.id());
    assertThat(read.status()).isEqualTo("ACTIVE");
    assertThat(read.spentAmount()).isEqualTo("4");
  }
}
