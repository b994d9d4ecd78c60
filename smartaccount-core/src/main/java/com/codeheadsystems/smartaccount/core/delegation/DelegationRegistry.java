package com.codeheadsystems.smartaccount.core.delegation;

import com.codeheadsystems.smartaccount.core.account.AccountManager;
import com.codeheadsystems.smartaccount.core.config.SmartAccountConfig;
import com.codeheadsystems.smartaccount.core.exception.ErrorCode;
import com.codeheadsystems.smartaccount.core.exception.SmartAccountException;
import com.codeheadsystems.smartaccount.core.exception.SpendingLimitExceededException;
import com.codeheadsystems.smartaccount.core.model.CallResult;
import com.codeheadsystems.smartaccount.core.model.ModuleType;
import com.codeheadsystems.smartaccount.core.model.Operation;
import com.codeheadsystems.smartaccount.core.model.OperationContext;
import com.codeheadsystems.smartaccount.core.model.ValidationResult;
import com.codeheadsystems.smartaccount.core.module.ExecutorModule;
import com.codeheadsystems.smartaccount.core.module.Module;
import com.codeheadsystems.smartaccount.core.module.ValidatorModule;
import com.codeheadsystems.smartaccount.core.store.DelegationStore;
import com.codeheadsystems.smartaccount.core.transaction.AccountTransactions;
import com.codeheadsystems.smartaccount.core.validation.DelegationLookup;
import com.codeheadsystems.smartaccount.crypto.Keccak;
import com.codeheadsystems.smartaccount.crypto.common.ByteUtils;
import com.codeheadsystems.smartaccount.crypto.ecdsa.Secp256k1;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import com.codeheadsystems.smartaccount.crypto.types.Hash32;
import com.codeheadsystems.smartaccount.crypto.types.Selector;
import com.codeheadsystems.smartaccount.model.delegation.DelegationGrantRequest;
import com.codeheadsystems.smartaccount.model.delegation.DelegationResponse;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Provider;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues, accounts for and retracts time-bound, capability-scoped delegations.
 * <p>
 * Installed on an account as a validator, it authorizes operations signed by a delegatee; as an
 * executor, it lets a delegatee run operations through {@link #executeDelegated}. Delegations
 * expire lazily: a read sees an expired delegation as {@link DelegationStatus#EXPIRED} at once,
 * and the first mutating call after the end time persists the flip before failing.
 */
@Singleton
public class DelegationRegistry implements ValidatorModule, ExecutorModule, DelegationLookup {

  public static final Address ADDRESS = Module.addressFor("delegation-registry");

  private static final Logger log = LoggerFactory.getLogger(DelegationRegistry.class);
  private static final byte[] GRANT_DOMAIN = Keccak.keccak256("SmartAccountDelegationGrant");

  private final SmartAccountConfig config;
  private final Clock clock;
  private final DelegationStore store;
  private final AccountTransactions transactions;
  private final Provider<AccountManager> accountManager;

  @Inject
  public DelegationRegistry(SmartAccountConfig config,
                            Clock clock,
                            DelegationStore store,
                            AccountTransactions transactions,
                            Provider<AccountManager> accountManager) {
    this.config = config;
    this.clock = clock;
    this.store = store;
    this.transactions = transactions;
    this.accountManager = accountManager;
    log.info("DelegationRegistry(duration={}..{}, administrator={})",
        config.minDelegationDuration(), config.maxDelegationDuration(), config.administrator());
  }

  // ── Creation ──────────────────────────────────────────────────────────────

  /**
   * Creates an active delegation from {@code delegator}, who is the authenticated caller.
   *
   * @param delegator the granting identity
   * @param params    what is granted
   * @return the stored delegation
   * @throws SmartAccountException {@code INVALID_DELEGATEE}, {@code INVALID_DURATION},
   *                               {@code INVALID_CONFIG} or {@code DELEGATION_ALREADY_EXISTS}
   */
  public Delegation createDelegation(Address delegator, DelegationParams params) {
    validate(delegator, params);
    return transactions.atomically(delegator, () -> create(delegator, params));
  }

  /**
   * Creates a delegation on the delegator's behalf from a detached signature over
   * {@link #delegationDigest}. The nonce must be the delegator's next grant nonce.
   *
   * @param delegator the granting identity
   * @param params    what is granted
   * @param nonce     the delegator's next grant nonce
   * @param signature 65-byte signature by the delegator
   * @return the stored delegation
   */
  public Delegation createDelegationWithSignature(Address delegator, DelegationParams params, long nonce,
                                                  byte[] signature) {
    validate(delegator, params);
    return transactions.atomically(delegator, () -> {
      Hash32 digest = delegationDigest(delegator, params, nonce);
      if (!Secp256k1.recover(digest, signature).map(delegator::equals).orElse(false)) {
        throw new SmartAccountException(ErrorCode.INVALID_SIGNATURE, "Grant not signed by " + delegator);
      }
      long expected = store.grantNonce(delegator);
      if (nonce != expected) {
        throw new SmartAccountException(ErrorCode.INVALID_NONCE, "Expected grant nonce " + expected + " but got " + nonce);
      }
      store.incrementGrantNonce(delegator);
      return create(delegator, params);
    });
  }

  /**
   * Creates a delegation from a relayed wire request.
   *
   * @param request the signed grant
   * @return the stored delegation
   */
  public Delegation createDelegationWithSignature(DelegationGrantRequest request) {
    DelegationParams params;
    try {
      params = new DelegationParams(
          request.delegatee(),
          DelegationType.valueOf(request.type()),
          Duration.ofSeconds(request.durationSeconds()),
          request.limit(),
          request.selectors());
    } catch (IllegalArgumentException e) {
      throw new SmartAccountException(ErrorCode.INVALID_CONFIG, "Malformed grant request: " + e.getMessage(), e);
    }
    Address delegator;
    byte[] signature;
    try {
      delegator = request.delegator();
      signature = request.signature();
    } catch (IllegalArgumentException e) {
      throw new SmartAccountException(ErrorCode.INVALID_CONFIG, "Malformed grant request: " + e.getMessage(), e);
    }
    return createDelegationWithSignature(delegator, params, request.nonce(), signature);
  }

  /**
   * The digest a delegator signs to grant {@code params} off-line.
   *
   * @param delegator the granting identity
   * @param params    what is granted
   * @param nonce     the grant nonce
   * @return the digest
   */
  public Hash32 delegationDigest(Address delegator, DelegationParams params, long nonce) {
    byte[] selectors = ByteUtils.concat(params.allowedSelectors().stream().map(Selector::bytes).toArray(byte[][]::new));
    return Keccak.hash(
        GRANT_DOMAIN,
        ADDRESS.toWord(),
        delegator.toWord(),
        params.delegatee().toWord(),
        ByteUtils.uint256(params.type().code()),
        ByteUtils.uint256(params.duration().toSeconds()),
        ByteUtils.uint256(params.spendingLimit()),
        Keccak.keccak256(selectors),
        ByteUtils.uint256(nonce));
  }

  /**
   * The grant nonce the delegator's next signed grant must carry.
   *
   * @param delegator the delegator
   * @return the nonce
   */
  public long nonce(Address delegator) {
    return store.grantNonce(delegator);
  }

  private void validate(Address delegator, DelegationParams params) {
    Address delegatee = params.delegatee();
    if (delegatee.isZero() || delegatee.equals(delegator)) {
      throw new SmartAccountException(ErrorCode.INVALID_DELEGATEE, "Invalid delegatee " + delegatee);
    }
    Duration duration = params.duration();
    if (duration.compareTo(config.minDelegationDuration()) < 0 || duration.compareTo(config.maxDelegationDuration()) > 0) {
      throw new SmartAccountException(ErrorCode.INVALID_DURATION, "Duration " + duration + " out of bounds");
    }
    boolean limited = params.type() == DelegationType.LIMITED;
    if (limited == params.allowedSelectors().isEmpty()) {
      throw new SmartAccountException(ErrorCode.INVALID_CONFIG,
          "Allowed selectors are required for LIMITED delegations and only for them");
    }
  }

  private Delegation create(Address delegator, DelegationParams params) {
    Instant now = clock.instant();
    long sequence = store.nextSequence(delegator);
    Hash32 id = Keccak.hash(
        delegator.bytes(),
        params.delegatee().bytes(),
        ByteUtils.uint256(now.getEpochSecond()),
        ByteUtils.uint256(sequence));
    if (store.load(id).isPresent()) {
      throw new SmartAccountException(ErrorCode.DELEGATION_ALREADY_EXISTS, "Delegation id collision " + id);
    }
    Delegation delegation = new Delegation(id, delegator, params.delegatee(), params.type(),
        DelegationStatus.ACTIVE, now, now.plus(params.duration()), params.spendingLimit(), BigInteger.ZERO,
        new HashSet<>(params.allowedSelectors()));
    store.store(delegation);
    log.debug("Created {} delegation {} from {} to {}", params.type(), id, delegator, params.delegatee());
    return delegation;
  }

  // ── Revocation ────────────────────────────────────────────────────────────

  /**
   * Revokes an active delegation.
   *
   * @param caller the delegator or the configured administrator
   * @param id     the delegation
   */
  public void revokeDelegation(Address caller, Hash32 id) {
    Delegation found = find(id);
    if (!caller.equals(found.delegator()) && !isAdministrator(caller)) {
      throw new SmartAccountException(ErrorCode.UNAUTHORIZED, caller + " may not revoke " + id);
    }
    settleExpiry(found);
    transactions.runAtomically(found.delegator(), () -> {
      Delegation delegation = find(id);
      if (delegation.status() != DelegationStatus.ACTIVE) {
        throw new SmartAccountException(ErrorCode.DELEGATION_NOT_ACTIVE, "Delegation " + id + " is " + delegation.status());
      }
      store.store(delegation.withStatus(DelegationStatus.REVOKED));
      log.debug("Revoked delegation {} by {}", id, caller);
    });
  }

  /**
   * Revokes every delegation of {@code delegator} that is still active.
   *
   * @param delegator the delegator, who is the caller
   * @return how many were revoked
   */
  public int revokeAllDelegations(Address delegator) {
    return transactions.atomically(delegator, () -> revokeActive(delegator));
  }

  private int revokeActive(Address delegator) {
    Instant now = clock.instant();
    int revoked = 0;
    for (Delegation delegation : store.byDelegator(delegator)) {
      if (delegation.isActiveAt(now)) {
        store.store(delegation.withStatus(DelegationStatus.REVOKED));
        revoked++;
      }
    }
    log.debug("Revoked {} delegations of {}", revoked, delegator);
    return revoked;
  }

  private boolean isAdministrator(Address caller) {
    return config.hasAdministrator() && config.administrator().equals(caller);
  }

  // ── Use ───────────────────────────────────────────────────────────────────

  /**
   * Records spend against a delegation.
   *
   * @param caller must be the delegatee
   * @param id     the delegation
   * @param amount the amount to record
   * @throws SmartAccountException {@code DELEGATION_NOT_FOUND}, {@code UNAUTHORIZED},
   *                               {@code DELEGATION_NOT_ACTIVE}, {@code DELEGATION_EXPIRED} or
   *                               {@code SPENDING_LIMIT_EXCEEDED}
   */
  public void useDelegation(Address caller, Hash32 id, BigInteger amount) {
    Delegation found = find(id);
    if (!caller.equals(found.delegatee())) {
      throw new SmartAccountException(ErrorCode.UNAUTHORIZED, caller + " is not the delegatee of " + id);
    }
    settleExpiry(found);
    transactions.runAtomically(found.delegator(), () -> charge(requireUsable(id), amount));
  }

  /**
   * Lets the delegatee of an executor-capable delegation run an operation on the delegator's
   * account. The registry must be installed on the account as an executor.
   *
   * @param caller    must be the delegatee
   * @param id        the delegation
   * @param operation the call
   * @return the effect's result
   */
  public CallResult executeDelegated(Address caller, Hash32 id, Operation operation) {
    Delegation found = find(id);
    if (!caller.equals(found.delegatee())) {
      throw new SmartAccountException(ErrorCode.UNAUTHORIZED, caller + " is not the delegatee of " + id);
    }
    settleExpiry(found);
    return transactions.atomically(found.delegator(), () -> {
      Delegation delegation = requireUsable(id);
      if (!delegation.type().canExecute()) {
        throw new SmartAccountException(ErrorCode.UNAUTHORIZED, delegation.type() + " delegation cannot execute");
      }
      if (!permits(delegation, operation)) {
        throw new SmartAccountException(ErrorCode.UNAUTHORIZED, "Selector not allowed by delegation " + id);
      }
      charge(delegation, operation.value());
      return accountManager.get().executeFromExecutor(delegation.delegator(), ADDRESS, operation);
    });
  }

  private Delegation find(Hash32 id) {
    return store.load(id)
        .orElseThrow(() -> new SmartAccountException(ErrorCode.DELEGATION_NOT_FOUND, "No delegation " + id));
  }

  private Delegation requireUsable(Hash32 id) {
    Delegation delegation = find(id);
    switch (delegation.status()) {
      case ACTIVE:
        break;
      case EXPIRED:
        throw new SmartAccountException(ErrorCode.DELEGATION_EXPIRED, "Delegation " + id + " expired at " + delegation.endTime());
      default:
        throw new SmartAccountException(ErrorCode.DELEGATION_NOT_ACTIVE, "Delegation " + id + " is " + delegation.status());
    }
    return delegation;
  }

  // Commits the EXPIRED flip on its own so it survives the failure that follows.
  private void settleExpiry(Delegation delegation) {
    if (delegation.status() != DelegationStatus.ACTIVE || !delegation.isExpiredAt(clock.instant())) {
      return;
    }
    transactions.runAtomically(delegation.delegator(), () -> {
      Delegation current = find(delegation.id());
      if (current.status() == DelegationStatus.ACTIVE && current.isExpiredAt(clock.instant())) {
        store.store(current.withStatus(DelegationStatus.EXPIRED));
        log.debug("Delegation {} expired at {}", current.id(), current.endTime());
      }
    });
  }

  private void charge(Delegation delegation, BigInteger amount) {
    if (amount.signum() < 0) {
      throw new SmartAccountException(ErrorCode.INVALID_CONFIG, "Amount must be non-negative");
    }
    BigInteger spent = delegation.spentAmount().add(amount);
    if (delegation.hasSpendingLimit() && spent.compareTo(delegation.spendingLimit()) > 0) {
      throw new SpendingLimitExceededException(Address.ZERO, amount, delegation.remaining());
    }
    store.store(delegation.withSpentAmount(spent));
  }

  private static boolean permits(Delegation delegation, Operation operation) {
    if (delegation.type() != DelegationType.LIMITED) {
      return true;
    }
    return operation.selector().map(delegation::permits).orElse(false);
  }

  // ── Queries ───────────────────────────────────────────────────────────────

  /**
   * Read-only selector check. Full and executor delegations allow every selector, limited ones
   * only their allowed set; validator-only, inactive, revoked, expired or unknown delegations
   * allow nothing.
   *
   * @param id       the delegation
   * @param selector the selector
   * @return true if the selector may be invoked now
   */
  public boolean isValidForSelector(Hash32 id, Selector selector) {
    return store.load(id)
        .filter(d -> d.isActiveAt(clock.instant()))
        .map(d -> switch (d.type()) {
          case FULL, EXECUTOR -> true;
          case LIMITED -> d.allowedSelectors().contains(selector);
          case VALIDATOR -> false;
        })
        .orElse(false);
  }

  /**
   * Whether any delegation from delegator to delegatee is active now.
   *
   * @param delegator the delegator
   * @param delegatee the delegatee
   * @return true if one is active
   */
  public boolean hasDelegation(Address delegator, Address delegatee) {
    Instant now = clock.instant();
    return store.byDelegator(delegator).stream()
        .anyMatch(d -> d.delegatee().equals(delegatee) && d.isActiveAt(now));
  }

  @Override
  public boolean hasSigningDelegation(Address delegator, Address delegatee) {
    Instant now = clock.instant();
    return store.byDelegator(delegator).stream()
        .anyMatch(d -> d.delegatee().equals(delegatee)
            && d.isActiveAt(now)
            && (d.type() == DelegationType.FULL || d.type() == DelegationType.EXECUTOR));
  }

  /**
   * The delegation as of now, with lazy expiry applied to the returned copy.
   *
   * @param id the delegation
   * @return the effective view, or empty
   */
  public Optional<Delegation> getDelegation(Hash32 id) {
    Instant now = clock.instant();
    return store.load(id).map(d -> d.withStatus(d.effectiveStatus(now)));
  }

  public List<Delegation> getDelegations(Address delegator) {
    Instant now = clock.instant();
    return store.byDelegator(delegator).stream()
        .map(d -> d.withStatus(d.effectiveStatus(now)))
        .toList();
  }

  /**
   * What can still be spent through the delegation.
   *
   * @param id the delegation
   * @return the remaining allowance, or empty when the delegation has no limit
   */
  public Optional<BigInteger> remainingAllowance(Hash32 id) {
    Delegation delegation = find(id);
    return delegation.hasSpendingLimit() ? Optional.of(delegation.remaining()) : Optional.empty();
  }

  public DelegationResponse toResponse(Delegation delegation) {
    DelegationStatus status = delegation.effectiveStatus(clock.instant());
    return new DelegationResponse(
        delegation.id().toHex(),
        delegation.delegator().toHex(),
        delegation.delegatee().toHex(),
        delegation.type().name(),
        status.name(),
        delegation.startTime().getEpochSecond(),
        delegation.endTime().getEpochSecond(),
        delegation.spendingLimit().toString(),
        delegation.spentAmount().toString());
  }

  // ── Module ────────────────────────────────────────────────────────────────

  @Override
  public Address address() {
    return ADDRESS;
  }

  @Override
  public boolean isModuleType(ModuleType type) {
    return type == ModuleType.VALIDATOR || type == ModuleType.EXECUTOR;
  }

  @Override
  public void onInstall(Address account, byte[] initData) {
    log.debug("Delegation registry installed on {}", account);
  }

  /**
   * Uninstalling the registry, as either type, revokes the account's active delegations.
   */
  @Override
  public void onUninstall(Address account, byte[] deinitData) {
    revokeActive(account);
  }

  /**
   * Authorizes an operation signed by a delegatee. The signature is a {@link DelegatedSignature};
   * the operation value is recorded against the delegation's spending limit.
   */
  @Override
  public ValidationResult validateOperation(OperationContext context) {
    Optional<DelegatedSignature> delegated = DelegatedSignature.decode(context.signature());
    if (delegated.isEmpty()) {
      return ValidationResult.rejected(context.validationId());
    }
    Optional<Delegation> found = store.load(delegated.get().delegationId())
        .filter(d -> d.delegator().equals(context.account()))
        .filter(d -> d.isActiveAt(clock.instant()))
        .filter(d -> d.type().canValidate())
        .filter(d -> permits(d, context.operation()));
    if (found.isEmpty()) {
      return ValidationResult.rejected(context.validationId());
    }
    Delegation delegation = found.get();
    Optional<Address> signer = Secp256k1.recover(context.operationHash(), delegated.get().signature());
    if (!signer.map(delegation.delegatee()::equals).orElse(false)) {
      return ValidationResult.rejected(context.validationId());
    }
    transactions.runAtomically(context.account(), () -> charge(delegation, context.operation().value()));
    return ValidationResult.authorized(context.validationId(), delegation.delegatee());
  }

  @Override
  public boolean isValidSignature(Address account, Hash32 hash, byte[] signature) {
    return DelegatedSignature.decode(signature)
        .flatMap(delegated -> store.load(delegated.delegationId())
            .filter(d -> d.delegator().equals(account))
            .filter(d -> d.isActiveAt(clock.instant()))
            .filter(d -> d.type().canValidate())
            .filter(d -> Secp256k1.recover(hash, delegated.signature()).map(d.delegatee()::equals).orElse(false)))
        .isPresent();
  }
}
