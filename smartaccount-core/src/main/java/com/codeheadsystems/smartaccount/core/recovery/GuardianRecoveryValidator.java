package com.codeheadsystems.smartaccount.core.recovery;

import com.codeheadsystems.smartaccount.core.account.AccountManager;
import com.codeheadsystems.smartaccount.core.config.SmartAccountConfig;
import com.codeheadsystems.smartaccount.core.exception.ErrorCode;
import com.codeheadsystems.smartaccount.core.exception.SmartAccountException;
import com.codeheadsystems.smartaccount.core.model.AccountState;
import com.codeheadsystems.smartaccount.core.model.ModuleType;
import com.codeheadsystems.smartaccount.core.model.OperationContext;
import com.codeheadsystems.smartaccount.core.model.ValidationResult;
import com.codeheadsystems.smartaccount.core.module.Module;
import com.codeheadsystems.smartaccount.core.module.ValidatorModule;
import com.codeheadsystems.smartaccount.core.store.AccountStore;
import com.codeheadsystems.smartaccount.core.store.RecoveryStore;
import com.codeheadsystems.smartaccount.core.transaction.AccountTransactions;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import com.codeheadsystems.smartaccount.crypto.types.Hash32;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import javax.inject.Inject;
import javax.inject.Provider;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * N-of-M guardian recovery of an account's root authority.
 * <p>
 * Per account: no request, then an initiated request collecting approvals, then executed or
 * cancelled. Execution needs both the approval threshold and the recovery delay; anyone may
 * trigger it once both hold. Installed as a recovery validator so that it may call
 * {@link AccountManager#setRootAuthority}; it never authorizes ordinary operations.
 */
@Singleton
public class GuardianRecoveryValidator implements ValidatorModule {

  public static final Address ADDRESS = Module.addressFor("guardian-recovery");

  private static final Logger log = LoggerFactory.getLogger(GuardianRecoveryValidator.class);

  private final SmartAccountConfig config;
  private final Clock clock;
  private final RecoveryStore store;
  private final AccountStore accountStore;
  private final AccountTransactions transactions;
  private final Provider<AccountManager> accountManager;

  @Inject
  public GuardianRecoveryValidator(SmartAccountConfig config,
                                   Clock clock,
                                   RecoveryStore store,
                                   AccountStore accountStore,
                                   AccountTransactions transactions,
                                   Provider<AccountManager> accountManager) {
    this.config = config;
    this.clock = clock;
    this.store = store;
    this.accountStore = accountStore;
    this.transactions = transactions;
    this.accountManager = accountManager;
    log.info("GuardianRecoveryValidator(guardians={}..{}, delay={}..{})",
        config.minGuardians(), config.maxGuardians(), config.minRecoveryDelay(), config.maxRecoveryDelay());
  }

  // ── Module ────────────────────────────────────────────────────────────────

  @Override
  public Address address() {
    return ADDRESS;
  }

  @Override
  public boolean isModuleType(ModuleType type) {
    return type == ModuleType.VALIDATOR;
  }

  @Override
  public boolean isRecoveryModule() {
    return true;
  }

  /**
   * Installs the guardian set; {@code initData} is an encoded {@link GuardianConfig}.
   */
  @Override
  public void onInstall(Address account, byte[] initData) {
    GuardianConfig guardianConfig;
    try {
      guardianConfig = GuardianConfig.decode(initData);
    } catch (IllegalArgumentException | ArithmeticException e) {
      throw new SmartAccountException(ErrorCode.INVALID_CONFIG, "Malformed guardian config", e);
    }
    validateConfig(account, guardianConfig);
    if (store.loadConfig(account).isPresent()) {
      throw new SmartAccountException(ErrorCode.MODULE_STATE_ERROR, "Guardians already configured for " + account);
    }
    store.storeConfig(account, guardianConfig);
    log.debug("Guardian recovery installed on {} ({} of {})", account,
        guardianConfig.threshold(), guardianConfig.guardians().size());
  }

  @Override
  public void onUninstall(Address account, byte[] deinitData) {
    store.clear(account);
    log.debug("Guardian recovery removed from {}", account);
  }

  @Override
  public ValidationResult validateOperation(OperationContext context) {
    return ValidationResult.rejected(context.validationId());
  }

  @Override
  public boolean isValidSignature(Address account, Hash32 hash, byte[] signature) {
    return false;
  }

  // ── Recovery workflow ─────────────────────────────────────────────────────

  /**
   * Proposes a new root authority. Approvals start at zero; the initiator approves separately.
   *
   * @param account          the account
   * @param caller           a guardian of the account
   * @param newRootAuthority the proposed root authority
   */
  public void initiateRecovery(Address account, Address caller, Address newRootAuthority) {
    transactions.runAtomically(account, () -> {
      requireGuardian(account, caller);
      if (store.loadRequest(account).isPresent()) {
        throw new SmartAccountException(ErrorCode.RECOVERY_ALREADY_INITIATED, "Recovery already initiated for " + account);
      }
      if (newRootAuthority == null || newRootAuthority.isZero()) {
        throw new SmartAccountException(ErrorCode.INVALID_VALIDATOR, "Proposed root authority must not be zero");
      }
      RecoveryRequest request = new RecoveryRequest(newRootAuthority, clock.instant(), Set.of(),
          store.nextRequestNonce(account));
      store.storeRequest(account, request);
      log.debug("Recovery {} of {} initiated by {} for {}", request.nonce(), account, caller, newRootAuthority);
    });
  }

  /**
   * Records one guardian's approval of the outstanding request.
   *
   * @param account the account
   * @param caller  a guardian who has not approved yet
   */
  public void approveRecovery(Address account, Address caller) {
    transactions.runAtomically(account, () -> {
      requireGuardian(account, caller);
      RecoveryRequest request = requireRequest(account);
      if (request.hasApproved(caller)) {
        throw new SmartAccountException(ErrorCode.ALREADY_APPROVED, caller + " already approved");
      }
      RecoveryRequest approved = request.withApproval(caller);
      store.storeRequest(account, approved);
      log.debug("Recovery of {} approved by {} ({} approvals)", account, caller, approved.approvalCount());
    });
  }

  /**
   * Completes the outstanding request once the delay has passed and the threshold is met, in
   * that order of checking.
   *
   * @param account the account
   * @param caller  anyone
   */
  public void executeRecovery(Address account, Address caller) {
    transactions.runAtomically(account, () -> {
      GuardianConfig guardianConfig = requireConfig(account);
      RecoveryRequest request = requireRequest(account);
      Instant executableAt = request.executableAt(guardianConfig.recoveryDelay());
      if (clock.instant().isBefore(executableAt)) {
        throw new SmartAccountException(ErrorCode.RECOVERY_DELAY_NOT_PASSED, "Recovery executable at " + executableAt);
      }
      if (request.approvalCount() < guardianConfig.threshold()) {
        throw new SmartAccountException(ErrorCode.THRESHOLD_NOT_MET,
            request.approvalCount() + " of " + guardianConfig.threshold() + " approvals");
      }
      accountManager.get().setRootAuthority(account, ADDRESS, request.newRootAuthority());
      store.clearRequest(account);
      log.debug("Recovery of {} executed by {}; root authority is {}", account, caller, request.newRootAuthority());
    });
  }

  /**
   * Discards the outstanding request and its approvals.
   *
   * @param account the account
   * @param caller  the account's current root authority
   */
  public void cancelRecovery(Address account, Address caller) {
    transactions.runAtomically(account, () -> {
      if (!caller.equals(currentRoot(account))) {
        throw new SmartAccountException(ErrorCode.UNAUTHORIZED, caller + " is not the root authority of " + account);
      }
      requireRequest(account);
      store.clearRequest(account);
      log.debug("Recovery of {} cancelled", account);
    });
  }

  // ── Guardian management ───────────────────────────────────────────────────

  public void addGuardian(Address account, Address caller, Address guardian) {
    reconfigure(account, caller, c -> {
      List<Address> guardians = new ArrayList<>(c.guardians());
      guardians.add(guardian);
      return c.withGuardians(guardians);
    });
  }

  public void removeGuardian(Address account, Address caller, Address guardian) {
    reconfigure(account, caller, c -> {
      if (!c.isGuardian(guardian)) {
        throw new SmartAccountException(ErrorCode.NOT_GUARDIAN, guardian + " is not a guardian");
      }
      List<Address> guardians = new ArrayList<>(c.guardians());
      guardians.remove(guardian);
      return c.withGuardians(guardians);
    });
  }

  public void updateThreshold(Address account, Address caller, int threshold) {
    reconfigure(account, caller, c -> c.withThreshold(threshold));
  }

  public void updateRecoveryDelay(Address account, Address caller, Duration recoveryDelay) {
    reconfigure(account, caller, c -> c.withRecoveryDelay(recoveryDelay));
  }

  /**
   * Applies a change to the guardian config. Restricted to the root authority or the account;
   * the result is revalidated and any pending request is dropped.
   */
  private void reconfigure(Address account, Address caller, UnaryOperator<GuardianConfig> change) {
    transactions.runAtomically(account, () -> {
      if (!caller.equals(currentRoot(account)) && !caller.equals(account)) {
        throw new SmartAccountException(ErrorCode.UNAUTHORIZED, caller + " may not manage guardians of " + account);
      }
      GuardianConfig updated = change.apply(requireConfig(account));
      validateConfig(account, updated);
      store.storeConfig(account, updated);
      if (store.loadRequest(account).isPresent()) {
        store.clearRequest(account);
        log.debug("Pending recovery of {} dropped after guardian change", account);
      }
      log.debug("Guardian config of {} is now {} of {}, delay {}", account,
          updated.threshold(), updated.guardians().size(), updated.recoveryDelay());
    });
  }

  private void validateConfig(Address account, GuardianConfig candidate) {
    List<Address> guardians = candidate.guardians();
    int count = guardians.size();
    if (count < config.minGuardians() || count > config.maxGuardians()) {
      throw new SmartAccountException(ErrorCode.INVALID_CONFIG,
          "Guardian count " + count + " outside " + config.minGuardians() + ".." + config.maxGuardians());
    }
    if (candidate.threshold() < SmartAccountConfig.MIN_THRESHOLD || candidate.threshold() > count) {
      throw new SmartAccountException(ErrorCode.INVALID_CONFIG,
          "Threshold " + candidate.threshold() + " invalid for " + count + " guardians");
    }
    Set<Address> seen = new HashSet<>();
    for (Address guardian : guardians) {
      if (guardian.isZero() || guardian.equals(account) || !seen.add(guardian)) {
        throw new SmartAccountException(ErrorCode.INVALID_CONFIG, "Invalid or duplicate guardian " + guardian);
      }
    }
    Duration delay = candidate.recoveryDelay();
    if (delay.compareTo(config.minRecoveryDelay()) < 0 || delay.compareTo(config.maxRecoveryDelay()) > 0) {
      throw new SmartAccountException(ErrorCode.INVALID_CONFIG, "Recovery delay " + delay + " out of bounds");
    }
  }

  // ── Queries ───────────────────────────────────────────────────────────────

  public Optional<GuardianConfig> getGuardianConfig(Address account) {
    return store.loadConfig(account);
  }

  public Optional<RecoveryRequest> getRecoveryRequest(Address account) {
    return store.loadRequest(account);
  }

  public boolean isGuardian(Address account, Address identity) {
    return store.loadConfig(account).map(c -> c.isGuardian(identity)).orElse(false);
  }

  private GuardianConfig requireConfig(Address account) {
    return store.loadConfig(account)
        .orElseThrow(() -> new SmartAccountException(ErrorCode.MODULE_STATE_ERROR, "Guardian recovery not installed on " + account));
  }

  private void requireGuardian(Address account, Address caller) {
    if (!requireConfig(account).isGuardian(caller)) {
      throw new SmartAccountException(ErrorCode.NOT_GUARDIAN, caller + " is not a guardian of " + account);
    }
  }

  private RecoveryRequest requireRequest(Address account) {
    return store.loadRequest(account)
        .orElseThrow(() -> new SmartAccountException(ErrorCode.NO_RECOVERY_REQUEST, "No recovery pending for " + account));
  }

  private Address currentRoot(Address account) {
    return accountStore.load(account)
        .map(AccountState::rootAuthority)
        .orElseThrow(() -> new SmartAccountException(ErrorCode.ACCOUNT_NOT_FOUND, "No account " + account));
  }
}
