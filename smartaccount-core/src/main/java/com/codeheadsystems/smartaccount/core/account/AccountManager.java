package com.codeheadsystems.smartaccount.core.account;

import com.codeheadsystems.smartaccount.core.config.SmartAccountConfig;
import com.codeheadsystems.smartaccount.core.exception.ErrorCode;
import com.codeheadsystems.smartaccount.core.exception.SmartAccountException;
import com.codeheadsystems.smartaccount.core.model.AccountState;
import com.codeheadsystems.smartaccount.core.model.CallResult;
import com.codeheadsystems.smartaccount.core.model.ModuleType;
import com.codeheadsystems.smartaccount.core.model.Operation;
import com.codeheadsystems.smartaccount.core.model.OperationContext;
import com.codeheadsystems.smartaccount.core.model.SignedOperation;
import com.codeheadsystems.smartaccount.core.model.ValidationResult;
import com.codeheadsystems.smartaccount.core.module.ExecutorModule;
import com.codeheadsystems.smartaccount.core.module.HookModule;
import com.codeheadsystems.smartaccount.core.module.Module;
import com.codeheadsystems.smartaccount.core.module.ModuleRegistry;
import com.codeheadsystems.smartaccount.core.module.ValidatorModule;
import com.codeheadsystems.smartaccount.core.store.AccountStore;
import com.codeheadsystems.smartaccount.core.transaction.AccountTransactions;
import com.codeheadsystems.smartaccount.core.validation.ValidationManager;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import com.codeheadsystems.smartaccount.crypto.types.Hash32;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single authoritative entry point for state-changing operations on an account.
 * <p>
 * Owns the root authority, activity tracking, installed modules and the emergency escape.
 * Every public mutator runs as one account transaction: a {@link SmartAccountException} (or any
 * other exception) leaves the account and every module's state for it exactly as before.
 * <p>
 * <strong>Reentrancy:</strong> calling back into a mutator for an account while an operation on
 * that account is in flight fails with {@code REENTRANT_CALL}.
 */
@Singleton
public class AccountManager {

  private static final Logger log = LoggerFactory.getLogger(AccountManager.class);

  private final SmartAccountConfig config;
  private final Clock clock;
  private final AccountStore accountStore;
  private final AccountTransactions transactions;
  private final ModuleRegistry moduleRegistry;
  private final ValidationManager validationManager;
  private final CallDispatcher dispatcher;

  private final Set<Address> inFlight = ConcurrentHashMap.newKeySet();

  @Inject
  public AccountManager(SmartAccountConfig config,
                        Clock clock,
                        AccountStore accountStore,
                        AccountTransactions transactions,
                        ModuleRegistry moduleRegistry,
                        ValidationManager validationManager,
                        CallDispatcher dispatcher) {
    this.config = config;
    this.clock = clock;
    this.accountStore = accountStore;
    this.transactions = transactions;
    this.moduleRegistry = moduleRegistry;
    this.validationManager = validationManager;
    this.dispatcher = dispatcher;
    log.info("AccountManager(entryPoint={}, emergencyDelay={})", config.entryPoint(), config.emergencyDelay());
  }

  // ── Accounts ──────────────────────────────────────────────────────────────

  /**
   * Creates an account. The emergency identity is fixed for the account's lifetime; zero disables
   * the emergency escape.
   *
   * @param account                   the new account address
   * @param rootAuthority             the initial root authority
   * @param emergencyRecoveryIdentity the fallback identity
   * @return the created state
   */
  public AccountState createAccount(Address account, Address rootAuthority, Address emergencyRecoveryIdentity) {
    if (account.isZero()) {
      throw new SmartAccountException(ErrorCode.INVALID_CONFIG, "Account address must not be zero");
    }
    if (rootAuthority.isZero()) {
      throw new SmartAccountException(ErrorCode.INVALID_VALIDATOR, "Root authority must not be zero");
    }
    return transactions.atomically(account, () -> {
      if (accountStore.load(account).isPresent()) {
        throw new SmartAccountException(ErrorCode.ACCOUNT_ALREADY_EXISTS, "Account exists: " + account);
      }
      AccountState state = AccountState.create(account, rootAuthority, emergencyRecoveryIdentity, clock.instant());
      accountStore.store(state);
      log.debug("Created account {} with root authority {}", account, rootAuthority);
      return state;
    });
  }

  public Optional<AccountState> getAccount(Address account) {
    return accountStore.load(account);
  }

  public Address rootAuthority(Address account) {
    return require(account).rootAuthority();
  }

  // ── Execution ─────────────────────────────────────────────────────────────

  /**
   * Runs an operation for a caller that needs no signature: the root authority, the entry point
   * or the account itself. Hooks gate the effect.
   *
   * @param account   the account
   * @param caller    the immediate caller
   * @param operation the call to make
   * @return the effect's result; a failed result is not rolled back
   */
  public CallResult execute(Address account, Address caller, Operation operation) {
    return guarded(account, () -> {
      authorizeDirect(require(account), caller);
      return runPipeline(account, caller, operation);
    });
  }

  /**
   * Runs several operations as one: if any is rejected, none takes effect.
   *
   * @param account    the account
   * @param caller     the immediate caller
   * @param operations the calls, in order
   * @return results in the same order
   */
  public List<CallResult> executeBatch(Address account, Address caller, List<Operation> operations) {
    return guarded(account, () -> {
      authorizeDirect(require(account), caller);
      List<CallResult> results = new ArrayList<>(operations.size());
      for (Operation operation : operations) {
        results.add(runPipeline(account, caller, operation));
      }
      return results;
    });
  }

  /**
   * Runs an operation submitted by an installed executor module.
   *
   * @param account   the account
   * @param executor  the executor module's address
   * @param operation the call
   * @return the effect's result
   */
  public CallResult executeFromExecutor(Address account, Address executor, Operation operation) {
    return guarded(account, () -> {
      AccountState state = require(account);
      if (!state.isInstalled(ModuleType.EXECUTOR, executor)) {
        throw new SmartAccountException(ErrorCode.UNAUTHORIZED, executor + " is not an installed executor");
      }
      return runPipeline(account, executor, operation);
    });
  }

  /**
   * Entry-point path: validates a signed operation against its declared validator, consumes the
   * nonce and runs the operation.
   *
   * @param account the account
   * @param caller  must be the configured entry point
   * @param signed  the signed operation
   * @return the effect's result
   */
  public CallResult handleOperation(Address account, Address caller, SignedOperation signed) {
    return guarded(account, () -> {
      if (!caller.equals(config.entryPoint())) {
        throw new SmartAccountException(ErrorCode.UNAUTHORIZED, caller + " is not the entry point");
      }
      ValidationResult result = validateSigned(account, signed);
      if (!result.authorized()) {
        throw new SmartAccountException(ErrorCode.UNAUTHORIZED,
            "Validator " + result.validationId().address() + " rejected the operation");
      }
      accountStore.store(require(account).withNextNonce());
      return runPipeline(account, caller, signed.operation());
    });
  }

  /**
   * Dry-run validation of a signed operation. Nothing the validator records is kept.
   *
   * @param account the account
   * @param signed  the signed operation
   * @return the validator's decision
   */
  public ValidationResult validateOperation(Address account, SignedOperation signed) {
    rejectReentry(account);
    return transactions.simulate(account, () -> validateSigned(account, signed));
  }

  private ValidationResult validateSigned(Address account, SignedOperation signed) {
    AccountState state = require(account);
    if (signed.nonce() != state.operationNonce()) {
      throw new SmartAccountException(ErrorCode.INVALID_NONCE,
          "Expected nonce " + state.operationNonce() + " but got " + signed.nonce());
    }
    return validationManager.validate(OperationContext.of(account, signed));
  }

  private CallResult runPipeline(Address account, Address caller, Operation operation) {
    List<HookModule> hooks = require(account).modules(ModuleType.HOOK).stream()
        .map(this::hook)
        .toList();
    List<byte[]> hookData = new ArrayList<>(hooks.size());
    for (HookModule hook : hooks) {
      hookData.add(callHook(hook, () -> hook.preCheck(account, caller, operation)));
    }
    CallResult result = dispatcher.dispatch(account, operation);
    for (int i = hooks.size() - 1; i >= 0; i--) {
      HookModule hook = hooks.get(i);
      byte[] data = hookData.get(i);
      callHook(hook, () -> {
        hook.postCheck(account, data, result);
        return null;
      });
    }
    touch(account);
    log.debug("Executed {} on {} for caller {} (success={})", operation.target(), account, caller, result.success());
    return result;
  }

  private <T> T callHook(HookModule hook, Supplier<T> call) {
    try {
      return call.get();
    } catch (SmartAccountException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SmartAccountException(ErrorCode.HOOK_REJECTED, "Hook " + hook.address() + " failed", e);
    }
  }

  // ── Modules ───────────────────────────────────────────────────────────────

  /**
   * Installs a registered module. The module's {@code onInstall} runs inside the same
   * transaction, so its failure aborts the install.
   *
   * @param account  the account
   * @param caller   root authority, entry point or the account
   * @param type     the capability to install it as
   * @param module   the module address
   * @param initData module configuration
   */
  public void installModule(Address account, Address caller, ModuleType type, Address module, byte[] initData) {
    guarded(account, () -> {
      AccountState state = require(account);
      authorizeDirect(state, caller);
      if (state.isInstalled(type, module)) {
        throw new SmartAccountException(ErrorCode.MODULE_STATE_ERROR, module + " already installed as " + type);
      }
      Module resolved = resolve(module, type);
      accountStore.store(state.withModuleInstalled(type, module));
      resolved.onInstall(account, initData == null ? new byte[0] : initData.clone());
      touch(account);
      log.debug("Installed {} as {} on {}", module, type, account);
      return null;
    });
  }

  /**
   * Uninstalls a module. The module's {@code onUninstall} failure aborts the uninstall.
   *
   * @param account    the account
   * @param caller     root authority, entry point or the account
   * @param type       the capability it is installed as
   * @param module     the module address
   * @param deinitData module clean-up data
   */
  public void uninstallModule(Address account, Address caller, ModuleType type, Address module, byte[] deinitData) {
    guarded(account, () -> {
      AccountState state = require(account);
      authorizeDirect(state, caller);
      if (!state.isInstalled(type, module)) {
        throw new SmartAccountException(ErrorCode.MODULE_STATE_ERROR, module + " is not installed as " + type);
      }
      Module resolved = resolve(module, type);
      accountStore.store(state.withModuleUninstalled(type, module));
      resolved.onUninstall(account, deinitData == null ? new byte[0] : deinitData.clone());
      touch(account);
      log.debug("Uninstalled {} as {} from {}", module, type, account);
      return null;
    });
  }

  public boolean isModuleInstalled(Address account, ModuleType type, Address module) {
    return accountStore.load(account).map(s -> s.isInstalled(type, module)).orElse(false);
  }

  private Module resolve(Address module, ModuleType type) {
    Class<? extends Module> expected = switch (type) {
      case VALIDATOR -> ValidatorModule.class;
      case EXECUTOR -> ExecutorModule.class;
      case HOOK -> HookModule.class;
    };
    Module resolved = moduleRegistry.find(module, expected)
        .orElseThrow(() -> new SmartAccountException(ErrorCode.MODULE_STATE_ERROR, "No " + type + " module at " + module));
    if (!resolved.isModuleType(type)) {
      throw new SmartAccountException(ErrorCode.MODULE_STATE_ERROR, module + " does not support " + type);
    }
    return resolved;
  }

  private HookModule hook(Address address) {
    return moduleRegistry.find(address, HookModule.class)
        .orElseThrow(() -> new SmartAccountException(ErrorCode.MODULE_STATE_ERROR, "Hook " + address + " not registered"));
  }

  // ── Root authority ────────────────────────────────────────────────────────

  /**
   * Replaces the root authority. Allowed for the current root authority, the account itself, or
   * an installed recovery validator.
   *
   * @param account          the account
   * @param caller           the immediate caller
   * @param newRootAuthority the new root authority, not zero
   */
  public void setRootAuthority(Address account, Address caller, Address newRootAuthority) {
    guarded(account, () -> {
      AccountState state = require(account);
      if (!caller.equals(state.rootAuthority()) && !caller.equals(account) && !isRecoveryValidator(state, caller)) {
        throw new SmartAccountException(ErrorCode.UNAUTHORIZED, caller + " may not set the root authority");
      }
      if (newRootAuthority == null || newRootAuthority.isZero()) {
        throw new SmartAccountException(ErrorCode.INVALID_VALIDATOR, "Root authority must not be zero");
      }
      accountStore.store(state.withRootAuthority(newRootAuthority).withLastActivityTime(clock.instant()));
      log.debug("Root authority of {} changed to {} by {}", account, newRootAuthority, caller);
      return null;
    });
  }

  private boolean isRecoveryValidator(AccountState state, Address caller) {
    return state.isInstalled(ModuleType.VALIDATOR, caller)
        && moduleRegistry.find(caller, ValidatorModule.class).map(ValidatorModule::isRecoveryModule).orElse(false);
  }

  /**
   * Last-resort escape: the emergency identity takes over once the account has been idle for
   * longer than the emergency delay. Bypasses every installed module.
   *
   * @param account          the account
   * @param caller           must be the account's emergency identity
   * @param newRootAuthority the new root authority, not zero
   */
  public void emergencyRecovery(Address account, Address caller, Address newRootAuthority) {
    guarded(account, () -> {
      AccountState state = require(account);
      Address identity = state.emergencyRecoveryIdentity();
      if (identity.isZero() || !identity.equals(caller)) {
        log.warn("Rejected emergency recovery of {} from {}", account, caller);
        throw new SmartAccountException(ErrorCode.UNAUTHORIZED, caller + " is not the emergency identity");
      }
      Instant now = clock.instant();
      Instant eligibleAfter = state.lastActivityTime().plus(config.emergencyDelay());
      if (!now.isAfter(eligibleAfter)) {
        log.warn("Rejected early emergency recovery of {}; eligible after {}", account, eligibleAfter);
        throw new SmartAccountException(ErrorCode.RECOVERY_DELAY_NOT_PASSED,
            "Emergency recovery available after " + eligibleAfter);
      }
      if (newRootAuthority == null || newRootAuthority.isZero()) {
        throw new SmartAccountException(ErrorCode.INVALID_VALIDATOR, "Root authority must not be zero");
      }
      accountStore.store(state.withRootAuthority(newRootAuthority).withLastActivityTime(now));
      log.debug("Emergency recovery of {} set root authority {}", account, newRootAuthority);
      return null;
    });
  }

  // ── Signatures ────────────────────────────────────────────────────────────

  /**
   * Off-band signature check; see {@link ValidationManager#isValidSignature}.
   *
   * @param account  the account
   * @param hash     the signed digest
   * @param envelope validation id followed by the signature
   * @return true if accepted
   */
  public boolean isValidSignature(Address account, Hash32 hash, byte[] envelope) {
    return validationManager.isValidSignature(account, hash, envelope);
  }

  // ── Internals ─────────────────────────────────────────────────────────────

  private void authorizeDirect(AccountState state, Address caller) {
    if (!caller.equals(state.rootAuthority()) && !caller.equals(config.entryPoint()) && !caller.equals(state.address())) {
      throw new SmartAccountException(ErrorCode.UNAUTHORIZED, caller + " may not act for " + state.address());
    }
  }

  private AccountState require(Address account) {
    return accountStore.load(account)
        .orElseThrow(() -> new SmartAccountException(ErrorCode.ACCOUNT_NOT_FOUND, "No account " + account));
  }

  private void touch(Address account) {
    accountStore.store(require(account).withLastActivityTime(clock.instant()));
  }

  private void rejectReentry(Address account) {
    if (inFlight.contains(account) && transactions.inTransaction(account)) {
      throw new SmartAccountException(ErrorCode.REENTRANT_CALL, "Operation already in flight for " + account);
    }
  }

  private <T> T guarded(Address account, Supplier<T> work) {
    return transactions.atomically(account, () -> {
      if (!inFlight.add(account)) {
        throw new SmartAccountException(ErrorCode.REENTRANT_CALL, "Operation already in flight for " + account);
      }
      try {
        return work.get();
      } finally {
        inFlight.remove(account);
      }
    });
  }
}
