package com.codeheadsystems.smartaccount.core;

import com.codeheadsystems.smartaccount.core.account.AccountManager;
import com.codeheadsystems.smartaccount.core.account.CallDispatcher;
import com.codeheadsystems.smartaccount.core.config.SmartAccountConfig;
import com.codeheadsystems.smartaccount.core.delegation.DelegationRegistry;
import com.codeheadsystems.smartaccount.core.hook.AuditHook;
import com.codeheadsystems.smartaccount.core.hook.SpendingLimitHook;
import com.codeheadsystems.smartaccount.core.module.ModuleRegistry;
import com.codeheadsystems.smartaccount.core.recovery.GuardianRecoveryValidator;
import com.codeheadsystems.smartaccount.core.store.AccountStore;
import com.codeheadsystems.smartaccount.core.store.AuditStore;
import com.codeheadsystems.smartaccount.core.store.DelegationStore;
import com.codeheadsystems.smartaccount.core.store.InMemoryAccountStore;
import com.codeheadsystems.smartaccount.core.store.InMemoryAuditStore;
import com.codeheadsystems.smartaccount.core.store.InMemoryDelegationStore;
import com.codeheadsystems.smartaccount.core.store.InMemoryModuleStateStore;
import com.codeheadsystems.smartaccount.core.store.InMemoryRecoveryStore;
import com.codeheadsystems.smartaccount.core.store.InMemorySpendingLimitStore;
import com.codeheadsystems.smartaccount.core.store.ModuleStateStore;
import com.codeheadsystems.smartaccount.core.store.RecoveryStore;
import com.codeheadsystems.smartaccount.core.store.SpendingLimitStore;
import com.codeheadsystems.smartaccount.core.transaction.AccountTransactions;
import com.codeheadsystems.smartaccount.core.validation.EcdsaValidator;
import com.codeheadsystems.smartaccount.core.validation.ValidationManager;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the account core, its modules and in-memory stores without a container.
 * <p>
 * Every component also carries {@code javax.inject} annotations, so a DI container can build the
 * same graph; this class is what embedders and tests use when they have none. The built-in
 * modules are registered in the {@link ModuleRegistry} but installed on no account.
 */
public class SmartAccountEngine {

  private static final Logger log = LoggerFactory.getLogger(SmartAccountEngine.class);

  private final SmartAccountConfig config;
  private final AccountStore accountStore;
  private final AccountTransactions transactions;
  private final ModuleRegistry moduleRegistry;
  private final DelegationRegistry delegationRegistry;
  private final GuardianRecoveryValidator guardianRecovery;
  private final SpendingLimitHook spendingLimitHook;
  private final AuditHook auditHook;
  private final EcdsaValidator ecdsaValidator;
  private final ValidationManager validationManager;
  private final AccountManager accountManager;

  /**
   * Builds the engine over fresh in-memory stores.
   *
   * @param config     policy constants
   * @param clock      the time source for every temporal rule
   * @param dispatcher performs the effect of executed operations
   */
  public SmartAccountEngine(SmartAccountConfig config, Clock clock, CallDispatcher dispatcher) {
    this(config, clock, dispatcher, new InMemoryAccountStore(), new InMemoryDelegationStore(),
        new InMemoryRecoveryStore(), new InMemorySpendingLimitStore(), new InMemoryAuditStore(),
        new InMemoryModuleStateStore());
  }

  public SmartAccountEngine(SmartAccountConfig config,
                            Clock clock,
                            CallDispatcher dispatcher,
                            AccountStore accountStore,
                            DelegationStore delegationStore,
                            RecoveryStore recoveryStore,
                            SpendingLimitStore spendingLimitStore,
                            AuditStore auditStore,
                            ModuleStateStore moduleStateStore) {
    this.config = config;
    this.accountStore = accountStore;
    this.transactions = new AccountTransactions(List.of(
        accountStore, delegationStore, recoveryStore, spendingLimitStore, auditStore, moduleStateStore));
    this.moduleRegistry = new ModuleRegistry();
    this.delegationRegistry = new DelegationRegistry(config, clock, delegationStore, transactions, this::accountManager);
    this.guardianRecovery = new GuardianRecoveryValidator(config, clock, recoveryStore, accountStore, transactions,
        this::accountManager);
    this.spendingLimitHook = new SpendingLimitHook(config, clock, spendingLimitStore, accountStore, transactions);
    this.auditHook = new AuditHook(clock, auditStore);
    this.ecdsaValidator = new EcdsaValidator(moduleStateStore, transactions);
    this.validationManager = new ValidationManager(accountStore, moduleRegistry, delegationRegistry);
    this.accountManager = new AccountManager(config, clock, accountStore, transactions, moduleRegistry,
        validationManager, dispatcher);

    moduleRegistry.register(delegationRegistry);
    moduleRegistry.register(guardianRecovery);
    moduleRegistry.register(spendingLimitHook);
    moduleRegistry.register(auditHook);
    moduleRegistry.register(ecdsaValidator);
    log.info("SmartAccountEngine ready (entryPoint={})", config.entryPoint());
  }

  public SmartAccountConfig config() {
    return config;
  }

  public AccountManager accountManager() {
    return accountManager;
  }

  public ValidationManager validationManager() {
    return validationManager;
  }

  public DelegationRegistry delegationRegistry() {
    return delegationRegistry;
  }

  public GuardianRecoveryValidator guardianRecovery() {
    return guardianRecovery;
  }

  public SpendingLimitHook spendingLimitHook() {
    return spendingLimitHook;
  }

  public AuditHook auditHook() {
    return auditHook;
  }

  public EcdsaValidator ecdsaValidator() {
    return ecdsaValidator;
  }

  public ModuleRegistry moduleRegistry() {
    return moduleRegistry;
  }

  public AccountStore accountStore() {
    return accountStore;
  }

  public AccountTransactions transactions() {
    return transactions;
  }
}
