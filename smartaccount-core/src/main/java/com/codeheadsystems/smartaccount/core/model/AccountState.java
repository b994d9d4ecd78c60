package com.codeheadsystems.smartaccount.core.model;

import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The authorization aggregate of one account. Immutable; every change produces a new instance.
 *
 * @param address                   the account identifier
 * @param rootAuthority             the identity currently in control
 * @param emergencyRecoveryIdentity fallback identity fixed at creation
 * @param lastActivityTime          time of the last successful authorized call
 * @param operationNonce            next nonce accepted for a signed operation
 * @param installedModules          installed module addresses per type, in install order
 */
public record AccountState(
    Address address,
    Address rootAuthority,
    Address emergencyRecoveryIdentity,
    Instant lastActivityTime,
    long operationNonce,
    Map<ModuleType, List<Address>> installedModules) {

  public AccountState {
    EnumMap<ModuleType, List<Address>> copy = new EnumMap<>(ModuleType.class);
    for (ModuleType type : ModuleType.values()) {
      copy.put(type, List.copyOf(installedModules.getOrDefault(type, List.of())));
    }
    installedModules = Map.copyOf(copy);
  }

  public static AccountState create(Address address, Address rootAuthority,
                                    Address emergencyRecoveryIdentity, Instant now) {
    return new AccountState(address, rootAuthority, emergencyRecoveryIdentity, now, 0, Map.of());
  }

  public List<Address> modules(ModuleType type) {
    return installedModules.get(type);
  }

  public boolean isInstalled(ModuleType type, Address module) {
    return installedModules.get(type).contains(module);
  }

  public AccountState withRootAuthority(Address newRootAuthority) {
    return new AccountState(address, newRootAuthority, emergencyRecoveryIdentity, lastActivityTime,
        operationNonce, installedModules);
  }

  public AccountState withLastActivityTime(Instant time) {
    return new AccountState(address, rootAuthority, emergencyRecoveryIdentity, time,
        operationNonce, installedModules);
  }

  public AccountState withNextNonce() {
    return new AccountState(address, rootAuthority, emergencyRecoveryIdentity, lastActivityTime,
        operationNonce + 1, installedModules);
  }

  public AccountState withModuleInstalled(ModuleType type, Address module) {
    return withModules(type, true, module);
  }

  public AccountState withModuleUninstalled(ModuleType type, Address module) {
    return withModules(type, false, module);
  }

  private AccountState withModules(ModuleType type, boolean add, Address module) {
    EnumMap<ModuleType, List<Address>> modules = new EnumMap<>(installedModules);
    List<Address> updated = new ArrayList<>(modules.get(type));
    if (add) {
      updated.add(module);
    } else {
      updated.remove(module);
    }
    modules.put(type, updated);
    return new AccountState(address, rootAuthority, emergencyRecoveryIdentity, lastActivityTime,
        operationNonce, modules);
  }
}
