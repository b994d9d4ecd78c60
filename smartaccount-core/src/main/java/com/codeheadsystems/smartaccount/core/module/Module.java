package com.codeheadsystems.smartaccount.core.module;

import com.codeheadsystems.smartaccount.core.model.ModuleType;
import com.codeheadsystems.smartaccount.crypto.Keccak;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.util.Arrays;

/**
 * A pluggable capability installed into accounts at runtime.
 * <p>
 * Implementations keep their per-account state in account-scoped stores so that a rejected
 * account operation rolls their state back along with the account's own.
 */
public interface Module {

  /**
   * The address the module is registered and installed under.
   *
   * @return the module address
   */
  Address address();

  /**
   * Whether this module can be installed as the given type.
   *
   * @param type the module type
   * @return true if supported
   */
  boolean isModuleType(ModuleType type);

  /**
   * Called synchronously when the module is installed. Throwing aborts the install.
   *
   * @param account  the installing account
   * @param initData module-specific configuration
   */
  void onInstall(Address account, byte[] initData);

  /**
   * Called synchronously when the module is uninstalled. Throwing aborts the uninstall.
   *
   * @param account    the account
   * @param deinitData module-specific clean-up data
   */
  void onUninstall(Address account, byte[] deinitData);

  /**
   * Derives a stable module address from a name: the last 20 bytes of keccak256 over
   * {@code "smartaccount.module." + name}.
   *
   * @param name the module name
   * @return the address
   */
  static Address addressFor(String name) {
    byte[] digest = Keccak.keccak256("smartaccount.module." + name);
    return new Address(Arrays.copyOfRange(digest, digest.length - Address.LENGTH, digest.length));
  }
}
