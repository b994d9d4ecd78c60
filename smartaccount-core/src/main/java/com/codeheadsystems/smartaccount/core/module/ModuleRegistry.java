package com.codeheadsystems.smartaccount.core.module;

import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves module addresses to module instances. Accounts hold only addresses.
 */
@Singleton
public class ModuleRegistry {

  private static final Logger log = LoggerFactory.getLogger(ModuleRegistry.class);

  private final ConcurrentHashMap<Address, Module> modules = new ConcurrentHashMap<>();

  /**
   * Makes a module available for installation.
   *
   * @param module the module
   * @throws IllegalArgumentException if another module already uses the address
   */
  public void register(Module module) {
    Module existing = modules.putIfAbsent(module.address(), module);
    if (existing != null && existing != module) {
      throw new IllegalArgumentException("Module address already registered: " + module.address());
    }
    log.debug("Registered module {} at {}", module.getClass().getSimpleName(), module.address());
  }

  public Optional<Module> find(Address address) {
    return Optional.ofNullable(modules.get(address));
  }

  public <T extends Module> Optional<T> find(Address address, Class<T> type) {
    return find(address).filter(type::isInstance).map(type::cast);
  }
}
