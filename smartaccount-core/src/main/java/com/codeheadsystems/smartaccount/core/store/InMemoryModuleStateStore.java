package com.codeheadsystems.smartaccount.core.store;

import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class InMemoryModuleStateStore extends InMemoryAccountScopedStore<Map<Address, byte[]>>
    implements ModuleStateStore {

  @Override
  public Optional<byte[]> load(Address account, Address module) {
    return get(account).map(states -> states.get(module)).map(byte[]::clone);
  }

  @Override
  public void store(Address account, Address module, byte[] state) {
    byte[] copy = state.clone();
    update(account, Map.of(), states -> {
      Map<Address, byte[]> updated = new HashMap<>(states);
      updated.put(module, copy);
      return Map.copyOf(updated);
    });
  }

  @Override
  public void delete(Address account, Address module) {
    update(account, Map.of(), states -> {
      Map<Address, byte[]> updated = new HashMap<>(states);
      updated.remove(module);
      return Map.copyOf(updated);
    });
  }
}
