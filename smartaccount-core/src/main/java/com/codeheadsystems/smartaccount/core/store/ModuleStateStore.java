package com.codeheadsystems.smartaccount.core.store;

import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.util.Optional;

/**
 * Opaque per-(account, module) storage for modules without a dedicated store.
 */
public interface ModuleStateStore extends AccountScopedStore {

  Optional<byte[]> load(Address account, Address module);

  void store(Address account, Address module, byte[] state);

  void delete(Address account, Address module);
}
