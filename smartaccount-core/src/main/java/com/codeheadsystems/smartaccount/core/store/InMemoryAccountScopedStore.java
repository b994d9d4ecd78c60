package com.codeheadsystems.smartaccount.core.store;

import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for the non-persistent stores: one immutable value per account in a
 * {@link ConcurrentHashMap}. Snapshots hold a reference to the value, which is enough because
 * values are never mutated in place.
 *
 * @param <V> the immutable per-account value
 */
public abstract class InMemoryAccountScopedStore<V> implements AccountScopedStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryAccountScopedStore.class);

  private final ConcurrentHashMap<Address, V> values = new ConcurrentHashMap<>();

  protected InMemoryAccountScopedStore() {
    log.warn("Using {}: state will NOT survive restarts. "
        + "Replace with a persistent store for production.", getClass().getSimpleName());
  }

  protected Optional<V> get(Address account) {
    return Optional.ofNullable(values.get(account));
  }

  protected void put(Address account, V value) {
    values.put(account, value);
  }

  protected void remove(Address account) {
    values.remove(account);
  }

  protected V update(Address account, V initial, UnaryOperator<V> change) {
    return values.compute(account, (k, current) -> change.apply(current == null ? initial : current));
  }

  @Override
  public StoreSnapshot snapshot(Address account) {
    V captured = values.get(account);
    return () -> {
      if (captured == null) {
        values.remove(account);
      } else {
        values.put(account, captured);
      }
    };
  }
}
