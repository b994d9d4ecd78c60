package com.codeheadsystems.smartaccount.core.store;

import com.codeheadsystems.smartaccount.core.recovery.GuardianConfig;
import com.codeheadsystems.smartaccount.core.recovery.RecoveryRequest;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.util.Optional;

public class InMemoryRecoveryStore extends InMemoryAccountScopedStore<InMemoryRecoveryStore.RecoveryState>
    implements RecoveryStore {

  record RecoveryState(GuardianConfig config, RecoveryRequest request, long requestNonce) {

    static final RecoveryState EMPTY = new RecoveryState(null, null, 0);
  }

  @Override
  public Optional<GuardianConfig> loadConfig(Address account) {
    return get(account).map(RecoveryState::config);
  }

  @Override
  public void storeConfig(Address account, GuardianConfig config) {
    update(account, RecoveryState.EMPTY, s -> new RecoveryState(config, s.request(), s.requestNonce()));
  }

  @Override
  public Optional<RecoveryRequest> loadRequest(Address account) {
    return get(account).map(RecoveryState::request);
  }

  @Override
  public void storeRequest(Address account, RecoveryRequest request) {
    update(account, RecoveryState.EMPTY, s -> new RecoveryState(s.config(), request, s.requestNonce()));
  }

  @Override
  public void clearRequest(Address account) {
    update(account, RecoveryState.EMPTY, s -> new RecoveryState(s.config(), null, s.requestNonce()));
  }

  @Override
  public long nextRequestNonce(Address account) {
    return update(account, RecoveryState.EMPTY,
        s -> new RecoveryState(s.config(), s.request(), s.requestNonce() + 1)).requestNonce() - 1;
  }

  @Override
  public void clear(Address account) {
    update(account, RecoveryState.EMPTY, s -> new RecoveryState(null, null, s.requestNonce()));
  }
}
