package com.codeheadsystems.smartaccount.core.store;

import com.codeheadsystems.smartaccount.core.recovery.GuardianConfig;
import com.codeheadsystems.smartaccount.core.recovery.RecoveryRequest;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.util.Optional;

/**
 * Guardian configuration and the outstanding recovery request, keyed by account alone.
 */
public interface RecoveryStore extends AccountScopedStore {

  Optional<GuardianConfig> loadConfig(Address account);

  void storeConfig(Address account, GuardianConfig config);

  Optional<RecoveryRequest> loadRequest(Address account);

  void storeRequest(Address account, RecoveryRequest request);

  void clearRequest(Address account);

  /**
   * Returns the account's next request nonce and advances it. Survives {@link #clear}.
   *
   * @param account the account
   * @return the nonce for a new request
   */
  long nextRequestNonce(Address account);

  /**
   * Drops the config and any request of the account.
   *
   * @param account the account
   */
  void clear(Address account);
}
