package com.codeheadsystems.smartaccount.core.module;

import com.codeheadsystems.smartaccount.core.model.CallResult;
import com.codeheadsystems.smartaccount.core.model.Operation;
import com.codeheadsystems.smartaccount.crypto.types.Address;

/**
 * A gate run around every executed operation of the accounts it is installed on.
 */
public interface HookModule extends Module {

  /**
   * Runs before the effect. Throwing rejects the whole operation.
   *
   * @param account   the account
   * @param caller    who triggered the operation
   * @param operation the operation about to run
   * @return opaque data handed back to {@link #postCheck}
   */
  byte[] preCheck(Address account, Address caller, Operation operation);

  /**
   * Runs after the effect. Throwing rejects the whole operation.
   *
   * @param account  the account
   * @param hookData what {@link #preCheck} returned
   * @param result   the outcome of the effect
   */
  void postCheck(Address account, byte[] hookData, CallResult result);
}
