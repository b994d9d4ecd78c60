package com.codeheadsystems.smartaccount.core.account;

import com.codeheadsystems.smartaccount.core.model.CallResult;
import com.codeheadsystems.smartaccount.core.model.Operation;
import com.codeheadsystems.smartaccount.crypto.types.Address;

/**
 * Performs the effect of an authorized operation. Supplied by the embedder (token transfers,
 * contract calls and the like live behind it).
 * <p>
 * Returning a failed {@link CallResult} is a non-reverting failure: hook accounting already
 * recorded stays recorded. Throwing reverts the whole operation.
 */
@FunctionalInterface
public interface CallDispatcher {

  CallResult dispatch(Address account, Operation operation);
}
