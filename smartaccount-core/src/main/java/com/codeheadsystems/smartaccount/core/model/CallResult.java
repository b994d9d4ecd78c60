package com.codeheadsystems.smartaccount.core.model;

/**
 * Outcome of the effect of an operation. A failed result is a non-reverting failure: state
 * recorded before the call, including spend, is kept.
 *
 * @param success    whether the callee succeeded
 * @param returnData the callee's return or revert data
 */
public record CallResult(boolean success, byte[] returnData) {

  public CallResult {
    returnData = returnData == null ? new byte[0] : returnData.clone();
  }

  public static CallResult success(byte[] returnData) {
    return new CallResult(true, returnData);
  }

  public static CallResult failure(byte[] returnData) {
    return new CallResult(false, returnData);
  }

  @Override
  public byte[] returnData() {
    return returnData.clone();
  }
}
