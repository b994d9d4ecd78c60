package com.codeheadsystems.smartaccount.core.exception;

/**
 * Rejection of an account operation.
 * <p>
 * Every entry point that throws this has already rolled back all state it touched, so callers
 * can rely on the account being exactly as it was before the call.
 */
public class SmartAccountException extends RuntimeException {

  private final ErrorCode code;

  /**
   * Instantiates a new Smart account exception.
   *
   * @param code    the code
   * @param message the message
   */
  public SmartAccountException(final ErrorCode code, final String message) {
    super(code + ": " + message);
    this.code = code;
  }

  /**
   * Instantiates a new Smart account exception.
   *
   * @param code    the code
   * @param message the message
   * @param cause   the cause
   */
  public SmartAccountException(final ErrorCode code, final String message, final Throwable cause) {
    super(code + ": " + message, cause);
    this.code = code;
  }

  public ErrorCode code() {
    return code;
  }

  public ErrorCategory category() {
    return code.category();
  }
}
