package com.codeheadsystems.smartaccount.core.exception;

/**
 * Machine-checkable rejection reasons.
 */
public enum ErrorCode {
  UNAUTHORIZED(ErrorCategory.AUTHORIZATION),
  INVALID_VALIDATOR(ErrorCategory.AUTHORIZATION),
  MODULE_STATE_ERROR(ErrorCategory.AUTHORIZATION),
  REENTRANT_CALL(ErrorCategory.AUTHORIZATION),
  HOOK_REJECTED(ErrorCategory.AUTHORIZATION),
  NOT_GUARDIAN(ErrorCategory.AUTHORIZATION),
  THRESHOLD_NOT_MET(ErrorCategory.AUTHORIZATION),
  INVALID_SIGNATURE(ErrorCategory.AUTHORIZATION),

  DELEGATION_EXPIRED(ErrorCategory.TEMPORAL),
  RECOVERY_DELAY_NOT_PASSED(ErrorCategory.TEMPORAL),

  SPENDING_LIMIT_EXCEEDED(ErrorCategory.QUOTA),
  ACCOUNT_IS_PAUSED(ErrorCategory.QUOTA),

  INVALID_CONFIG(ErrorCategory.CONFIGURATION),
  INVALID_DURATION(ErrorCategory.CONFIGURATION),
  INVALID_DELEGATEE(ErrorCategory.CONFIGURATION),
  INVALID_NONCE(ErrorCategory.CONFIGURATION),

  DELEGATION_NOT_FOUND(ErrorCategory.STATE_CONSISTENCY),
  DELEGATION_NOT_ACTIVE(ErrorCategory.STATE_CONSISTENCY),
  DELEGATION_ALREADY_EXISTS(ErrorCategory.STATE_CONSISTENCY),
  RECOVERY_ALREADY_INITIATED(ErrorCategory.STATE_CONSISTENCY),
  NO_RECOVERY_REQUEST(ErrorCategory.STATE_CONSISTENCY),
  ALREADY_APPROVED(ErrorCategory.STATE_CONSISTENCY),
  ACCOUNT_NOT_FOUND(ErrorCategory.STATE_CONSISTENCY),
  ACCOUNT_ALREADY_EXISTS(ErrorCategory.STATE_CONSISTENCY);

  private final ErrorCategory category;

  ErrorCode(ErrorCategory category) {
    this.category = category;
  }

  public ErrorCategory category() {
    return category;
  }
}
