package com.codeheadsystems.smartaccount.core.delegation;

/**
 * What a delegatee may do with a delegation.
 */
public enum DelegationType {
  /**
   * Sign and execute anything on the delegator's behalf.
   */
  FULL(0),
  /**
   * Execute operations through the registry acting as executor module.
   */
  EXECUTOR(1),
  /**
   * Sign operations validated by the registry acting as validator module.
   */
  VALIDATOR(2),
  /**
   * Sign or execute only calls whose selector is in the allowed set.
   */
  LIMITED(3);

  private final int code;

  DelegationType(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean canExecute() {
    return this == FULL || this == EXECUTOR || this == LIMITED;
  }

  public boolean canValidate() {
    return this == FULL || this == VALIDATOR || this == LIMITED;
  }
}
