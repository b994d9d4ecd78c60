package com.codeheadsystems.smartaccount.core.exception;

/**
 * Broad classes of rejection. Callers decide whether to retry from the category alone.
 */
public enum ErrorCategory {
  /**
   * The caller may not do this. Never self-resolving.
   */
  AUTHORIZATION,
  /**
   * Too early or too late. Retrying later may succeed.
   */
  TEMPORAL,
  /**
   * A quota is exhausted until the period rolls over or the owner raises it.
   */
  QUOTA,
  /**
   * The input is invalid and must be corrected.
   */
  CONFIGURATION,
  /**
   * The request is redundant or refers to state that does not exist.
   */
  STATE_CONSISTENCY
}
