package com.codeheadsystems.smartaccount.core.delegation;

public enum DelegationStatus {
  INACTIVE,
  ACTIVE,
  REVOKED,
  EXPIRED
}
