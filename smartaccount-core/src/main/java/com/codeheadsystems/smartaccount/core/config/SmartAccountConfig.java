package com.codeheadsystems.smartaccount.core.config;

import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.time.Duration;

/**
 * Policy constants for accounts, delegations and recovery.
 *
 * @param emergencyDelay        inactivity required before the emergency identity may act
 * @param minDelegationDuration shortest delegation lifetime accepted
 * @param maxDelegationDuration longest delegation lifetime accepted
 * @param minRecoveryDelay      shortest guardian recovery delay accepted
 * @param maxRecoveryDelay      longest guardian recovery delay accepted
 * @param minGuardians          smallest guardian set accepted
 * @param maxGuardians          largest guardian set accepted
 * @param maxSpendingPeriod     longest spending-limit period accepted
 * @param entryPoint            the designated outer-dispatch caller
 * @param administrator         role allowed to revoke any delegation, {@link Address#ZERO} for none
 */
public record SmartAccountConfig(
    Duration emergencyDelay,
    Duration minDelegationDuration,
    Duration maxDelegationDuration,
    Duration minRecoveryDelay,
    Duration maxRecoveryDelay,
    int minGuardians,
    int maxGuardians,
    Duration maxSpendingPeriod,
    Address entryPoint,
    Address administrator
) {

  /**
   * ERC-4337 v0.7 entry point.
   */
  public static final Address DEFAULT_ENTRY_POINT = Address.of("0x0000000071727De22E5E9d8BAf0edAc6f37da032");

  /**
   * Smallest recovery threshold accepted, whatever the guardian bounds.
   */
  public static final int MIN_THRESHOLD = 2;

  /**
   * Production defaults: 30-day emergency window, 1 hour to 365 day delegations, 1 to 30 day
   * recovery delay, 2 to 10 guardians, spending periods up to 365 days.
   */
  public static final SmartAccountConfig DEFAULT = new SmartAccountConfig(
      Duration.ofDays(30),
      Duration.ofHours(1),
      Duration.ofDays(365),
      Duration.ofDays(1),
      Duration.ofDays(30),
      2,
      10,
      Duration.ofDays(365),
      DEFAULT_ENTRY_POINT,
      Address.ZERO
  );

  public SmartAccountConfig {
    if (minDelegationDuration.compareTo(maxDelegationDuration) > 0) {
      throw new IllegalArgumentException("minDelegationDuration exceeds maxDelegationDuration");
    }
    if (minRecoveryDelay.compareTo(maxRecoveryDelay) > 0) {
      throw new IllegalArgumentException("minRecoveryDelay exceeds maxRecoveryDelay");
    }
    if (minGuardians < 2 || maxGuardians < minGuardians) {
      throw new IllegalArgumentException("Guardian bounds must satisfy 2 <= min <= max");
    }
    if (maxSpendingPeriod.isZero() || maxSpendingPeriod.isNegative()) {
      throw new IllegalArgumentException("maxSpendingPeriod must be positive");
    }
  }

  public SmartAccountConfig withEntryPoint(Address newEntryPoint) {
    return new SmartAccountConfig(emergencyDelay, minDelegationDuration, maxDelegationDuration,
        minRecoveryDelay, maxRecoveryDelay, minGuardians, maxGuardians, maxSpendingPeriod, newEntryPoint, administrator);
  }

  public SmartAccountConfig withAdministrator(Address newAdministrator) {
    return new SmartAccountConfig(emergencyDelay, minDelegationDuration, maxDelegationDuration,
        minRecoveryDelay, maxRecoveryDelay, minGuardians, maxGuardians, maxSpendingPeriod, entryPoint, newAdministrator);
  }

  public SmartAccountConfig withEmergencyDelay(Duration newEmergencyDelay) {
    return new SmartAccountConfig(newEmergencyDelay, minDelegationDuration, maxDelegationDuration,
        minRecoveryDelay, maxRecoveryDelay, minGuardians, maxGuardians, maxSpendingPeriod, entryPoint, administrator);
  }

  public SmartAccountConfig withGuardianBounds(int newMinGuardians, int newMaxGuardians) {
    return new SmartAccountConfig(emergencyDelay, minDelegationDuration, maxDelegationDuration,
        minRecoveryDelay, maxRecoveryDelay, newMinGuardians, newMaxGuardians, maxSpendingPeriod, entryPoint,
        administrator);
  }

  public boolean hasAdministrator() {
    return !administrator.isZero();
  }
}
