package com.codeheadsystems.smartaccount.core.hook;

import static com.codeheadsystems.smartaccount.core.testing.SmartAccountFixture.ACCOUNT;
import static com.codeheadsystems.smartaccount.core.testing.SmartAccountFixture.OWNER;
import static com.codeheadsystems.smartaccount.core.testing.SmartAccountFixture.START;
import static com.codeheadsystems.smartaccount.core.testing.SmartAccountFixture.TARGET;
import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.smartaccount.core.model.CallResult;
import com.codeheadsystems.smartaccount.core.model.ModuleType;
import com.codeheadsystems.smartaccount.core.model.Operation;
import com.codeheadsystems.smartaccount.core.testing.SmartAccountFixture;
import com.codeheadsystems.smartaccount.crypto.abi.AbiWords;
import com.codeheadsystems.smartaccount.crypto.types.Selector;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AuditHookTest {

  private static final Selector PING = Selector.fromSignature("ping()");

  private SmartAccountFixture fixture;
  private AuditHook audit;

  @BeforeEach
  void setUp() {
    fixture = new SmartAccountFixture();
    audit = fixture.engine.auditHook();
    fixture.createAccount();
    fixture.accounts().installModule(ACCOUNT, OWNER.address(), ModuleType.HOOK, AuditHook.ADDRESS, new byte[0]);
  }

  @Test
  void recordsEveryExecutedOperation() {
    fixture.accounts().execute(ACCOUNT, OWNER.address(), Operation.transfer(TARGET, BigInteger.valueOf(3)));
    fixture.clock.advance(Duration.ofMinutes(1));
    fixture.accounts().execute(ACCOUNT, ACCOUNT, Operation.call(TARGET, AbiWords.callData(PING)));

    assertThat(audit.entries(ACCOUNT)).containsExactly(
        new AuditEntry(ACCOUNT, OWNER.address(), TARGET, BigInteger.valueOf(3), Optional.empty(), START, true),
        new AuditEntry(ACCOUNT, ACCOUNT, TARGET, BigInteger.ZERO, Optional.of(PING),
            START.plus(Duration.ofMinutes(1)), true));
  }

  @Test
  void failedEffectsAreRecordedAsFailures() {
    fixture.onDispatch((account, operation) -> CallResult.failure(new byte[0]));

    fixture.accounts().execute(ACCOUNT, OWNER.address(), Operation.transfer(TARGET, BigInteger.ONE));

    assertThat(audit.entries(ACCOUNT)).singleElement().extracting(AuditEntry::success).isEqualTo(false);
  }

  @Test
  void trailOutlivesUninstall() {
    fixture.accounts().execute(ACCOUNT, OWNER.address(), Operation.transfer(TARGET, BigInteger.ONE));

    fixture.accounts().uninstallModule(ACCOUNT, OWNER.address(), ModuleType.HOOK, AuditHook.ADDRESS, new byte[0]);
    fixture.accounts().execute(ACCOUNT, OWNER.address(), Operation.transfer(TARGET, BigInteger.ONE));

    assertThat(audit.entries(ACCOUNT)).hasSize(1);
  }
}
