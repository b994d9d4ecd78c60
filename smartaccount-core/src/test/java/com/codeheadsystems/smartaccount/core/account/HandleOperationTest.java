package com.codeheadsystems.smartaccount.core.account;

import static com.codeheadsystems.smartaccount.core.testing.Rejections.assertRejected;
import static com.codeheadsystems.smartaccount.core.testing.SmartAccountFixture.ACCOUNT;
import static com.codeheadsystems.smartaccount.core.testing.SmartAccountFixture.ENTRY_POINT;
import static com.codeheadsystems.smartaccount.core.testing.SmartAccountFixture.OWNER;
import static com.codeheadsystems.smartaccount.core.testing.SmartAccountFixture.STRANGER;
import static com.codeheadsystems.smartaccount.core.testing.SmartAccountFixture.TARGET;
import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.smartaccount.core.exception.ErrorCode;
import com.codeheadsystems.smartaccount.core.model.ModuleType;
import com.codeheadsystems.smartaccount.core.model.Operation;
import com.codeheadsystems.smartaccount.core.model.SignedOperation;
import com.codeheadsystems.smartaccount.core.model.ValidationId;
import com.codeheadsystems.smartaccount.core.model.ValidationResult;
import com.codeheadsystems.smartaccount.core.testing.SmartAccountFixture;
import com.codeheadsystems.smartaccount.core.validation.EcdsaValidator;
import com.codeheadsystems.smartaccount.crypto.ecdsa.EcdsaSignature;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Entry-point path: signature validation, nonce handling and dry runs.
 */
class HandleOperationTest {

  private static final Operation PAY = Operation.transfer(TARGET, BigInteger.valueOf(3));

  private SmartAccountFixture fixture;
  private AccountManager manager;

  @BeforeEach
  void setUp() {
    fixture = new SmartAccountFixture();
    manager = fixture.accounts();
    fixture.createAccount();
  }

  private long nonce() {
    return manager.getAccount(ACCOUNT).orElseThrow().operationNonce();
  }

  @Test
  void rootSignedOperation_executesAndConsumesNonce() {
    SignedOperation signed = fixture.sign(PAY, ValidationId.ROOT, OWNER);

    assertThat(manager.handleOperation(ACCOUNT, ENTRY_POINT, signed).success()).isTrue();

    assertThat(fixture.dispatched).containsExactly(PAY);
    assertThat(nonce()).isEqualTo(1);
  }

  @Test
  void replayedOperation_isRejectedByNonce() {
    SignedOperation signed = fixture.sign(PAY, ValidationId.ROOT, OWNER);
    manager.handleOperation(ACCOUNT, ENTRY_POINT, signed);

    assertRejected(() -> manager.handleOperation(ACCOUNT, ENTRY_POINT, signed), ErrorCode.INVALID_NONCE);
    assertThat(fixture.dispatched).hasSize(1);
  }

  @Test
  void onlyTheEntryPointMaySubmit() {
    SignedOperation signed = fixture.sign(PAY, ValidationId.ROOT, OWNER);

    assertRejected(() -> manager.handleOperation(ACCOUNT, OWNER.address(), signed), ErrorCode.UNAUTHORIZED);
  }

  @Test
  void wrongSigner_isRejectedWithoutSideEffects() {
    SignedOperation signed = fixture.sign(PAY, ValidationId.ROOT, STRANGER);

    assertRejected(() -> manager.handleOperation(ACCOUNT, ENTRY_POINT, signed), ErrorCode.UNAUTHORIZED);

    assertThat(nonce()).isZero();
    assertThat(fixture.dispatched).isEmpty();
  }

  @Test
  void signatureWithROffTheCurve_isUnauthorized() {
    byte[] offCurve = new EcdsaSignature(BigInteger.valueOf(5), BigInteger.ONE, 27).toBytes();
    SignedOperation signed = new SignedOperation(PAY, ValidationId.ROOT, nonce(), offCurve);

    assertRejected(() -> manager.handleOperation(ACCOUNT, ENTRY_POINT, signed), ErrorCode.UNAUTHORIZED);
    assertThat(manager.validateOperation(ACCOUNT, signed).authorized()).isFalse();

    assertThat(nonce()).isZero();
    assertThat(fixture.dispatched).isEmpty();
  }

  @Test
  void signatureForOneValidatorDoesNotSatisfyAnother() {
    manager.installModule(ACCOUNT, OWNER.address(), ModuleType.VALIDATOR, EcdsaValidator.ADDRESS,
        EcdsaValidator.initData(STRANGER.address()));
    SignedOperation forRoot = fixture.sign(PAY, ValidationId.ROOT, STRANGER);
    SignedOperation forModule = fixture.sign(PAY, ValidationId.of(EcdsaValidator.ADDRESS), STRANGER);

    assertRejected(() -> manager.handleOperation(ACCOUNT, ENTRY_POINT, forRoot), ErrorCode.UNAUTHORIZED);
    assertThat(manager.handleOperation(ACCOUNT, ENTRY_POINT, forModule).success()).isTrue();
  }

  @Test
  void undeclaredValidator_isInvalid() {
    SignedOperation signed = fixture.sign(PAY, ValidationId.of(EcdsaValidator.ADDRESS), OWNER);

    assertRejected(() -> manager.handleOperation(ACCOUNT, ENTRY_POINT, signed), ErrorCode.INVALID_VALIDATOR);
  }

  @Test
  void validateOperation_isADryRun() {
    SignedOperation signed = fixture.sign(PAY, ValidationId.ROOT, OWNER);

    ValidationResult result = manager.validateOperation(ACCOUNT, signed);

    assertThat(result.authorized()).isTrue();
    assertThat(result.signer()).contains(OWNER.address());
    assertThat(nonce()).isZero();
    assertThat(fixture.dispatched).isEmpty();
    assertThat(manager.validateOperation(ACCOUNT, fixture.sign(PAY, ValidationId.ROOT, STRANGER)).authorized())
        .isFalse();
  }
}
