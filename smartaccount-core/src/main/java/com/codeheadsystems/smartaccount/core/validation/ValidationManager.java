package com.codeheadsystems.smartaccount.core.validation;

import com.codeheadsystems.smartaccount.core.exception.ErrorCode;
import com.codeheadsystems.smartaccount.core.exception.SmartAccountException;
import com.codeheadsystems.smartaccount.core.model.AccountState;
import com.codeheadsystems.smartaccount.core.model.ModuleType;
import com.codeheadsystems.smartaccount.core.model.OperationContext;
import com.codeheadsystems.smartaccount.core.model.SignatureEnvelope;
import com.codeheadsystems.smartaccount.core.model.ValidationId;
import com.codeheadsystems.smartaccount.core.model.ValidationResult;
import com.codeheadsystems.smartaccount.core.module.ModuleRegistry;
import com.codeheadsystems.smartaccount.core.module.ValidatorModule;
import com.codeheadsystems.smartaccount.core.store.AccountStore;
import com.codeheadsystems.smartaccount.crypto.ecdsa.Secp256k1;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import com.codeheadsystems.smartaccount.crypto.types.Hash32;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves who may authorize an operation for an account.
 * <p>
 * Validation id zero is the root authority, checked by recovering the ECDSA signer of the
 * operation hash. Any other id must name a validator module installed on the account. There is
 * no fallback from one to the other: the operation declares which validator it targets.
 */
@Singleton
public class ValidationManager {

  private static final Logger log = LoggerFactory.getLogger(ValidationManager.class);

  private final AccountStore accountStore;
  private final ModuleRegistry moduleRegistry;
  private final DelegationLookup delegationLookup;

  @Inject
  public ValidationManager(AccountStore accountStore, ModuleRegistry moduleRegistry,
                           DelegationLookup delegationLookup) {
    this.accountStore = accountStore;
    this.moduleRegistry = moduleRegistry;
    this.delegationLookup = delegationLookup;
  }

  /**
   * Authorizes an operation.
   *
   * @param context the operation context
   * @return the decision of the declared validator
   * @throws SmartAccountException {@code INVALID_VALIDATOR} if a non-root id is not an installed
   *                               validator; {@code ACCOUNT_NOT_FOUND} for unknown accounts
   */
  public ValidationResult validate(OperationContext context) {
    AccountState state = load(context.account());
    ValidationId validationId = context.validationId();
    if (validationId.isRoot()) {
      Optional<Address> signer = Secp256k1.recover(context.operationHash(), context.signature());
      if (signer.isPresent() && signer.get().equals(state.rootAuthority())) {
        return ValidationResult.authorized(validationId, signer.get());
      }
      log.debug("Root signature rejected for account {}", context.account());
      return ValidationResult.rejected(validationId);
    }
    return validator(state, validationId)
        .orElseThrow(() -> new SmartAccountException(ErrorCode.INVALID_VALIDATOR,
            "Validator " + validationId.address() + " is not installed on " + context.account()))
        .validateOperation(context);
  }

  /**
   * Off-band signature check over an envelope of validation id and signature.
   * <p>
   * For the root id the signer must be the root authority, or hold an active full or executor
   * delegation from the root authority or from the account itself. Non-root ids are judged by the
   * installed validator. Malformed input is rejected, never thrown.
   *
   * @param account           the account
   * @param hash              the signed digest
   * @param encodedEnvelope   20-byte validation id followed by the signature
   * @return true if accepted
   */
  public boolean isValidSignature(Address account, Hash32 hash, byte[] encodedEnvelope) {
    Optional<AccountState> state = accountStore.load(account);
    if (state.isEmpty() || encodedEnvelope == null || encodedEnvelope.length < Address.LENGTH) {
      return false;
    }
    SignatureEnvelope envelope = SignatureEnvelope.decode(encodedEnvelope);
    if (!envelope.validationId().isRoot()) {
      return validator(state.get(), envelope.validationId())
          .map(v -> v.isValidSignature(account, hash, envelope.signature()))
          .orElse(false);
    }
    Optional<Address> signer = Secp256k1.recover(hash, envelope.signature());
    if (signer.isEmpty()) {
      return false;
    }
    Address root = state.get().rootAuthority();
    return signer.get().equals(root)
        || delegationLookup.hasSigningDelegation(root, signer.get())
        || delegationLookup.hasSigningDelegation(account, signer.get());
  }

  /**
   * The validator module registered under the id and installed on the account.
   *
   * @param state        the account
   * @param validationId a non-root id
   * @return the module, or empty
   */
  public Optional<ValidatorModule> validator(AccountState state, ValidationId validationId) {
    if (validationId.isRoot() || !state.isInstalled(ModuleType.VALIDATOR, validationId.address())) {
      return Optional.empty();
    }
    return moduleRegistry.find(validationId.address(), ValidatorModule.class);
  }

  private AccountState load(Address account) {
    return accountStore.load(account)
        .orElseThrow(() -> new SmartAccountException(ErrorCode.ACCOUNT_NOT_FOUND, "No account " + account));
  }
}
