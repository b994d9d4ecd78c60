package com.codeheadsystems.smartaccount.core.validation;

import com.codeheadsystems.smartaccount.core.exception.ErrorCode;
import com.codeheadsystems.smartaccount.core.exception.SmartAccountException;
import com.codeheadsystems.smartaccount.core.model.ModuleType;
import com.codeheadsystems.smartaccount.core.model.OperationContext;
import com.codeheadsystems.smartaccount.core.model.ValidationResult;
import com.codeheadsystems.smartaccount.core.module.Module;
import com.codeheadsystems.smartaccount.core.module.ValidatorModule;
import com.codeheadsystems.smartaccount.core.store.ModuleStateStore;
import com.codeheadsystems.smartaccount.core.transaction.AccountTransactions;
import com.codeheadsystems.smartaccount.crypto.abi.AbiWords;
import com.codeheadsystems.smartaccount.crypto.common.ByteUtils;
import com.codeheadsystems.smartaccount.crypto.ecdsa.Secp256k1;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import com.codeheadsystems.smartaccount.crypto.types.Hash32;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validator module accepting secp256k1 signatures from a per-account owner key.
 * Install data is the owner address as one ABI word.
 */
@Singleton
public class EcdsaValidator implements ValidatorModule {

  public static final Address ADDRESS = Module.addressFor("ecdsa-validator");

  private static final Logger log = LoggerFactory.getLogger(EcdsaValidator.class);

  private final ModuleStateStore stateStore;
  private final AccountTransactions transactions;

  @Inject
  public EcdsaValidator(ModuleStateStore stateStore, AccountTransactions transactions) {
    this.stateStore = stateStore;
    this.transactions = transactions;
  }

  @Override
  public Address address() {
    return ADDRESS;
  }

  @Override
  public boolean isModuleType(ModuleType type) {
    return type == ModuleType.VALIDATOR;
  }

  public static byte[] initData(Address owner) {
    return AbiWords.encodeWords(AbiWords.word(owner));
  }

  @Override
  public void onInstall(Address account, byte[] initData) {
    if (initData == null || initData.length != ByteUtils.WORD) {
      throw new SmartAccountException(ErrorCode.INVALID_CONFIG, "ECDSA validator expects one owner word");
    }
    Address owner = Address.fromWord(initData);
    if (owner.isZero()) {
      throw new SmartAccountException(ErrorCode.INVALID_CONFIG, "ECDSA owner must not be zero");
    }
    if (stateStore.load(account, ADDRESS).isPresent()) {
      throw new SmartAccountException(ErrorCode.MODULE_STATE_ERROR, "ECDSA validator already initialized for " + account);
    }
    stateStore.store(account, ADDRESS, owner.bytes());
    log.debug("ECDSA validator installed on {} with owner {}", account, owner);
  }

  @Override
  public void onUninstall(Address account, byte[] deinitData) {
    stateStore.delete(account, ADDRESS);
    log.debug("ECDSA validator removed from {}", account);
  }

  public Optional<Address> owner(Address account) {
    return stateStore.load(account, ADDRESS).map(Address::new);
  }

  /**
   * Hands the account's validator key to a new owner.
   *
   * @param account  the account
   * @param caller   the current owner or the account itself
   * @param newOwner the new owner
   */
  public void transferOwnership(Address account, Address caller, Address newOwner) {
    transactions.runAtomically(account, () -> {
      Address current = owner(account).orElseThrow(() ->
          new SmartAccountException(ErrorCode.MODULE_STATE_ERROR, "ECDSA validator not installed on " + account));
      if (!caller.equals(current) && !caller.equals(account)) {
        throw new SmartAccountException(ErrorCode.UNAUTHORIZED, caller + " may not transfer ownership");
      }
      if (newOwner.isZero()) {
        throw new SmartAccountException(ErrorCode.INVALID_CONFIG, "ECDSA owner must not be zero");
      }
      stateStore.store(account, ADDRESS, newOwner.bytes());
      log.debug("ECDSA owner of {} changed to {}", account, newOwner);
    });
  }

  @Override
  public ValidationResult validateOperation(OperationContext context) {
    Optional<Address> signer = Secp256k1.recover(context.operationHash(), context.signature());
    if (signer.isPresent() && signer.equals(owner(context.account()))) {
      return ValidationResult.authorized(context.validationId(), signer.get());
    }
    return ValidationResult.rejected(context.validationId());
  }

  @Override
  public boolean isValidSignature(Address account, Hash32 hash, byte[] signature) {
    Optional<Address> signer = Secp256k1.recover(hash, signature);
    return signer.isPresent() && signer.equals(owner(account));
  }
}
