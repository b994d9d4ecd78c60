package com.codeheadsystems.smartaccount.core.hook;

import com.codeheadsystems.smartaccount.core.model.CallResult;
import com.codeheadsystems.smartaccount.core.model.ModuleType;
import com.codeheadsystems.smartaccount.core.model.Operation;
import com.codeheadsystems.smartaccount.core.module.HookModule;
import com.codeheadsystems.smartaccount.core.module.Module;
import com.codeheadsystems.smartaccount.core.store.AuditStore;
import com.codeheadsystems.smartaccount.crypto.abi.AbiWords;
import com.codeheadsystems.smartaccount.crypto.common.ByteUtils;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import com.codeheadsystems.smartaccount.crypto.types.Selector;
import java.math.BigInteger;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records every executed operation of the accounts it is installed on. The trail outlives
 * uninstallation.
 */
@Singleton
public class AuditHook implements HookModule {

  public static final Address ADDRESS = Module.addressFor("audit");

  private static final Logger log = LoggerFactory.getLogger(AuditHook.class);

  private final Clock clock;
  private final AuditStore store;

  @Inject
  public AuditHook(Clock clock, AuditStore store) {
    this.clock = clock;
    this.store = store;
  }

  @Override
  public Address address() {
    return ADDRESS;
  }

  @Override
  public boolean isModuleType(ModuleType type) {
    return type == ModuleType.HOOK;
  }

  @Override
  public void onInstall(Address account, byte[] initData) {
    log.debug("Audit hook installed on {}", account);
  }

  @Override
  public void onUninstall(Address account, byte[] deinitData) {
    log.debug("Audit hook removed from {}; {} entries kept", account, store.entries(account).size());
  }

  // Words: caller, target, value, then the selector right-aligned with a leading 1 marker byte.
  @Override
  public byte[] preCheck(Address account, Address caller, Operation operation) {
    byte[] selectorWord = operation.selector()
        .map(s -> ByteUtils.leftPad(ByteUtils.concat(new byte[]{1}, s.bytes()), ByteUtils.WORD))
        .orElseGet(() -> new byte[ByteUtils.WORD]);
    return AbiWords.encodeWords(
        AbiWords.word(caller),
        AbiWords.word(operation.target()),
        AbiWords.word(operation.value()),
        selectorWord);
  }

  @Override
  public void postCheck(Address account, byte[] hookData, CallResult result) {
    byte[] selectorWord = AbiWords.wordAt(hookData, 3);
    Optional<Selector> selector = selectorWord[ByteUtils.WORD - Selector.LENGTH - 1] == 1
        ? Optional.of(new Selector(Arrays.copyOfRange(selectorWord, ByteUtils.WORD - Selector.LENGTH, ByteUtils.WORD)))
        : Optional.empty();
    AuditEntry entry = new AuditEntry(
        account,
        Address.fromWord(AbiWords.wordAt(hookData, 0)),
        Address.fromWord(AbiWords.wordAt(hookData, 1)),
        new BigInteger(1, AbiWords.wordAt(hookData, 2)),
        selector,
        clock.instant(),
        result.success());
    store.append(entry);
  }

  public List<AuditEntry> entries(Address account) {
    return store.entries(account);
  }
}
