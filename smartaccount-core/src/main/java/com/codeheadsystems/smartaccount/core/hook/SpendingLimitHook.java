package com.codeheadsystems.smartaccount.core.hook;

import com.codeheadsystems.smartaccount.core.config.SmartAccountConfig;
import com.codeheadsystems.smartaccount.core.exception.ErrorCode;
import com.codeheadsystems.smartaccount.core.exception.SmartAccountException;
import com.codeheadsystems.smartaccount.core.exception.SpendingLimitExceededException;
import com.codeheadsystems.smartaccount.core.model.AccountState;
import com.codeheadsystems.smartaccount.core.model.CallResult;
import com.codeheadsystems.smartaccount.core.model.ModuleType;
import com.codeheadsystems.smartaccount.core.model.Operation;
import com.codeheadsystems.smartaccount.core.module.HookModule;
import com.codeheadsystems.smartaccount.core.module.Module;
import com.codeheadsystems.smartaccount.core.store.AccountStore;
import com.codeheadsystems.smartaccount.core.store.SpendingLimitStore;
import com.codeheadsystems.smartaccount.core.transaction.AccountTransactions;
import com.codeheadsystems.smartaccount.crypto.abi.AbiWords;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import com.codeheadsystems.smartaccount.crypto.types.Selector;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rolling-period quota on an account's aggregate outflow per asset, enforced before every
 * executed operation regardless of who triggered it.
 * <p>
 * Native value is charged to asset {@link Address#ZERO}; ERC-20 {@code transfer} and
 * {@code approve} calls are charged to the token at the call target. Periods reset lazily on the
 * first charge after they elapse. Install data is optional: groups of three words
 * (asset, limit, period seconds).
 */
@Singleton
public class SpendingLimitHook implements HookModule {

  public static final Address ADDRESS = Module.addressFor("spending-limit");

  public static final Selector TRANSFER = Selector.fromSignature("transfer(address,uint256)");
  public static final Selector APPROVE = Selector.fromSignature("approve(address,uint256)");

  private static final Logger log = LoggerFactory.getLogger(SpendingLimitHook.class);
  private static final int WORDS_PER_LIMIT = 3;

  /**
   * One amount charged to one asset.
   *
   * @param asset  the asset
   * @param amount the amount
   */
  public record Charge(Address asset, BigInteger amount) {
  }

  private final SmartAccountConfig config;
  private final Clock clock;
  private final SpendingLimitStore store;
  private final AccountStore accountStore;
  private final AccountTransactions transactions;

  @Inject
  public SpendingLimitHook(SmartAccountConfig config, Clock clock, SpendingLimitStore store,
                           AccountStore accountStore, AccountTransactions transactions) {
    this.config = config;
    this.clock = clock;
    this.store = store;
    this.accountStore = accountStore;
    this.transactions = transactions;
  }

  // ── Module ────────────────────────────────────────────────────────────────

  @Override
  public Address address() {
    return ADDRESS;
  }

  @Override
  public boolean isModuleType(ModuleType type) {
    return type == ModuleType.HOOK;
  }

  public static byte[] initData(Address asset, BigInteger limit, Duration period) {
    return AbiWords.encodeWords(AbiWords.word(asset), AbiWords.word(limit),
        AbiWords.word(BigInteger.valueOf(period.toSeconds())));
  }

  @Override
  public void onInstall(Address account, byte[] initData) {
    if (initData == null || initData.length == 0) {
      return;
    }
    int words;
    try {
      words = AbiWords.wordCount(initData);
    } catch (IllegalArgumentException e) {
      throw new SmartAccountException(ErrorCode.INVALID_CONFIG, "Malformed spending limit data", e);
    }
    if (words % WORDS_PER_LIMIT != 0) {
      throw new SmartAccountException(ErrorCode.INVALID_CONFIG, "Spending limit data must be (asset, limit, period) triples");
    }
    for (int i = 0; i < words; i += WORDS_PER_LIMIT) {
      Address asset = Address.fromWord(AbiWords.wordAt(initData, i));
      BigInteger limit = new BigInteger(1, AbiWords.wordAt(initData, i + 1));
      BigInteger seconds = new BigInteger(1, AbiWords.wordAt(initData, i + 2));
      if (seconds.bitLength() > 62) {
        throw new SmartAccountException(ErrorCode.INVALID_CONFIG, "Period out of range");
      }
      putLimit(account, asset, limit, Duration.ofSeconds(seconds.longValue()));
    }
  }

  @Override
  public void onUninstall(Address account, byte[] deinitData) {
    store.clear(account);
    log.debug("Spending limits of {} cleared", account);
  }

  // ── Hook ──────────────────────────────────────────────────────────────────

  /**
   * Charges the operation against the account's quotas.
   *
   * @return the encoded charges, empty when nothing was charged
   * @throws SmartAccountException {@code ACCOUNT_IS_PAUSED}; {@link SpendingLimitExceededException}
   */
  @Override
  public byte[] preCheck(Address account, Address caller, Operation operation) {
    SpendingPolicy policy = store.policy(account);
    if (policy.isWhitelisted(caller) || policy.isWhitelisted(operation.target())) {
      return new byte[0];
    }
    if (policy.paused()) {
      throw new SmartAccountException(ErrorCode.ACCOUNT_IS_PAUSED, "Account " + account + " is paused");
    }
    Instant now = clock.instant();
    List<byte[]> recorded = new ArrayList<>();
    for (Charge charge : charges(operation)) {
      Optional<SpendingLimitConfig> found = store.load(account, charge.asset()).filter(SpendingLimitConfig::enabled);
      if (found.isEmpty()) {
        continue;
      }
      SpendingLimitConfig current = found.get().resetIfElapsed(now);
      BigInteger spent = current.spent().add(charge.amount());
      if (spent.compareTo(current.limit()) > 0) {
        throw new SpendingLimitExceededException(charge.asset(), charge.amount(), current.remaining());
      }
      store.store(account, current.withSpent(spent));
      recorded.add(AbiWords.word(charge.asset()));
      recorded.add(AbiWords.word(charge.amount()));
    }
    return AbiWords.encodeWords(recorded.toArray(new byte[0][]));
  }

  /**
   * Recorded spend is kept even when the effect failed: an attempted spend consumes quota.
   */
  @Override
  public void postCheck(Address account, byte[] hookData, CallResult result) {
    if (!result.success() && hookData.length > 0) {
      log.debug("Operation on {} failed after spend was recorded; spend is kept", account);
    }
  }

  /**
   * What an operation would be charged, by asset.
   *
   * @param operation the operation
   * @return native value first, then any token amount
   */
  public static List<Charge> charges(Operation operation) {
    List<Charge> charges = new ArrayList<>(2);
    if (operation.value().signum() > 0) {
      charges.add(new Charge(Address.ZERO, operation.value()));
    }
    byte[] callData = operation.callData();
    operation.selector()
        .filter(s -> s.equals(TRANSFER) || s.equals(APPROVE))
        .filter(s -> callData.length >= Selector.LENGTH + 64)
        .ifPresent(s -> charges.add(new Charge(operation.target(), AbiWords.uintArgument(callData, 1))));
    return charges;
  }

  // ── Administration ────────────────────────────────────────────────────────

  /**
   * Sets or changes the quota of one asset. Changing an existing quota keeps the current
   * period's spend and start, capped at the new limit.
   *
   * @param account the account
   * @param caller  the account or its root authority
   * @param asset   the asset, zero for native value
   * @param limit   spend allowed per period, positive
   * @param period  the period length, positive and at most the configured maximum
   */
  public void setSpendingLimit(Address account, Address caller, Address asset, BigInteger limit, Duration period) {
    transactions.runAtomically(account, () -> {
      requireAdmin(account, caller);
      putLimit(account, asset, limit, period);
    });
  }

  private void putLimit(Address account, Address asset, BigInteger limit, Duration period) {
    if (limit.signum() <= 0 || period.isZero() || period.isNegative()) {
      throw new SmartAccountException(ErrorCode.INVALID_CONFIG, "Limit and period must be positive");
    }
    if (period.compareTo(config.maxSpendingPeriod()) > 0) {
      throw new SmartAccountException(ErrorCode.INVALID_CONFIG,
          "Period " + period + " exceeds " + config.maxSpendingPeriod());
    }
    Instant now = clock.instant();
    SpendingLimitConfig updated = store.load(account, asset)
        .map(c -> c.resetIfElapsed(now))
        .map(c -> new SpendingLimitConfig(asset, limit, period, c.spent().min(limit), c.periodStart(), true))
        .orElseGet(() -> new SpendingLimitConfig(asset, limit, period, BigInteger.ZERO, now, true));
    store.store(account, updated);
    log.debug("Spending limit of {} for asset {} set to {} per {}", account, asset, limit, period);
  }

  public void removeSpendingLimit(Address account, Address caller, Address asset) {
    transactions.runAtomically(account, () -> {
      requireAdmin(account, caller);
      store.remove(account, asset);
      log.debug("Spending limit of {} for asset {} removed", account, asset);
    });
  }

  public void setLimitEnabled(Address account, Address caller, Address asset, boolean enabled) {
    transactions.runAtomically(account, () -> {
      requireAdmin(account, caller);
      SpendingLimitConfig c = requireLimit(account, asset);
      store.store(account, new SpendingLimitConfig(asset, c.limit(), c.periodLength(), c.spent(), c.periodStart(), enabled));
    });
  }

  /**
   * Starts a new period, but only if the current one has elapsed.
   *
   * @param account the account
   * @param caller  the account or its root authority
   * @param asset   the asset
   * @return true if a reset happened
   */
  public boolean resetPeriod(Address account, Address caller, Address asset) {
    return transactions.atomically(account, () -> {
      requireAdmin(account, caller);
      SpendingLimitConfig current = requireLimit(account, asset);
      SpendingLimitConfig reset = current.resetIfElapsed(clock.instant());
      if (reset == current) {
        log.debug("Period of {} for asset {} has not elapsed; reset ignored", account, asset);
        return false;
      }
      store.store(account, reset);
      return true;
    });
  }

  public void setPaused(Address account, Address caller, boolean paused) {
    transactions.runAtomically(account, () -> {
      requireAdmin(account, caller);
      store.storePolicy(account, store.policy(account).withPaused(paused));
      log.debug("Account {} paused={}", account, paused);
    });
  }

  public void addToWhitelist(Address account, Address caller, Address identity) {
    setWhitelisted(account, caller, identity, true);
  }

  public void removeFromWhitelist(Address account, Address caller, Address identity) {
    setWhitelisted(account, caller, identity, false);
  }

  private void setWhitelisted(Address account, Address caller, Address identity, boolean whitelisted) {
    transactions.runAtomically(account, () -> {
      requireAdmin(account, caller);
      store.storePolicy(account, store.policy(account).withWhitelisted(identity, whitelisted));
    });
  }

  // ── Queries ───────────────────────────────────────────────────────────────

  /**
   * The quota as it stands now, with any elapsed period already reset in the returned copy.
   *
   * @param account the account
   * @param asset   the asset
   * @return the effective config, or empty
   */
  public Optional<SpendingLimitConfig> getSpendingLimit(Address account, Address asset) {
    Instant now = clock.instant();
    return store.load(account, asset).map(c -> c.resetIfElapsed(now));
  }

  public Optional<BigInteger> getRemaining(Address account, Address asset) {
    return getSpendingLimit(account, asset).map(SpendingLimitConfig::remaining);
  }

  public boolean isPaused(Address account) {
    return store.policy(account).paused();
  }

  public boolean isWhitelisted(Address account, Address identity) {
    return store.policy(account).isWhitelisted(identity);
  }

  private SpendingLimitConfig requireLimit(Address account, Address asset) {
    return store.load(account, asset)
        .orElseThrow(() -> new SmartAccountException(ErrorCode.INVALID_CONFIG, "No spending limit for asset " + asset));
  }

  private void requireAdmin(Address account, Address caller) {
    boolean root = accountStore.load(account).map(AccountState::rootAuthority).map(caller::equals).orElse(false);
    if (!root && !caller.equals(account)) {
      throw new SmartAccountException(ErrorCode.UNAUTHORIZED, caller + " may not manage spending limits of " + account);
    }
  }
}
