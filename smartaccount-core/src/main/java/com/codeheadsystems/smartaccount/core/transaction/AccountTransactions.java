package com.codeheadsystems.smartaccount.core.transaction;

import com.codeheadsystems.smartaccount.core.store.AccountScopedStore;
import com.codeheadsystems.smartaccount.core.store.StoreSnapshot;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * All-or-nothing units of work over one account's state.
 * <p>
 * Work on the same account is serialized by a per-account lock; different accounts run in
 * parallel. The outermost unit snapshots every account-scoped store and restores them if the
 * work throws. Nested units on the same thread join the outer one, so module callbacks roll back
 * together with the operation that triggered them.
 */
@Singleton
public class AccountTransactions {

  private static final Logger log = LoggerFactory.getLogger(AccountTransactions.class);

  private final List<AccountScopedStore> stores;
  private final ConcurrentHashMap<Address, ReentrantLock> locks = new ConcurrentHashMap<>();

  @Inject
  public AccountTransactions(List<AccountScopedStore> stores) {
    this.stores = List.copyOf(stores);
    log.info("AccountTransactions over {} stores", this.stores.size());
  }

  /**
   * Runs {@code work} atomically for the account.
   *
   * @param account the account whose state the work touches
   * @param work    the work
   * @param <T>     the result type
   * @return what the work returned
   */
  public <T> T atomically(Address account, Supplier<T> work) {
    return run(account, work, false);
  }

  public void runAtomically(Address account, Runnable work) {
    run(account, () -> {
      work.run();
      return null;
    }, false);
  }

  /**
   * Runs {@code work} and then discards every change it made, whether or not it threw. Used for
   * dry-run validation.
   *
   * @param account the account
   * @param work    the work
   * @param <T>     the result type
   * @return what the work returned
   */
  public <T> T simulate(Address account, Supplier<T> work) {
    return run(account, work, true);
  }

  /**
   * Whether the current thread is inside a unit of work for the account.
   *
   * @param account the account
   * @return true if joined calls would nest
   */
  public boolean inTransaction(Address account) {
    ReentrantLock lock = locks.get(account);
    return lock != null && lock.isHeldByCurrentThread();
  }

  private <T> T run(Address account, Supplier<T> work, boolean discard) {
    ReentrantLock lock = locks.computeIfAbsent(account, a -> new ReentrantLock());
    if (lock.isHeldByCurrentThread() && !discard) {
      return work.get();
    }
    lock.lock();
    List<StoreSnapshot> snapshots = new ArrayList<>(stores.size());
    try {
      for (AccountScopedStore store : stores) {
        snapshots.add(store.snapshot(account));
      }
      T result;
      try {
        result = work.get();
      } catch (RuntimeException | Error e) {
        rollback(account, snapshots);
        throw e;
      }
      if (discard) {
        rollback(account, snapshots);
      }
      return result;
    } finally {
      lock.unlock();
    }
  }

  private void rollback(Address account, List<StoreSnapshot> snapshots) {
    for (int i = snapshots.size() - 1; i >= 0; i--) {
      snapshots.get(i).restore();
    }
    log.debug("Rolled back state of account {}", account);
  }
}
