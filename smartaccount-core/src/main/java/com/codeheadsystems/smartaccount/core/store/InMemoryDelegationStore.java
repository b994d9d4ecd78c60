package com.codeheadsystems.smartaccount.core.store;

import com.codeheadsystems.smartaccount.core.delegation.Delegation;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import com.codeheadsystems.smartaccount.crypto.types.Hash32;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryDelegationStore extends InMemoryAccountScopedStore<InMemoryDelegationStore.DelegatorTable>
    implements DelegationStore {

  /**
   * Everything one delegator owns. Copied on every write.
   */
  record DelegatorTable(Map<Hash32, Delegation> delegations, long sequence, long grantNonce) {

    static final DelegatorTable EMPTY = new DelegatorTable(Map.of(), 0, 0);

    DelegatorTable with(Delegation delegation) {
      Map<Hash32, Delegation> copy = new LinkedHashMap<>(delegations);
      copy.put(delegation.id(), delegation);
      return new DelegatorTable(copy, sequence, grantNonce);
    }
  }

  // id -> delegator. Only ids present in their delegator's table.
  private final ConcurrentHashMap<Hash32, Address> index = new ConcurrentHashMap<>();

  @Override
  public Optional<Delegation> load(Hash32 id) {
    Address delegator = index.get(id);
    if (delegator == null) {
      return Optional.empty();
    }
    Optional<Delegation> found = get(delegator).map(table -> table.delegations().get(id));
    if (found.isEmpty()) {
      index.remove(id, delegator);
    }
    return found;
  }

  @Override
  public StoreSnapshot snapshot(Address delegator) {
    StoreSnapshot table = super.snapshot(delegator);
    return () -> {
      table.restore();
      Map<Hash32, Delegation> restored = get(delegator).map(DelegatorTable::delegations).orElse(Map.of());
      index.entrySet().removeIf(e -> e.getValue().equals(delegator) && !restored.containsKey(e.getKey()));
    };
  }

  int indexedIds() {
    return index.size();
  }

  @Override
  public void store(Delegation delegation) {
    update(delegation.delegator(), DelegatorTable.EMPTY, table -> table.with(delegation));
    index.put(delegation.id(), delegation.delegator());
  }

  @Override
  public List<Delegation> byDelegator(Address delegator) {
    return get(delegator).map(table -> List.copyOf(table.delegations().values())).orElse(List.of());
  }

  @Override
  public long nextSequence(Address delegator) {
    return update(delegator, DelegatorTable.EMPTY,
        table -> new DelegatorTable(table.delegations(), table.sequence() + 1, table.grantNonce()))
        .sequence() - 1;
  }

  @Override
  public long grantNonce(Address delegator) {
    return get(delegator).map(DelegatorTable::grantNonce).orElse(0L);
  }

  @Override
  public void incrementGrantNonce(Address delegator) {
    update(delegator, DelegatorTable.EMPTY,
        table -> new DelegatorTable(table.delegations(), table.sequence(), table.grantNonce() + 1));
  }
}
