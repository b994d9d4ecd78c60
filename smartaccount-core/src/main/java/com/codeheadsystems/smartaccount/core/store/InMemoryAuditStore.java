package com.codeheadsystems.smartaccount.core.store;

import com.codeheadsystems.smartaccount.core.hook.AuditEntry;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.util.ArrayList;
import java.util.List;

public class InMemoryAuditStore extends InMemoryAccountScopedStore<List<AuditEntry>> implements AuditStore {

  @Override
  public void append(AuditEntry entry) {
    update(entry.account(), List.of(), entries -> {
      List<AuditEntry> copy = new ArrayList<>(entries);
      copy.add(entry);
      return List.copyOf(copy);
    });
  }

  @Override
  public List<AuditEntry> entries(Address account) {
    return get(account).orElse(List.of());
  }
}
