package com.codeheadsystems.smartaccount.core.store;

import com.codeheadsystems.smartaccount.core.hook.AuditEntry;
import com.codeheadsystems.smartaccount.crypto.types.Address;
import java.util.List;

/**
 * Append-only audit trail per account.
 */
public interface AuditStore extends AccountScopedStore {

  void append(AuditEntry entry);

  List<AuditEntry> entries(Address account);
}
