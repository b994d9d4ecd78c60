package com.codeheadsystems.smartaccount.core.hook;

import com.codeheadsystems.smartaccount.crypto.types.Address;
import com.codeheadsystems.smartaccount.crypto.types.Selector;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Optional;

/**
 * One executed operation as recorded by {@link AuditHook}.
 *
 * @param account  the account
 * @param caller   who triggered it
 * @param target   the callee
 * @param value    native value sent
 * @param selector the called selector, empty for plain transfers
 * @param time     completion time
 * @param success  whether the effect succeeded
 */
public record AuditEntry(
    Address account,
    Address caller,
    Address target,
    BigInteger value,
    Optional<Selector> selector,
    Instant time,
    boolean success) {
}
