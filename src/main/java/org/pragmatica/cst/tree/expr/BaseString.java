package org.pragmatica.cst.tree.expr;

import java.util.Set;

/**
 * Any string literal expression.
 */
public sealed interface BaseString extends Expression permits SingleString, ConcatenatedString {
    Set<Capability> STRING_CAPABILITIES = Set.of(Capability.ATOM, Capability.STRING);

    @Override
    default Set<Capability> capabilities() {
        return STRING_CAPABILITIES;
    }
}
