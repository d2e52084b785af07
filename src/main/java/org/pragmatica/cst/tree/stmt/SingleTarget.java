package org.pragmatica.cst.tree.stmt;

import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.expr.Capability;
import org.pragmatica.cst.tree.expr.Expression;
import org.pragmatica.cst.tree.expr.Starred;

/**
 * Target check shared by the assignments that take exactly one target and no unpacking.
 */
final class SingleTarget {
    private SingleTarget() {}

    static void validate(Class<?> owner, Expression target) {
        ValidationException.check(target.hasCapability(Capability.ASSIGN_TARGET) && !(target instanceof Starred),
                                  owner,
                                  "Cannot assign to " + target.getClass().getSimpleName() + ".");
    }
}
