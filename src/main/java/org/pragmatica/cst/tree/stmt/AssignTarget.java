package org.pragmatica.cst.tree.stmt;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.tree.expr.Capability;
import org.pragmatica.cst.tree.expr.Expression;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * One {@code target =} of an assignment; {@code a = b = 1} has two.
 */
public record AssignTarget(Expression target, SimpleWhitespace whitespaceBeforeEqual,
                           SimpleWhitespace whitespaceAfterEqual) implements CstNode {
    public AssignTarget {
        ValidationException.check(target.hasCapability(Capability.ASSIGN_TARGET),
                                  AssignTarget.class,
                                  "Cannot assign to " + target.getClass().getSimpleName() + ".");
    }

    public AssignTarget(Expression target) {
        this(target, SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
    }

    @Override
    public AssignTarget visitChildren(CstVisitor visitor) {
        var target = visitor.visitRequired("target", this.target, Expression.class);
        var before = visitor.visitRequired("whitespaceBeforeEqual", whitespaceBeforeEqual, SimpleWhitespace.class);
        var after = visitor.visitRequired("whitespaceAfterEqual", whitespaceAfterEqual, SimpleWhitespace.class);
        return new AssignTarget(target, before, after);
    }

    @Override
    public void codegen(CodegenState state) {
        target.codegen(state);
        whitespaceBeforeEqual.codegen(state);
        state.add("=");
        whitespaceAfterEqual.codegen(state);
    }
}
