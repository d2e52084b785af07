package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * The {@code from item} part of {@code yield from item}.
 *
 * @param whitespaceBeforeFrom when inferred, the owner decides what precedes {@code from}
 */
public record From(Expression item, MaybeSentinel<SimpleWhitespace> whitespaceBeforeFrom,
                   SimpleWhitespace whitespaceAfterFrom) implements YieldValue {
    public From {
        ValidationException.check(!whitespaceAfterFrom.empty() || item.safeToUseWithWordOperator(ExpressionPosition.RIGHT),
                                  From.class,
                                  "Must have at least one space after 'from' keyword.");
    }

    public From(Expression item) {
        this(item, MaybeSentinel.inferred(), SimpleWhitespace.SPACE);
    }

    @Override
    public From visitChildren(CstVisitor visitor) {
        var beforeFrom = visitor.visitSentinel("whitespaceBeforeFrom", whitespaceBeforeFrom, SimpleWhitespace.class);
        var item = visitor.visitRequired("item", this.item, Expression.class);
        var afterFrom = visitor.visitRequired("whitespaceAfterFrom", whitespaceAfterFrom, SimpleWhitespace.class);
        return new From(item, beforeFrom, afterFrom);
    }

    @Override
    public void codegen(CodegenState state) {
        codegen(state, "");
    }

    /**
     * @param defaultSpace rendered before {@code from} when that whitespace is inferred
     */
    public void codegen(CodegenState state, String defaultSpace) {
        if (whitespaceBeforeFrom instanceof MaybeSentinel.Explicit<SimpleWhitespace> explicit) {
            explicit.value().codegen(state);
        } else if (whitespaceBeforeFrom.isInferred()) {
            state.add(defaultSpace);
        }
        state.add("from");
        whitespaceAfterFrom.codegen(state);
        item.codegen(state);
    }
}
