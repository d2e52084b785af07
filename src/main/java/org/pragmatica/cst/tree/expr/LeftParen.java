package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * Opening parenthesis. Whitespace before it belongs to the parent.
 */
public record LeftParen(SimpleWhitespace whitespaceAfter) implements CstNode {
    public LeftParen() {
        this(SimpleWhitespace.EMPTY);
    }

    @Override
    public LeftParen visitChildren(CstVisitor visitor) {
        return new LeftParen(visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
    }

    @Override
    public void codegen(CodegenState state) {
        state.add("(");
        whitespaceAfter.codegen(state);
    }
}
