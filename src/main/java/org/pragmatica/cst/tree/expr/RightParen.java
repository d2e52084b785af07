package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * Closing parenthesis. Whitespace after it belongs to the parent.
 */
public record RightParen(SimpleWhitespace whitespaceBefore) implements CstNode {
    public RightParen() {
        this(SimpleWhitespace.EMPTY);
    }

    @Override
    public RightParen visitChildren(CstVisitor visitor) {
        return new RightParen(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class));
    }

    @Override
    public void codegen(CodegenState state) {
        whitespaceBefore.codegen(state);
        state.add(")");
    }
}
