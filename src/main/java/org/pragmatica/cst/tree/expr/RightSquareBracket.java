package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * Closing bracket of a subscript.
 */
public record RightSquareBracket(SimpleWhitespace whitespaceBefore) implements CstNode {
    public RightSquareBracket() {
        this(SimpleWhitespace.EMPTY);
    }

    @Override
    public RightSquareBracket visitChildren(CstVisitor visitor) {
        return new RightSquareBracket(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class));
    }

    @Override
    public void codegen(CodegenState state) {
        whitespaceBefore.codegen(state);
        state.add("]");
    }
}
