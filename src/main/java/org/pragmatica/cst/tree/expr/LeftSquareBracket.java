package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * Opening bracket of a subscript.
 */
public record LeftSquareBracket(SimpleWhitespace whitespaceAfter) implements CstNode {
    public LeftSquareBracket() {
        this(SimpleWhitespace.EMPTY);
    }

    @Override
    public LeftSquareBracket visitChildren(CstVisitor visitor) {
        return new LeftSquareBracket(visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
    }

    @Override
    public void codegen(CodegenState state) {
        state.add("[");
        whitespaceAfter.codegen(state);
    }
}
