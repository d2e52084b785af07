package org.pragmatica.cst.tree.op;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * Dot of an attribute reference.
 */
public record Dot(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements CstNode {
    public Dot() {
        this(SimpleWhitespace.EMPTY, SimpleWhitespace.EMPTY);
    }

    @Override
    public Dot visitChildren(CstVisitor visitor) {
        return new Dot(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                      visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
    }

    @Override
    public void codegen(CodegenState state) {
        whitespaceBefore.codegen(state);
        state.add(".");
        whitespaceAfter.codegen(state);
    }
}
