package org.pragmatica.cst.tree.op;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * Semicolon separating small statements on one line.
 */
public record Semicolon(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements CstNode {
    public Semicolon() {
        this(SimpleWhitespace.EMPTY, SimpleWhitespace.EMPTY);
    }

    @Override
    public Semicolon visitChildren(CstVisitor visitor) {
        return new Semicolon(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                            visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
    }

    @Override
    public void codegen(CodegenState state) {
        whitespaceBefore.codegen(state);
        state.add(";");
        whitespaceAfter.codegen(state);
    }
}
