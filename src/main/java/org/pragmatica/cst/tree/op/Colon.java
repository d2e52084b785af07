package org.pragmatica.cst.tree.op;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * Colon used in slices and lambdas.
 */
public record Colon(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements CstNode {
    public Colon() {
        this(SimpleWhitespace.EMPTY, SimpleWhitespace.EMPTY);
    }

    @Override
    public Colon visitChildren(CstVisitor visitor) {
        return new Colon(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                        visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
    }

    @Override
    public void codegen(CodegenState state) {
        whitespaceBefore.codegen(state);
        state.add(":");
        whitespaceAfter.codegen(state);
    }
}
