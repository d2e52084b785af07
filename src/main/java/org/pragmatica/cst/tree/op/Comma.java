package org.pragmatica.cst.tree.op;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * Comma separating list elements; owns the whitespace on both sides.
 */
public record Comma(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements CstNode {
    public static Comma withSpace() {
        return new Comma(SimpleWhitespace.EMPTY, SimpleWhitespace.SPACE);
    }

    public Comma() {
        this(SimpleWhitespace.EMPTY, SimpleWhitespace.EMPTY);
    }

    @Override
    public Comma visitChildren(CstVisitor visitor) {
        return new Comma(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                        visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
    }

    @Override
    public void codegen(CodegenState state) {
        whitespaceBefore.codegen(state);
        state.add(",");
        whitespaceAfter.codegen(state);
    }
}
