package org.pragmatica.cst.tree.op;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * Equals sign of a keyword argument, parameter default or assignment.
 */
public record AssignEqual(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements CstNode {
    public AssignEqual() {
        this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
    }

    @Override
    public AssignEqual visitChildren(CstVisitor visitor) {
        return new AssignEqual(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                              visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
    }

    @Override
    public void codegen(CodegenState state) {
        whitespaceBefore.codegen(state);
        state.add("=");
        whitespaceAfter.codegen(state);
    }
}
