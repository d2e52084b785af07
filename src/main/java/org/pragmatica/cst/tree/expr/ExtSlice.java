package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.op.Comma;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * One entry of a multi-dimensional subscript such as {@code x[1:2, 3]}.
 */
public record ExtSlice(BaseSlice slice, MaybeSentinel<Comma> comma) implements CstNode {
    public ExtSlice(BaseSlice slice) {
        this(slice, MaybeSentinel.inferred());
    }

    @Override
    public ExtSlice visitChildren(CstVisitor visitor) {
        var slice = visitor.visitRequired("slice", this.slice, BaseSlice.class);
        var comma = visitor.visitSentinel("comma", this.comma, Comma.class);
        return new ExtSlice(slice, comma);
    }

    /**
     * Render as the last entry: an inferred comma produces nothing.
     */
    @Override
    public void codegen(CodegenState state) {
        codegen(state, false);
    }

    /**
     * @param defaultComma whether an inferred comma should be rendered as {@code ", "}
     */
    public void codegen(CodegenState state, boolean defaultComma) {
        slice.codegen(state);
        if (comma instanceof MaybeSentinel.Explicit<Comma> explicit) {
            explicit.value().codegen(state);
        } else if (comma.isInferred() && defaultComma) {
            state.add(", ");
        }
    }
}
