package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.op.Comma;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * A bare {@code *} marking the parameters after it as keyword-only.
 */
public record ParamStar(Comma comma) implements StarArg {
    public ParamStar() {
        this(Comma.withSpace());
    }

    @Override
    public ParamStar visitChildren(CstVisitor visitor) {
        return new ParamStar(visitor.visitRequired("comma", comma, Comma.class));
    }

    @Override
    public void codegen(CodegenState state) {
        state.add("*");
        comma.codegen(state);
    }
}
