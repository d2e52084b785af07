package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * A plain subscript index, as in {@code x[2]}.
 */
public record Index(Expression value) implements BaseSlice {
    @Override
    public Index visitChildren(CstVisitor visitor) {
        return new Index(visitor.visitRequired("value", value, Expression.class));
    }

    @Override
    public void codegen(CodegenState state) {
        value.codegen(state);
    }
}
