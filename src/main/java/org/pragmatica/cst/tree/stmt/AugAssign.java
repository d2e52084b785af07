package org.pragmatica.cst.tree.stmt;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.expr.Expression;
import org.pragmatica.cst.tree.op.AugOp;
import org.pragmatica.cst.tree.op.Semicolon;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * {@code target += value} and the other augmented assignments.
 */
public record AugAssign(Expression target, AugOp operator, Expression value, MaybeSentinel<Semicolon> semicolon)
implements SmallStatement {
    public AugAssign {
        SingleTarget.validate(AugAssign.class, target);
    }

    public AugAssign(Expression target, AugOp operator, Expression value) {
        this(target, operator, value, MaybeSentinel.inferred());
    }

    @Override
    public AugAssign visitChildren(CstVisitor visitor) {
        var target = visitor.visitRequired("target", this.target, Expression.class);
        var operator = visitor.visitRequired("operator", this.operator, AugOp.class);
        var value = visitor.visitRequired("value", this.value, Expression.class);
        var semicolon = visitor.visitSentinel("semicolon", this.semicolon, Semicolon.class);
        return new AugAssign(target, operator, value, semicolon);
    }

    @Override
    public void codegen(CodegenState state, boolean defaultSemicolon) {
        target.codegen(state);
        operator.codegen(state);
        value.codegen(state);
        Semicolons.render(state, semicolon, defaultSemicolon);
    }
}
