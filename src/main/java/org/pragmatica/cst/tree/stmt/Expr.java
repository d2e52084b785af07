package org.pragmatica.cst.tree.stmt;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.expr.Expression;
import org.pragmatica.cst.tree.op.Semicolon;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * An expression evaluated for its side effects, such as a bare call.
 */
public record Expr(Expression value, MaybeSentinel<Semicolon> semicolon) implements SmallStatement {
    public Expr(Expression value) {
        this(value, MaybeSentinel.inferred());
    }

    @Override
    public Expr visitChildren(CstVisitor visitor) {
        var value = visitor.visitRequired("value", this.value, Expression.class);
        var semicolon = visitor.visitSentinel("semicolon", this.semicolon, Semicolon.class);
        return new Expr(value, semicolon);
    }

    @Override
    public void codegen(CodegenState state, boolean defaultSemicolon) {
        value.codegen(state);
        Semicolons.render(state, semicolon, defaultSemicolon);
    }
}
