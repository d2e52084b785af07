package org.pragmatica.cst.tree.stmt;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.expr.Expression;
import org.pragmatica.cst.tree.op.Semicolon;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;

/**
 * {@code a = b = value}
 */
public record Assign(List<AssignTarget> targets, Expression value, MaybeSentinel<Semicolon> semicolon)
implements SmallStatement {
    public Assign {
        targets = List.copyOf(targets);
        ValidationException.check(!targets.isEmpty(), Assign.class, "A Assign must have at least one AssignTarget.");
    }

    public Assign(List<AssignTarget> targets, Expression value) {
        this(targets, value, MaybeSentinel.inferred());
    }

    @Override
    public Assign visitChildren(CstVisitor visitor) {
        var targets = visitor.visitSequence("targets", this.targets, AssignTarget.class);
        var value = visitor.visitRequired("value", this.value, Expression.class);
        var semicolon = visitor.visitSentinel("semicolon", this.semicolon, Semicolon.class);
        return new Assign(targets, value, semicolon);
    }

    @Override
    public void codegen(CodegenState state, boolean defaultSemicolon) {
        targets.forEach(target -> target.codegen(state));
        value.codegen(state);
        Semicolons.render(state, semicolon, defaultSemicolon);
    }
}
