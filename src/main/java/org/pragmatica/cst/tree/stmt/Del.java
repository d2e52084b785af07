package org.pragmatica.cst.tree.stmt;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.tree.expr.Capability;
import org.pragmatica.cst.tree.expr.Expression;
import org.pragmatica.cst.tree.expr.ExpressionPosition;
import org.pragmatica.cst.tree.op.Semicolon;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * {@code del target}
 */
public record Del(Expression target, SimpleWhitespace whitespaceAfterDel, MaybeSentinel<Semicolon> semicolon)
implements SmallStatement {
    public Del {
        ValidationException.check(target.hasCapability(Capability.DEL_TARGET),
                                  Del.class,
                                  "Cannot delete " + target.getClass().getSimpleName() + ".");
        ValidationException.check(!whitespaceAfterDel.empty()
                                  || target.safeToUseWithWordOperator(ExpressionPosition.RIGHT),
                                  Del.class,
                                  "Must have at least one space after 'del'.");
    }

    public Del(Expression target) {
        this(target, SimpleWhitespace.SPACE, MaybeSentinel.inferred());
    }

    @Override
    public Del visitChildren(CstVisitor visitor) {
        var afterDel = visitor.visitRequired("whitespaceAfterDel", whitespaceAfterDel, SimpleWhitespace.class);
        var target = visitor.visitRequired("target", this.target, Expression.class);
        var semicolon = visitor.visitSentinel("semicolon", this.semicolon, Semicolon.class);
        return new Del(target, afterDel, semicolon);
    }

    @Override
    public void codegen(CodegenState state, boolean defaultSemicolon) {
        state.add("del");
        whitespaceAfterDel.codegen(state);
        target.codegen(state);
        Semicolons.render(state, semicolon, defaultSemicolon);
    }
}
