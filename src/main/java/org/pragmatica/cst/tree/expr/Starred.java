package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;
import java.util.Set;

/**
 * A starred assignment target, as in {@code first, *rest = values}.
 */
public record Starred(Expression expression, SimpleWhitespace whitespaceAfterStar, List<LeftParen> lpar,
                      List<RightParen> rpar) implements Expression {
    public Starred {
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(Starred.class, lpar, rpar);
    }

    public Starred(Expression expression) {
        this(expression, SimpleWhitespace.EMPTY, List.of(), List.of());
    }

    @Override
    public Set<Capability> capabilities() {
        return Set.of(Capability.ASSIGN_TARGET);
    }

    @Override
    public Starred visitChildren(CstVisitor visitor) {
        var lpar = visitor.visitSequence("lpar", this.lpar, LeftParen.class);
        var afterStar = visitor.visitRequired("whitespaceAfterStar", whitespaceAfterStar, SimpleWhitespace.class);
        var expression = visitor.visitRequired("expression", this.expression, Expression.class);
        var rpar = visitor.visitSequence("rpar", this.rpar, RightParen.class);
        return new Starred(expression, afterStar, lpar, rpar);
    }

    @Override
    public void codegen(CodegenState state) {
        try (var ignored = state.parenthesize(lpar, rpar)) {
            state.add("*");
            whitespaceAfterStar.codegen(state);
            expression.codegen(state);
        }
    }
}
