package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;

/**
 * {@code await expression}
 */
public record Await(Expression expression, SimpleWhitespace whitespaceAfterAwait, List<LeftParen> lpar,
                    List<RightParen> rpar) implements Expression {
    public Await {
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(Await.class, lpar, rpar);
        ValidationException.check(!whitespaceAfterAwait.empty(),
                                  Await.class,
                                  "Must have at least one space after await");
    }

    public Await(Expression expression) {
        this(expression, SimpleWhitespace.SPACE, List.of(), List.of());
    }

    @Override
    public Await visitChildren(CstVisitor visitor) {
        var lpar = visitor.visitSequence("lpar", this.lpar, LeftParen.class);
        var afterAwait = visitor.visitRequired("whitespaceAfterAwait", whitespaceAfterAwait, SimpleWhitespace.class);
        var expression = visitor.visitRequired("expression", this.expression, Expression.class);
        var rpar = visitor.visitSequence("rpar", this.rpar, RightParen.class);
        return new Await(expression, afterAwait, lpar, rpar);
    }

    @Override
    public void codegen(CodegenState state) {
        try (var ignored = state.parenthesize(lpar, rpar)) {
            state.add("await");
            whitespaceAfterAwait.codegen(state);
            expression.codegen(state);
        }
    }
}
