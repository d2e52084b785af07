package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.op.UnaryOperator;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;

/**
 * A prefix operation such as {@code not x} or {@code -x}. Signed numeric literals use {@link Number} instead.
 */
public record UnaryOperation(UnaryOperator operator, Expression expression, List<LeftParen> lpar,
                             List<RightParen> rpar) implements Expression {
    public UnaryOperation {
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(UnaryOperation.class, lpar, rpar);
        ValidationException.check(!operator.wordOperator()
                                  || !operator.whitespaceAfter().empty()
                                  || expression.safeToUseWithWordOperator(ExpressionPosition.RIGHT),
                                  UnaryOperation.class,
                                  "Must have at least one space after not operator.");
    }

    public UnaryOperation(UnaryOperator operator, Expression expression) {
        this(operator, expression, List.of(), List.of());
    }

    @Override
    public UnaryOperation visitChildren(CstVisitor visitor) {
        var lpar = visitor.visitSequence("lpar", this.lpar, LeftParen.class);
        var operator = visitor.visitRequired("operator", this.operator, UnaryOperator.class);
        var expression = visitor.visitRequired("expression", this.expression, Expression.class);
        var rpar = visitor.visitSequence("rpar", this.rpar, RightParen.class);
        return new UnaryOperation(operator, expression, lpar, rpar);
    }

    @Override
    public void codegen(CodegenState state) {
        try (var ignored = state.parenthesize(lpar, rpar)) {
            operator.codegen(state);
            expression.codegen(state);
        }
    }
}
