package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.op.BooleanOperator;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;

/**
 * {@code x and y} / {@code x or y}.
 */
public record BooleanOperation(Expression left, BooleanOperator operator, Expression right, List<LeftParen> lpar,
                               List<RightParen> rpar) implements Expression {
    public BooleanOperation {
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(BooleanOperation.class, lpar, rpar);
        ValidationException.check(!operator.whitespaceBefore().empty()
                                  || left.safeToUseWithWordOperator(ExpressionPosition.LEFT),
                                  BooleanOperation.class,
                                  "Must have at least one space around boolean operator.");
        ValidationException.check(!operator.whitespaceAfter().empty()
                                  || right.safeToUseWithWordOperator(ExpressionPosition.RIGHT),
                                  BooleanOperation.class,
                                  "Must have at least one space around boolean operator.");
    }

    public BooleanOperation(Expression left, BooleanOperator operator, Expression right) {
        this(left, operator, right, List.of(), List.of());
    }

    @Override
    public BooleanOperation visitChildren(CstVisitor visitor) {
        var lpar = visitor.visitSequence("lpar", this.lpar, LeftParen.class);
        var left = visitor.visitRequired("left", this.left, Expression.class);
        var operator = visitor.visitRequired("operator", this.operator, BooleanOperator.class);
        var right = visitor.visitRequired("right", this.right, Expression.class);
        var rpar = visitor.visitSequence("rpar", this.rpar, RightParen.class);
        return new BooleanOperation(left, operator, right, lpar, rpar);
    }

    @Override
    public void codegen(CodegenState state) {
        try (var ignored = state.parenthesize(lpar, rpar)) {
            left.codegen(state);
            operator.codegen(state);
            right.codegen(state);
        }
    }
}
