package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.op.BinaryOperator;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;

/**
 * An arithmetic or bitwise infix operation such as {@code x << y}.
 */
public record BinaryOperation(Expression left, BinaryOperator operator, Expression right, List<LeftParen> lpar,
                              List<RightParen> rpar) implements Expression {
    public BinaryOperation {
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(BinaryOperation.class, lpar, rpar);
    }

    public BinaryOperation(Expression left, BinaryOperator operator, Expression right) {
        this(left, operator, right, List.of(), List.of());
    }

    @Override
    public BinaryOperation visitChildren(CstVisitor visitor) {
        var lpar = visitor.visitSequence("lpar", this.lpar, LeftParen.class);
        var left = visitor.visitRequired("left", this.left, Expression.class);
        var operator = visitor.visitRequired("operator", this.operator, BinaryOperator.class);
        var right = visitor.visitRequired("right", this.right, Expression.class);
        var rpar = visitor.visitSequence("rpar", this.rpar, RightParen.class);
        return new BinaryOperation(left, operator, right, lpar, rpar);
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
