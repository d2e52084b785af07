package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;

/**
 * A comparison chain such as {@code a < b <= c} or {@code x not in y}.
 */
public record Comparison(Expression left, List<ComparisonTarget> comparisons, List<LeftParen> lpar,
                         List<RightParen> rpar) implements Expression {
    public Comparison {
        comparisons = List.copyOf(comparisons);
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(Comparison.class, lpar, rpar);
        ValidationException.check(!comparisons.isEmpty(),
                                  Comparison.class,
                                  "Must have at least one ComparisonTarget.");
        // Every word operator in the chain is checked against the operand on its left.
        var operand = left;
        for (var target : comparisons) {
            var operator = target.operator();
            ValidationException.check(!operator.wordOperator()
                                      || !operator.whitespaceBefore().empty()
                                      || operand.safeToUseWithWordOperator(ExpressionPosition.LEFT),
                                      Comparison.class,
                                      "Must have at least one space around comparison operator.");
            operand = target.comparator();
        }
    }

    public Comparison(Expression left, List<ComparisonTarget> comparisons) {
        this(left, comparisons, List.of(), List.of());
    }

    @Override
    public Comparison visitChildren(CstVisitor visitor) {
        var lpar = visitor.visitSequence("lpar", this.lpar, LeftParen.class);
        var left = visitor.visitRequired("left", this.left, Expression.class);
        var comparisons = visitor.visitSequence("comparisons", this.comparisons, ComparisonTarget.class);
        var rpar = visitor.visitSequence("rpar", this.rpar, RightParen.class);
        return new Comparison(left, comparisons, lpar, rpar);
    }

    @Override
    public void codegen(CodegenState state) {
        try (var ignored = state.parenthesize(lpar, rpar)) {
            left.codegen(state);
            comparisons.forEach(target -> target.codegen(state));
        }
    }
}
