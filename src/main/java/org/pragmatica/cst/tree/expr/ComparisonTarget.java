package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.op.ComparisonOperator;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * One {@code operator comparator} step of a {@link Comparison}.
 */
public record ComparisonTarget(ComparisonOperator operator, Expression comparator) implements CstNode {
    public ComparisonTarget {
        ValidationException.check(!operator.wordOperator()
                                  || !operator.whitespaceAfter().empty()
                                  || comparator.safeToUseWithWordOperator(ExpressionPosition.RIGHT),
                                  ComparisonTarget.class,
                                  "Must have at least one space around comparison operator.");
    }

    @Override
    public ComparisonTarget visitChildren(CstVisitor visitor) {
        var operator = visitor.visitRequired("operator", this.operator, ComparisonOperator.class);
        var comparator = visitor.visitRequired("comparator", this.comparator, Expression.class);
        return new ComparisonTarget(operator, comparator);
    }

    @Override
    public void codegen(CodegenState state) {
        operator.codegen(state);
        comparator.codegen(state);
    }
}
