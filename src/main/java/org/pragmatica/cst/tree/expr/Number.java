package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.op.UnaryOperator;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A numeric literal with an optional sign, as in {@code -5}. Signs on other operands use {@link UnaryOperation}.
 */
public record Number(NumberLiteral number, Optional<UnaryOperator> operator, List<LeftParen> lpar,
                     List<RightParen> rpar) implements Expression {
    public Number {
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(Number.class, lpar, rpar);
        operator.ifPresent(op -> ValidationException.check(op instanceof UnaryOperator.Plus
                                                           || op instanceof UnaryOperator.Minus,
                                                           Number.class,
                                                           "A Number operator must be '+' or '-'."));
    }

    public Number(NumberLiteral number) {
        this(number, Optional.empty(), List.of(), List.of());
    }

    public static Number integer(String value) {
        return new Number(new IntegerLiteral(value));
    }

    public static Number negative(NumberLiteral number) {
        return new Number(number, Optional.of(new UnaryOperator.Minus()), List.of(), List.of());
    }

    @Override
    public Set<Capability> capabilities() {
        return Set.of(Capability.ATOM);
    }

    /**
     * A number is always safe on the left of a word operator: {@code 5in [1, 5]} tokenizes as {@code 5 in [1, 5]}.
     */
    @Override
    public boolean safeToUseWithWordOperator(ExpressionPosition position) {
        return position == ExpressionPosition.LEFT || parenthesized();
    }

    @Override
    public Number visitChildren(CstVisitor visitor) {
        var lpar = visitor.visitSequence("lpar", this.lpar, LeftParen.class);
        var operator = visitor.visitOptional("operator", this.operator, UnaryOperator.class);
        var number = visitor.visitRequired("number", this.number, NumberLiteral.class);
        var rpar = visitor.visitSequence("rpar", this.rpar, RightParen.class);
        return new Number(number, operator, lpar, rpar);
    }

    @Override
    public void codegen(CodegenState state) {
        try (var ignored = state.parenthesize(lpar, rpar)) {
            operator.ifPresent(op -> op.codegen(state));
            number.codegen(state);
        }
    }
}
