package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;
import java.util.Optional;

/**
 * {@code yield}, {@code yield x} or {@code yield from gen()}.
 *
 * @param whitespaceAfterYield when inferred, one space if there is a value and nothing otherwise
 */
public record Yield(Optional<YieldValue> value,
                    MaybeSentinel<SimpleWhitespace> whitespaceAfterYield,
                    List<LeftParen> lpar,
                    List<RightParen> rpar) implements Expression {
    public Yield {
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(Yield.class, lpar, rpar);
        var noSpace = whitespaceAfterYield.isOmitted()
                      || whitespaceAfterYield.explicitValue()
                                             .filter(SimpleWhitespace::empty)
                                             .isPresent();
        if (noSpace) {
            ValidationException.check(value.map(Yield::safeAfterYield).orElse(true),
                                      Yield.class,
                                      "Must have at least one space after 'yield' keyword.");
        }
    }

    public Yield(Optional<YieldValue> value) {
        this(value, MaybeSentinel.inferred(), List.of(), List.of());
    }

    @Override
    public Yield visitChildren(CstVisitor visitor) {
        var lpar = visitor.visitSequence("lpar", this.lpar, LeftParen.class);
        var afterYield = visitor.visitSentinel("whitespaceAfterYield", whitespaceAfterYield, SimpleWhitespace.class);
        var value = visitor.visitOptional("value", this.value, YieldValue.class);
        var rpar = visitor.visitSequence("rpar", this.rpar, RightParen.class);
        return new Yield(value, afterYield, lpar, rpar);
    }

    @Override
    public void codegen(CodegenState state) {
        try (var ignored = state.parenthesize(lpar, rpar)) {
            state.add("yield");
            if (whitespaceAfterYield instanceof MaybeSentinel.Explicit<SimpleWhitespace> explicit) {
                explicit.value().codegen(state);
            } else if (whitespaceAfterYield.isInferred() && value.isPresent()) {
                state.add(" ");
            }
            value.ifPresent(item -> {
                if (item instanceof From from) {
                    from.codegen(state, "");
                } else {
                    item.codegen(state);
                }
            });
        }
    }

    // "yieldfrom" always glues, whatever follows.
    private static boolean safeAfterYield(YieldValue value) {
        if (value instanceof Expression expression) {
            return expression.safeToUseWithWordOperator(ExpressionPosition.RIGHT);
        }
        return false;
    }
}
