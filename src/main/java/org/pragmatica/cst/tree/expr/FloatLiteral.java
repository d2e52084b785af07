package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;

/**
 * Floating point token.
 */
public record FloatLiteral(String value, List<LeftParen> lpar, List<RightParen> rpar) implements NumberLiteral {
    public FloatLiteral {
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(FloatLiteral.class, lpar, rpar);
        ValidationException.check(NumberPatterns.FLOATING.matcher(value).matches(),
                                  FloatLiteral.class,
                                  "Number is not a valid float.");
    }

    public FloatLiteral(String value) {
        this(value, List.of(), List.of());
    }

    @Override
    public FloatLiteral visitChildren(CstVisitor visitor) {
        return new FloatLiteral(value,
                               visitor.visitSequence("lpar", lpar, LeftParen.class),
                               visitor.visitSequence("rpar", rpar, RightParen.class));
    }

    @Override
    public void codegen(CodegenState state) {
        try (var ignored = state.parenthesize(lpar, rpar)) {
            state.add(value);
        }
    }
}
