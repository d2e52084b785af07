package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;

/**
 * Imaginary token such as {@code 2j}.
 */
public record ImaginaryLiteral(String value, List<LeftParen> lpar, List<RightParen> rpar) implements NumberLiteral {
    public ImaginaryLiteral {
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(ImaginaryLiteral.class, lpar, rpar);
        ValidationException.check(NumberPatterns.IMAGINARY.matcher(value).matches(),
                                  ImaginaryLiteral.class,
                                  "Number is not a valid imaginary.");
    }

    public ImaginaryLiteral(String value) {
        this(value, List.of(), List.of());
    }

    @Override
    public ImaginaryLiteral visitChildren(CstVisitor visitor) {
        return new ImaginaryLiteral(value,
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
