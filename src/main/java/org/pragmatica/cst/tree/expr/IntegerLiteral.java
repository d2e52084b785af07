package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;

/**
 * Integer token in decimal, hex, octal or binary notation.
 */
public record IntegerLiteral(String value, List<LeftParen> lpar, List<RightParen> rpar) implements NumberLiteral {
    public IntegerLiteral {
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(IntegerLiteral.class, lpar, rpar);
        ValidationException.check(NumberPatterns.INTEGER.matcher(value).matches(),
                                  IntegerLiteral.class,
                                  "Number is not a valid integer.");
    }

    public IntegerLiteral(String value) {
        this(value, List.of(), List.of());
    }

    @Override
    public IntegerLiteral visitChildren(CstVisitor visitor) {
        return new IntegerLiteral(value,
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
