package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;

/**
 * Implicit concatenation of adjacent string literals, as in {@code "a" "b"}. Longer chains nest on the right.
 */
public record ConcatenatedString(SingleString left,
                                 BaseString right,
                                 SimpleWhitespace whitespaceBetween,
                                 List<LeftParen> lpar,
                                 List<RightParen> rpar) implements BaseString {
    public ConcatenatedString {
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(ConcatenatedString.class, lpar, rpar);
        ValidationException.check(!hasParens(left) && !hasParens(right),
                                  ConcatenatedString.class,
                                  "Cannot concatenate parenthesized strings.");
        ValidationException.check(left.bytes() == leftmost(right).bytes(),
                                  ConcatenatedString.class,
                                  "Cannot concatenate string and bytes.");
    }

    public ConcatenatedString(SingleString left, BaseString right) {
        this(left, right, SimpleWhitespace.SPACE, List.of(), List.of());
    }

    @Override
    public ConcatenatedString visitChildren(CstVisitor visitor) {
        var lpar = visitor.visitSequence("lpar", this.lpar, LeftParen.class);
        var left = visitor.visitRequired("left", this.left, SingleString.class);
        var between = visitor.visitRequired("whitespaceBetween", whitespaceBetween, SimpleWhitespace.class);
        var right = visitor.visitRequired("right", this.right, BaseString.class);
        var rpar = visitor.visitSequence("rpar", this.rpar, RightParen.class);
        return new ConcatenatedString(left, right, between, lpar, rpar);
    }

    @Override
    public void codegen(CodegenState state) {
        try (var ignored = state.parenthesize(lpar, rpar)) {
            left.codegen(state);
            whitespaceBetween.codegen(state);
            right.codegen(state);
        }
    }

    private static boolean hasParens(BaseString string) {
        return !string.lpar().isEmpty() || !string.rpar().isEmpty();
    }

    private static SingleString leftmost(BaseString string) {
        if (string instanceof ConcatenatedString concatenated) {
            return concatenated.left();
        }
        return (SingleString) string;
    }
}
