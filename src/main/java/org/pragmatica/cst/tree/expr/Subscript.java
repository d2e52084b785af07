package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;
import java.util.Set;

/**
 * A subscript reference such as {@code x[2]}, {@code x[1:]} or {@code x[1:2, 3]}.
 */
public record Subscript(Expression value,
                        SubscriptSlice slice,
                        LeftSquareBracket lbracket,
                        RightSquareBracket rbracket,
                        SimpleWhitespace whitespaceAfterValue,
                        List<LeftParen> lpar,
                        List<RightParen> rpar) implements Expression {
    private static final Set<Capability> CAPABILITIES = Set.of(Capability.ASSIGN_TARGET, Capability.DEL_TARGET);

    public Subscript {
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(Subscript.class, lpar, rpar);
    }

    public Subscript(Expression value, SubscriptSlice slice) {
        this(value,
             slice,
             new LeftSquareBracket(),
             new RightSquareBracket(),
             SimpleWhitespace.EMPTY,
             List.of(),
             List.of());
    }

    public Subscript(Expression value, BaseSlice slice) {
        this(value, SubscriptSlice.single(slice));
    }

    @Override
    public Set<Capability> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public Subscript visitChildren(CstVisitor visitor) {
        var lpar = visitor.visitSequence("lpar", this.lpar, LeftParen.class);
        var value = visitor.visitRequired("value", this.value, Expression.class);
        var afterValue = visitor.visitRequired("whitespaceAfterValue", whitespaceAfterValue, SimpleWhitespace.class);
        var lbracket = visitor.visitRequired("lbracket", this.lbracket, LeftSquareBracket.class);
        var slice = this.slice.visit(visitor);
        var rbracket = visitor.visitRequired("rbracket", this.rbracket, RightSquareBracket.class);
        var rpar = visitor.visitSequence("rpar", this.rpar, RightParen.class);
        return new Subscript(value, slice, lbracket, rbracket, afterValue, lpar, rpar);
    }

    @Override
    public void codegen(CodegenState state) {
        try (var ignored = state.parenthesize(lpar, rpar)) {
            value.codegen(state);
            whitespaceAfterValue.codegen(state);
            lbracket.codegen(state);
            slice.codegen(state);
            rbracket.codegen(state);
        }
    }
}
