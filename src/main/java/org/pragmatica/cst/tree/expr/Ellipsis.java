package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;
import java.util.Set;

/**
 * {@code ...}
 */
public record Ellipsis(List<LeftParen> lpar, List<RightParen> rpar) implements Expression {
    public Ellipsis {
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(Ellipsis.class, lpar, rpar);
    }

    public Ellipsis() {
        this(List.of(), List.of());
    }

    @Override
    public Set<Capability> capabilities() {
        return Set.of(Capability.ATOM);
    }

    @Override
    public Ellipsis visitChildren(CstVisitor visitor) {
        return new Ellipsis(visitor.visitSequence("lpar", lpar, LeftParen.class),
                            visitor.visitSequence("rpar", rpar, RightParen.class));
    }

    @Override
    public void codegen(CodegenState state) {
        try (var ignored = state.parenthesize(lpar, rpar)) {
            state.add("...");
        }
    }
}
