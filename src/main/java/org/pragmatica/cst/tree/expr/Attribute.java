package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.op.Dot;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;
import java.util.Set;

/**
 * Attribute access {@code value.attr}. For {@code x.y.z} the outer node has attr {@code z} and an inner
 * {@code Attribute} as its value.
 */
public record Attribute(Expression value, Name attr, Dot dot, List<LeftParen> lpar, List<RightParen> rpar)
implements Expression {
    private static final Set<Capability> CAPABILITIES = Set.of(Capability.ASSIGN_TARGET, Capability.DEL_TARGET);

    public Attribute {
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(Attribute.class, lpar, rpar);
        ValidationException.check(!attr.parenthesized(), Attribute.class, "Cannot parenthesize an attribute name.");
    }

    public Attribute(Expression value, Name attr) {
        this(value, attr, new Dot(), List.of(), List.of());
    }

    @Override
    public Set<Capability> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public Attribute visitChildren(CstVisitor visitor) {
        var lpar = visitor.visitSequence("lpar", this.lpar, LeftParen.class);
        var value = visitor.visitRequired("value", this.value, Expression.class);
        var dot = visitor.visitRequired("dot", this.dot, Dot.class);
        var attr = visitor.visitRequired("attr", this.attr, Name.class);
        var rpar = visitor.visitSequence("rpar", this.rpar, RightParen.class);
        return new Attribute(value, attr, dot, lpar, rpar);
    }

    @Override
    public void codegen(CodegenState state) {
        try (var ignored = state.parenthesize(lpar, rpar)) {
            value.codegen(state);
            dot.codegen(state);
            attr.codegen(state);
        }
    }
}
