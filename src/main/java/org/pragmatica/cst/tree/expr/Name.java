package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;
import java.util.Set;

/**
 * An identifier.
 */
public record Name(String value, List<LeftParen> lpar, List<RightParen> rpar) implements Expression {
    private static final Set<Capability> CAPABILITIES = Set.of(Capability.ATOM,
                                                               Capability.ASSIGN_TARGET,
                                                               Capability.DEL_TARGET);

    public Name {
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(Name.class, lpar, rpar);
        ValidationException.check(!value.isEmpty(), Name.class, "Cannot have empty name identifier.");
        ValidationException.check(isIdentifier(value), Name.class, "Name is not a valid identifier.");
    }

    public Name(String value) {
        this(value, List.of(), List.of());
    }

    @Override
    public Set<Capability> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public Name visitChildren(CstVisitor visitor) {
        return new Name(value,
                        visitor.visitSequence("lpar", lpar, LeftParen.class),
                        visitor.visitSequence("rpar", rpar, RightParen.class));
    }

    @Override
    public void codegen(CodegenState state) {
        try (var ignored = state.parenthesize(lpar, rpar)) {
            state.add(value);
        }
    }

    private static boolean isIdentifier(String value) {
        var first = value.codePointAt(0);
        if (first != '_' && !Character.isUnicodeIdentifierStart(first)) {
            return false;
        }
        return value.codePoints()
                    .skip(1)
                    .allMatch(cp -> Character.isUnicodeIdentifierPart(cp) && !Character.isIdentifierIgnorable(cp));
    }
}
