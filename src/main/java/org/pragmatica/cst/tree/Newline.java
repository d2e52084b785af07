package org.pragmatica.cst.tree;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.Optional;
import java.util.Set;

/**
 * Line terminator. When no value is given the configured default newline is rendered.
 */
public record Newline(Optional<String> value) implements CstNode {
    private static final Set<String> NEWLINES = Set.of("\n", "\r\n", "\r");

    public Newline {
        value.ifPresent(v -> ValidationException.check(NEWLINES.contains(v),
                                                      Newline.class,
                                                      "Newline must be one of '\\n', '\\r\\n' or '\\r'."));
    }

    public Newline() {
        this(Optional.empty());
    }

    public static Newline of(String value) {
        return new Newline(Optional.of(value));
    }

    @Override
    public Newline visitChildren(CstVisitor visitor) {
        return this;
    }

    @Override
    public void codegen(CodegenState state) {
        state.add(value.orElse(state.config()
                                    .defaultNewline()));
    }
}
