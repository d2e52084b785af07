package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;
import java.util.Set;

/**
 * An f-string.
 *
 * @param start prefix and opening quotes, such as {@code f"} or {@code rf'''}
 * @param end   closing quotes
 */
public record FormattedString(List<FormattedStringContent> parts,
                              String start,
                              String end,
                              List<LeftParen> lpar,
                              List<RightParen> rpar) implements SingleString {
    private static final Set<String> PREFIXES = Set.of("f", "fr", "rf");
    private static final Set<String> QUOTES = Set.of("\"", "'", "\"\"\"", "'''");

    public FormattedString {
        parts = List.copyOf(parts);
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(FormattedString.class, lpar, rpar);
        var prefix = SingleString.prefixOf(start);
        ValidationException.check(PREFIXES.contains(prefix), FormattedString.class, "Invalid f-string prefix.");
        var startQuote = start.substring(prefix.length());
        ValidationException.check(startQuote.equals(end),
                                  FormattedString.class,
                                  "f-string must have matching enclosing quotes.");
        ValidationException.check(QUOTES.contains(startQuote),
                                  FormattedString.class,
                                  "Invalid f-string enclosing quotes.");
    }

    public FormattedString(List<FormattedStringContent> parts) {
        this(parts, "f\"", "\"", List.of(), List.of());
    }

    @Override
    public String prefix() {
        return SingleString.prefixOf(start);
    }

    @Override
    public FormattedString visitChildren(CstVisitor visitor) {
        var lpar = visitor.visitSequence("lpar", this.lpar, LeftParen.class);
        var parts = visitor.visitSequence("parts", this.parts, FormattedStringContent.class);
        var rpar = visitor.visitSequence("rpar", this.rpar, RightParen.class);
        return new FormattedString(parts, start, end, lpar, rpar);
    }

    @Override
    public void codegen(CodegenState state) {
        try (var ignored = state.parenthesize(lpar, rpar)) {
            state.add(start);
            parts.forEach(part -> part.codegen(state));
            state.add(end);
        }
    }
}
