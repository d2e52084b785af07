package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;
import java.util.Set;

/**
 * A string or bytes literal without formatting, kept exactly as written including prefix and quotes.
 */
public record SimpleString(String value, List<LeftParen> lpar, List<RightParen> rpar) implements SingleString {
    private static final Set<String> PREFIXES = Set.of("", "r", "u", "b", "br", "rb");

    public SimpleString {
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(SimpleString.class, lpar, rpar);
        validateQuotes(value);
    }

    public SimpleString(String value) {
        this(value, List.of(), List.of());
    }

    @Override
    public String prefix() {
        return SingleString.prefixOf(value);
    }

    @Override
    public SimpleString visitChildren(CstVisitor visitor) {
        return new SimpleString(value,
                                visitor.visitSequence("lpar", lpar, LeftParen.class),
                                visitor.visitSequence("rpar", rpar, RightParen.class));
    }

    @Override
    public void codegen(CodegenState state) {
        try (var ignored = state.parenthesize(lpar, rpar)) {
            state.add(value);
        }
    }

    // The content between the quotes is not checked.
    private static void validateQuotes(String value) {
        var prefix = SingleString.prefixOf(value);
        ValidationException.check(PREFIXES.contains(prefix), SimpleString.class, "Invalid string prefix.");
        var start = prefix.length();
        ValidationException.check(value.length() >= start + 2,
                                  SimpleString.class,
                                  "String must have enclosing quotes.");
        var quote = value.charAt(start);
        var last = value.length() - 1;
        ValidationException.check((quote == '"' || quote == '\'') && value.charAt(last) == quote,
                                  SimpleString.class,
                                  "String must have matching enclosing quotes.");
        // Two leading quotes in a string this long can only open a triple-quoted string.
        if (value.length() >= start + 6 && value.charAt(start + 1) == quote) {
            ValidationException.check(value.charAt(start + 2) == quote
                                      && value.charAt(last - 1) == quote
                                      && value.charAt(last - 2) == quote,
                                      SimpleString.class,
                                      "String must have matching enclosing quotes.");
        }
    }
}
