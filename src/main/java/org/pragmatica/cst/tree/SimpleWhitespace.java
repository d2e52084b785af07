package org.pragmatica.cst.tree;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.regex.Pattern;

/**
 * Whitespace between two tokens on one logical line: spaces, tabs, form feeds and backslash line continuations.
 */
public record SimpleWhitespace(String value) implements CstNode {
    private static final Pattern WHITESPACE = Pattern.compile("([ \\f\\t]|\\\\(\\r\\n?|\\n))*");

    public static final SimpleWhitespace EMPTY = new SimpleWhitespace("");
    public static final SimpleWhitespace SPACE = new SimpleWhitespace(" ");

    public SimpleWhitespace {
        ValidationException.check(value != null && WHITESPACE.matcher(value).matches(),
                                  SimpleWhitespace.class,
                                  "Invalid whitespace " + quote(value) + ".");
    }

    public static SimpleWhitespace of(String value) {
        if (value.isEmpty()) {
            return EMPTY;
        }
        return " ".equals(value)
               ? SPACE
               : new SimpleWhitespace(value);
    }

    public boolean empty() {
        return value.isEmpty();
    }

    @Override
    public SimpleWhitespace visitChildren(CstVisitor visitor) {
        return this;
    }

    @Override
    public void codegen(CodegenState state) {
        state.add(value);
    }

    private static String quote(String value) {
        if (value == null) {
            return "null";
        }
        return "'" + value.replace("\n", "\\n")
                          .replace("\r", "\\r") + "'";
    }
}
