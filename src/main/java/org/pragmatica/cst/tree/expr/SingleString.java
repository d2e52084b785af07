package org.pragmatica.cst.tree.expr;

/**
 * A single string token, as opposed to an implicit concatenation of several.
 */
public sealed interface SingleString extends BaseString permits SimpleString, FormattedString {
    /**
     * Lower-cased prefix letters before the opening quote.
     */
    String prefix();

    /**
     * True for bytes literals.
     */
    default boolean bytes() {
        return prefix().contains("b");
    }

    static String prefixOf(String token) {
        var prefix = new StringBuilder();
        for (var c : token.toCharArray()) {
            if (c == '"' || c == '\'') {
                break;
            }
            prefix.append(c);
        }
        return prefix.toString()
                     .toLowerCase();
    }
}
