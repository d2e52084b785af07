package org.pragmatica.cst.tree.expr;

/**
 * Unsigned numeric token wrapped by {@link Number}.
 */
public sealed interface NumberLiteral extends Parenthesized permits IntegerLiteral, FloatLiteral, ImaginaryLiteral {
    String value();
}
