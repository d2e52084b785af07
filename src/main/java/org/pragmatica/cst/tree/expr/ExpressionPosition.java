package org.pragmatica.cst.tree.expr;

/**
 * Side of a word operator an operand sits on.
 */
public enum ExpressionPosition {
    LEFT,
    RIGHT
}
