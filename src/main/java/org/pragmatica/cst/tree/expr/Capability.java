package org.pragmatica.cst.tree.expr;

/**
 * Syntactic roles an expression node may fill.
 */
public enum Capability {
    /**
     * Identifiers, literals and other atoms of the expression grammar.
     */
    ATOM,
    /**
     * Valid on the left of {@code =}.
     */
    ASSIGN_TARGET,
    /**
     * Valid as the operand of {@code del}.
     */
    DEL_TARGET,
    /**
     * Any string literal, plain, formatted or concatenated.
     */
    STRING
}
