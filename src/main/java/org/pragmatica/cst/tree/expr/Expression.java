package org.pragmatica.cst.tree.expr;

import java.util.Set;

/**
 * Any expression node. Expressions own their surrounding parentheses.
 */
public sealed interface Expression extends Parenthesized, YieldValue
permits Name, Ellipsis, Number, BaseString, Starred, Comparison, UnaryOperation, BinaryOperation, BooleanOperation,
        Attribute, Subscript, Lambda, Call, Await, IfExp, Yield {

    /**
     * Syntactic roles this node may fill; empty for a general expression.
     */
    default Set<Capability> capabilities() {
        return Set.of();
    }

    default boolean hasCapability(Capability capability) {
        return capabilities().contains(capability);
    }

    /**
     * Whether this node may touch a word operator such as {@code not} or {@code in} on the given side without
     * whitespace in between, without the two tokens running together. True for any parenthesized node, as in
     * {@code not(x)} or {@code (1)in[1,2]}.
     */
    default boolean safeToUseWithWordOperator(ExpressionPosition position) {
        return parenthesized();
    }
}
