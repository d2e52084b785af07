package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.CstNode;

import java.util.List;

/**
 * Node that may be wrapped in redundant parentheses. Both lists are kept in source order: the first left paren is
 * the outermost one, the first right paren is the innermost one.
 */
public interface Parenthesized extends CstNode {
    List<LeftParen> lpar();

    List<RightParen> rpar();

    default boolean parenthesized() {
        return !lpar().isEmpty() && !rpar().isEmpty();
    }

    /**
     * Check that the parentheses around a node of the given type balance.
     */
    static void validateParens(Class<?> nodeType, List<LeftParen> lpar, List<RightParen> rpar) {
        if (!lpar.isEmpty() && rpar.isEmpty()) {
            throw ValidationException.of(nodeType, "Cannot have left paren without right paren.");
        }
        if (lpar.isEmpty() && !rpar.isEmpty()) {
            throw ValidationException.of(nodeType, "Cannot have right paren without left paren.");
        }
        if (lpar.size() != rpar.size()) {
            throw ValidationException.of(nodeType, "Cannot have unbalanced parens.");
        }
    }
}
