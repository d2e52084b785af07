package org.pragmatica.cst.tree;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * Concrete Syntax Tree node - an immutable value that keeps every piece of source text it was built from.
 *
 * <p>Implementations validate their fields in the canonical constructor, so an instance that exists is
 * structurally valid. Nodes never reference their parents.
 */
public interface CstNode {
    /**
     * Build a node of the same type whose children have been passed through the visitor in source order.
     * Scalar fields are copied unchanged. The result is validated like any freshly constructed node.
     */
    CstNode visitChildren(CstVisitor visitor);

    /**
     * Append the exact text of this node, including the whitespace and punctuation it owns.
     */
    void codegen(CodegenState state);

    /**
     * Render this node with the default configuration.
     */
    default String code() {
        var state = CodegenState.create();
        codegen(state);
        return state.code();
    }
}
