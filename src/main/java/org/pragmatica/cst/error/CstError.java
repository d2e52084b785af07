package org.pragmatica.cst.error;

/**
 * Structural problem found in a syntax tree, either while building a node or while rendering it.
 */
public sealed interface CstError {
    /**
     * Simple name of the node type that reported the problem.
     */
    String node();

    String reason();

    String message();

    /**
     * A structural invariant was violated while constructing a node.
     */
    record Validation(String node, String reason) implements CstError {
        @Override
        public String message() {
            return node + ": " + reason;
        }
    }

    /**
     * A node was rendered without a context able to resolve one of its sentinel fields.
     */
    record Codegen(String node, String reason) implements CstError {
        @Override
        public String message() {
            return "Cannot render " + node + ": " + reason;
        }
    }
}
