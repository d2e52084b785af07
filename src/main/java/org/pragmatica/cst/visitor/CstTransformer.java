package org.pragmatica.cst.visitor;

import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Depth-first tree rewriter. Subclasses override {@link #onVisit(CstNode)} and {@link #onLeave(CstNode, CstNode)};
 * a transformer that overrides nothing rebuilds an equal tree.
 *
 * <p>The source tree is never modified: every ancestor of a replaced node is rebuilt, unchanged subtrees are
 * shared. Instances hold no state of their own, so one transformer may rewrite several trees concurrently
 * unless a subclass adds state.
 */
public abstract class CstTransformer implements CstVisitor {
    private static final Logger log = LoggerFactory.getLogger(CstTransformer.class);

    /**
     * Called before the children of a node are visited.
     *
     * @return {@code false} to keep the children of this node as they are
     */
    protected boolean onVisit(CstNode node) {
        return true;
    }

    /**
     * Called after the children of a node were visited.
     *
     * @param original the node as found in the source tree
     * @param updated  the node rebuilt from transformed children
     * @return the replacement, or empty to remove the node from its parent
     */
    protected Optional<CstNode> onLeave(CstNode original, CstNode updated) {
        return Optional.of(updated);
    }

    /**
     * Transform a whole tree.
     *
     * @throws ValidationException if the root is removed or a rebuilt node is invalid
     */
    public CstNode transform(CstNode root) {
        return visit(root).orElseThrow(() -> ValidationException.of(root.getClass(), "The root node cannot be removed."));
    }

    /**
     * Transform a tree whose root must keep its type.
     */
    public <T extends CstNode> T transform(T root, Class<T> type) {
        return visitRequired("root", root, type);
    }

    private Optional<CstNode> visit(CstNode node) {
        CstNode updated;
        if (onVisit(node)) {
            updated = node.visitChildren(this);
        } else {
            log.trace("Skipping children of {}", node.getClass().getSimpleName());
            updated = node;
        }
        var result = onLeave(node, updated);
        if (result.isEmpty()) {
            log.trace("Removing {}", node.getClass().getSimpleName());
        }
        return result;
    }

    @Override
    public final <T extends CstNode> T visitRequired(String field, T child, Class<T> type) {
        var result = visit(child).orElseThrow(() -> ValidationException.of(child.getClass(),
                                                                           "Cannot remove required field '"
                                                                           + field + "'."));
        return checked(field, result, type);
    }

    @Override
    public final <T extends CstNode> Optional<T> visitOptional(String field, Optional<T> child, Class<T> type) {
        if (child.isEmpty()) {
            return child;
        }
        return visit(child.get()).map(result -> checked(field, result, type));
    }

    @Override
    public final <T extends CstNode> MaybeSentinel<T> visitSentinel(String field,
                                                                    MaybeSentinel<T> child,
                                                                    Class<T> type) {
        if (!(child instanceof MaybeSentinel.Explicit<T> explicit)) {
            return child;
        }
        return visit(explicit.value()).map(result -> MaybeSentinel.explicit(checked(field, result, type)))
                                      .orElseGet(MaybeSentinel::inferred);
    }

    @Override
    public final <T extends CstNode> List<T> visitSequence(String field, List<T> children, Class<T> type) {
        var result = new ArrayList<T>(children.size());
        for (var child : children) {
            visit(child).ifPresent(node -> result.add(checked(field, node, type)));
        }
        return List.copyOf(result);
    }

    private static <T extends CstNode> T checked(String field, CstNode node, Class<T> type) {
        if (!type.isInstance(node)) {
            throw ValidationException.of(node.getClass(),
                                         "Expected " + type.getSimpleName() + " for field '" + field
                                         + "', got " + node.getClass().getSimpleName() + ".");
        }
        return type.cast(node);
    }
}
