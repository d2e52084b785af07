package org.pragmatica.cst.visitor;

import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.MaybeSentinel;

import java.util.List;
import java.util.Optional;

/**
 * Callbacks a node uses to rebuild itself from transformed children. A node calls exactly one of these per child
 * field, in source order, passing the field name and the type the field is declared with.
 */
public interface CstVisitor {
    /**
     * Transform a child that must stay present.
     */
    <T extends CstNode> T visitRequired(String field, T child, Class<T> type);

    /**
     * Transform a child that may be absent, or may become absent.
     */
    <T extends CstNode> Optional<T> visitOptional(String field, Optional<T> child, Class<T> type);

    /**
     * Transform a sentinel-valued child. Only {@link MaybeSentinel.Explicit} values carry a node to visit.
     */
    <T extends CstNode> MaybeSentinel<T> visitSentinel(String field, MaybeSentinel<T> child, Class<T> type);

    /**
     * Transform an ordered sequence of children; elements may be dropped.
     */
    <T extends CstNode> List<T> visitSequence(String field, List<T> children, Class<T> type);
}
