package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.tree.CstNode;

/**
 * What a {@link Yield} may produce: a plain expression or a {@code from} clause.
 */
public sealed interface YieldValue extends CstNode permits Expression, From {}
