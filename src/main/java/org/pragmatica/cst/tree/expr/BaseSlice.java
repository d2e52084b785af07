package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.tree.CstNode;

/**
 * One entry between the brackets of a subscript.
 */
public sealed interface BaseSlice extends CstNode permits Index, Slice {}
