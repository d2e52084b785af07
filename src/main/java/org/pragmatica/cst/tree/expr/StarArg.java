package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.tree.CstNode;

/**
 * What may sit between the positional and keyword-only parameters: {@code *args} or a bare {@code *}.
 */
public sealed interface StarArg extends CstNode permits Param, ParamStar {}
