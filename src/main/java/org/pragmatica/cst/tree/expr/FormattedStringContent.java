package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.tree.CstNode;

/**
 * A piece of a formatted string: literal text or an embedded expression.
 */
public sealed interface FormattedStringContent extends CstNode permits FormattedStringText, FormattedStringExpression {}
