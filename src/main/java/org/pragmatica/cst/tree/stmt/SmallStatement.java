package org.pragmatica.cst.tree.stmt;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.op.Semicolon;

/**
 * A statement that fits on one line and may share it with others, separated by semicolons.
 */
public sealed interface SmallStatement extends CstNode
permits Pass, Expr, Assign, AnnAssign, AugAssign, Del, Return, Global, Nonlocal {
    /**
     * When inferred, {@code "; "} is rendered if another statement follows on the same line.
     */
    MaybeSentinel<Semicolon> semicolon();

    /**
     * @param defaultSemicolon whether an inferred semicolon should be rendered as {@code "; "}
     */
    void codegen(CodegenState state, boolean defaultSemicolon);

    /**
     * Render as the last statement of its line.
     */
    @Override
    default void codegen(CodegenState state) {
        codegen(state, false);
    }
}
