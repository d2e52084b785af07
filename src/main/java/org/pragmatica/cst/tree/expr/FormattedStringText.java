package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * Literal text inside a formatted string, rendered verbatim.
 */
public record FormattedStringText(String value) implements FormattedStringContent {
    @Override
    public FormattedStringText visitChildren(CstVisitor visitor) {
        return this;
    }

    @Override
    public void codegen(CodegenState state) {
        state.add(value);
    }
}
