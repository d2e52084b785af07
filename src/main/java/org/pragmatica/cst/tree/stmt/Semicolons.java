package org.pragmatica.cst.tree.stmt;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.op.Semicolon;

final class Semicolons {
    private Semicolons() {}

    static void render(CodegenState state, MaybeSentinel<Semicolon> semicolon, boolean defaultSemicolon) {
        if (semicolon instanceof MaybeSentinel.Explicit<Semicolon> explicit) {
            explicit.value().codegen(state);
        } else if (semicolon.isInferred() && defaultSemicolon) {
            state.add("; ");
        }
    }
}
