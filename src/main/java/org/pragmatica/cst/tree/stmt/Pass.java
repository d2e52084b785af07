package org.pragmatica.cst.tree.stmt;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.op.Semicolon;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * {@code pass}
 */
public record Pass(MaybeSentinel<Semicolon> semicolon) implements SmallStatement {
    public Pass() {
        this(MaybeSentinel.inferred());
    }

    @Override
    public Pass visitChildren(CstVisitor visitor) {
        return new Pass(visitor.visitSentinel("semicolon", semicolon, Semicolon.class));
    }

    @Override
    public void codegen(CodegenState state, boolean defaultSemicolon) {
        state.add("pass");
        Semicolons.render(state, semicolon, defaultSemicolon);
    }
}
