package org.pragmatica.cst.tree.stmt;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.tree.op.Semicolon;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;

/**
 * {@code global a, b}
 */
public record Global(List<NameItem> names, SimpleWhitespace whitespaceAfterGlobal, MaybeSentinel<Semicolon> semicolon)
implements SmallStatement {
    public Global {
        names = List.copyOf(names);
        NameItem.validate(Global.class, "global", names, !whitespaceAfterGlobal.empty());
    }

    public Global(List<NameItem> names) {
        this(names, SimpleWhitespace.SPACE, MaybeSentinel.inferred());
    }

    @Override
    public Global visitChildren(CstVisitor visitor) {
        var after = visitor.visitRequired("whitespaceAfterGlobal", whitespaceAfterGlobal, SimpleWhitespace.class);
        var names = visitor.visitSequence("names", this.names, NameItem.class);
        var semicolon = visitor.visitSentinel("semicolon", this.semicolon, Semicolon.class);
        return new Global(names, after, semicolon);
    }

    @Override
    public void codegen(CodegenState state, boolean defaultSemicolon) {
        state.add("global");
        whitespaceAfterGlobal.codegen(state);
        NameItem.render(state, names);
        Semicolons.render(state, semicolon, defaultSemicolon);
    }
}
