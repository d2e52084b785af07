package org.pragmatica.cst.tree.stmt;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.tree.op.Semicolon;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;

/**
 * {@code nonlocal a, b}
 */
public record Nonlocal(List<NameItem> names, SimpleWhitespace whitespaceAfterNonlocal, MaybeSentinel<Semicolon> semicolon)
implements SmallStatement {
    public Nonlocal {
        names = List.copyOf(names);
        NameItem.validate(Nonlocal.class, "nonlocal", names, !whitespaceAfterNonlocal.empty());
    }

    public Nonlocal(List<NameItem> names) {
        this(names, SimpleWhitespace.SPACE, MaybeSentinel.inferred());
    }

    @Override
    public Nonlocal visitChildren(CstVisitor visitor) {
        var after = visitor.visitRequired("whitespaceAfterNonlocal", whitespaceAfterNonlocal, SimpleWhitespace.class);
        var names = visitor.visitSequence("names", this.names, NameItem.class);
        var semicolon = visitor.visitSentinel("semicolon", this.semicolon, Semicolon.class);
        return new Nonlocal(names, after, semicolon);
    }

    @Override
    public void codegen(CodegenState state, boolean defaultSemicolon) {
        state.add("nonlocal");
        whitespaceAfterNonlocal.codegen(state);
        NameItem.render(state, names);
        Semicolons.render(state, semicolon, defaultSemicolon);
    }
}
