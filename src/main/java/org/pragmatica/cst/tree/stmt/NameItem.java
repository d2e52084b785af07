package org.pragmatica.cst.tree.stmt;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.expr.Name;
import org.pragmatica.cst.tree.op.Comma;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;

/**
 * A name listed by {@link Global} or {@link Nonlocal}, with its separating comma.
 */
public record NameItem(Name name, MaybeSentinel<Comma> comma) implements CstNode {
    public NameItem {
        ValidationException.check(!name.parenthesized(), NameItem.class, "Cannot have parens around names in NameItem.");
    }

    public NameItem(Name name) {
        this(name, MaybeSentinel.inferred());
    }

    @Override
    public NameItem visitChildren(CstVisitor visitor) {
        var name = visitor.visitRequired("name", this.name, Name.class);
        var comma = visitor.visitSentinel("comma", this.comma, Comma.class);
        return new NameItem(name, comma);
    }

    @Override
    public void codegen(CodegenState state) {
        codegen(state, false);
    }

    /**
     * @param defaultComma whether an inferred comma should be rendered as {@code ", "}
     */
    public void codegen(CodegenState state, boolean defaultComma) {
        name.codegen(state);
        if (comma instanceof MaybeSentinel.Explicit<Comma> explicit) {
            explicit.value().codegen(state);
        } else if (comma.isInferred() && defaultComma) {
            state.add(", ");
        }
    }

    static void validate(Class<?> owner, String keyword, List<NameItem> names, boolean spaceAfterKeyword) {
        var type = owner.getSimpleName();
        ValidationException.check(!names.isEmpty(), owner, "A " + type + " statement must have at least one NameItem.");
        ValidationException.check(spaceAfterKeyword, owner, "Must have at least one space after '" + keyword + "' keyword.");
        for (int i = 0; i < names.size() - 1; i++) {
            ValidationException.check(!names.get(i).comma().isOmitted(),
                                      owner,
                                      "Cannot omit the comma between names in a " + type + ".");
        }
        ValidationException.check(!names.get(names.size() - 1).comma().isExplicit(),
                                  owner,
                                  "The last NameItem in a " + type + " cannot have a trailing comma.");
    }

    static void render(CodegenState state, List<NameItem> names) {
        var last = names.size() - 1;
        for (int i = 0; i < names.size(); i++) {
            names.get(i).codegen(state, i != last);
        }
    }
}
