package org.pragmatica.cst.tree;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * A {@code #} comment running to the end of its line, without the line terminator.
 */
public record Comment(String value) implements CstNode {
    public Comment {
        ValidationException.check(value.startsWith("#"), Comment.class, "A comment must start with '#'.");
        ValidationException.check(value.indexOf('\n') < 0 && value.indexOf('\r') < 0,
                                  Comment.class,
                                  "A comment cannot contain a line break.");
    }

    @Override
    public Comment visitChildren(CstVisitor visitor) {
        return this;
    }

    @Override
    public void codegen(CodegenState state) {
        state.add(value);
    }
}
