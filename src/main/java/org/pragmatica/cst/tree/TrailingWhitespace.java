package org.pragmatica.cst.tree;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.Optional;

/**
 * Whitespace, optional comment and newline that terminate a line.
 */
public record TrailingWhitespace(SimpleWhitespace whitespace, Optional<Comment> comment, Newline newline)
implements CstNode {
    public TrailingWhitespace() {
        this(SimpleWhitespace.EMPTY, Optional.empty(), new Newline());
    }

    public static TrailingWhitespace withComment(SimpleWhitespace whitespace, Comment comment) {
        return new TrailingWhitespace(whitespace, Optional.of(comment), new Newline());
    }

    @Override
    public TrailingWhitespace visitChildren(CstVisitor visitor) {
        return new TrailingWhitespace(visitor.visitRequired("whitespace", whitespace, SimpleWhitespace.class),
                                      visitor.visitOptional("comment", comment, Comment.class),
                                      visitor.visitRequired("newline", newline, Newline.class));
    }

    @Override
    public void codegen(CodegenState state) {
        whitespace.codegen(state);
        comment.ifPresent(c -> c.codegen(state));
        newline.codegen(state);
    }
}
