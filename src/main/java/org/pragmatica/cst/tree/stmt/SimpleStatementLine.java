package org.pragmatica.cst.tree.stmt;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.TrailingWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;

/**
 * One source line of small statements, as in {@code x = 1; del y  # done}.
 */
public record SimpleStatementLine(List<SmallStatement> body, TrailingWhitespace trailingWhitespace)
implements CstNode {
    public SimpleStatementLine {
        body = List.copyOf(body);
        ValidationException.check(!body.isEmpty(),
                                  SimpleStatementLine.class,
                                  "A SimpleStatementLine must have at least one statement.");
        for (int i = 0; i < body.size() - 1; i++) {
            ValidationException.check(!body.get(i).semicolon().isOmitted(),
                                      SimpleStatementLine.class,
                                      "Cannot omit the semicolon between statements.");
        }
    }

    public SimpleStatementLine(List<SmallStatement> body) {
        this(body, new TrailingWhitespace());
    }

    @Override
    public SimpleStatementLine visitChildren(CstVisitor visitor) {
        var body = visitor.visitSequence("body", this.body, SmallStatement.class);
        var trailing = visitor.visitRequired("trailingWhitespace", trailingWhitespace, TrailingWhitespace.class);
        return new SimpleStatementLine(body, trailing);
    }

    @Override
    public void codegen(CodegenState state) {
        var last = body.size() - 1;
        for (int i = 0; i < body.size(); i++) {
            body.get(i).codegen(state, i != last);
        }
        trailingWhitespace.codegen(state);
    }
}
