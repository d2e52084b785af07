package org.pragmatica.cst.tree.stmt;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.tree.expr.Expression;
import org.pragmatica.cst.tree.expr.ExpressionPosition;
import org.pragmatica.cst.tree.op.Semicolon;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.Optional;

/**
 * {@code return} with an optional value.
 *
 * @param whitespaceAfterReturn when inferred, one space if there is a value and nothing otherwise
 */
public record Return(Optional<Expression> value,
                     MaybeSentinel<SimpleWhitespace> whitespaceAfterReturn,
                     MaybeSentinel<Semicolon> semicolon) implements SmallStatement {
    public Return {
        var noSpace = whitespaceAfterReturn.isOmitted()
                      || whitespaceAfterReturn.explicitValue()
                                              .filter(SimpleWhitespace::empty)
                                              .isPresent();
        if (noSpace) {
            ValidationException.check(value.map(v -> v.safeToUseWithWordOperator(ExpressionPosition.RIGHT))
                                           .orElse(true),
                                      Return.class,
                                      "Must have at least one space after 'return'.");
        }
    }

    public Return(Optional<Expression> value) {
        this(value, MaybeSentinel.inferred(), MaybeSentinel.inferred());
    }

    @Override
    public Return visitChildren(CstVisitor visitor) {
        var afterReturn = visitor.visitSentinel("whitespaceAfterReturn", whitespaceAfterReturn, SimpleWhitespace.class);
        var value = visitor.visitOptional("value", this.value, Expression.class);
        var semicolon = visitor.visitSentinel("semicolon", this.semicolon, Semicolon.class);
        return new Return(value, afterReturn, semicolon);
    }

    @Override
    public void codegen(CodegenState state, boolean defaultSemicolon) {
        state.add("return");
        if (whitespaceAfterReturn instanceof MaybeSentinel.Explicit<SimpleWhitespace> explicit) {
            explicit.value().codegen(state);
        } else if (whitespaceAfterReturn.isInferred() && value.isPresent()) {
            state.add(" ");
        }
        value.ifPresent(v -> v.codegen(state));
        Semicolons.render(state, semicolon, defaultSemicolon);
    }
}
