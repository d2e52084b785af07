package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A replacement field such as {@code {value!r:>10}}.
 *
 * @param conversion one of {@code s}, {@code r}, {@code a}
 * @param formatSpec present whenever a {@code :} follows, possibly with no content
 */
public record FormattedStringExpression(Expression expression,
                                        Optional<String> conversion,
                                        Optional<List<FormattedStringContent>> formatSpec,
                                        SimpleWhitespace whitespaceBeforeExpression,
                                        SimpleWhitespace whitespaceAfterExpression) implements FormattedStringContent {
    private static final Set<String> CONVERSIONS = Set.of("s", "r", "a");

    public FormattedStringExpression {
        formatSpec = formatSpec.map(List::copyOf);
        conversion.ifPresent(c -> ValidationException.check(CONVERSIONS.contains(c),
                                                           FormattedStringExpression.class,
                                                           "Invalid f-string conversion."));
    }

    public FormattedStringExpression(Expression expression) {
        this(expression, Optional.empty(), Optional.empty(), SimpleWhitespace.EMPTY, SimpleWhitespace.EMPTY);
    }

    @Override
    public FormattedStringExpression visitChildren(CstVisitor visitor) {
        var before = visitor.visitRequired("whitespaceBeforeExpression",
                                           whitespaceBeforeExpression,
                                           SimpleWhitespace.class);
        var expression = visitor.visitRequired("expression", this.expression, Expression.class);
        var after = visitor.visitRequired("whitespaceAfterExpression", whitespaceAfterExpression, SimpleWhitespace.class);
        var formatSpec = this.formatSpec.map(spec -> visitor.visitSequence("formatSpec",
                                                                            spec,
                                                                            FormattedStringContent.class));
        return new FormattedStringExpression(expression, conversion, formatSpec, before, after);
    }

    @Override
    public void codegen(CodegenState state) {
        state.add("{");
        whitespaceBeforeExpression.codegen(state);
        expression.codegen(state);
        whitespaceAfterExpression.codegen(state);
        conversion.ifPresent(c -> {
            state.add("!");
            state.add(c);
        });
        formatSpec.ifPresent(spec -> {
            state.add(":");
            spec.forEach(part -> part.codegen(state));
        });
        state.add("}");
    }
}
