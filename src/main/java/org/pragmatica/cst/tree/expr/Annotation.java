package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.CodegenException;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.AnnotationIndicator;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.Optional;

/**
 * A type annotation together with its indicator token.
 *
 * @param indicator                 when inferred, the owner supplies the indicator at render time
 * @param whitespaceBeforeIndicator when inferred, one space before {@code ->} and nothing before {@code :}
 */
public record Annotation(Expression annotation,
                         MaybeSentinel<AnnotationIndicator> indicator,
                         MaybeSentinel<SimpleWhitespace> whitespaceBeforeIndicator,
                         SimpleWhitespace whitespaceAfterIndicator) implements CstNode {
    public Annotation {
        ValidationException.check(!indicator.isOmitted(),
                                  Annotation.class,
                                  "An Annotation indicator must be one of ':', '->'.");
    }

    public Annotation(Expression annotation) {
        this(annotation, MaybeSentinel.inferred(), MaybeSentinel.inferred(), SimpleWhitespace.SPACE);
    }

    public Annotation(Expression annotation, AnnotationIndicator indicator) {
        this(annotation, MaybeSentinel.explicit(indicator), MaybeSentinel.inferred(), SimpleWhitespace.SPACE);
    }

    @Override
    public Annotation visitChildren(CstVisitor visitor) {
        var before = visitor.visitSentinel("whitespaceBeforeIndicator", whitespaceBeforeIndicator, SimpleWhitespace.class);
        var after = visitor.visitRequired("whitespaceAfterIndicator", whitespaceAfterIndicator, SimpleWhitespace.class);
        var annotation = visitor.visitRequired("annotation", this.annotation, Expression.class);
        return new Annotation(annotation, indicator, before, after);
    }

    /**
     * Render standalone. Fails unless the indicator is explicit.
     */
    @Override
    public void codegen(CodegenState state) {
        render(state, Optional.empty());
    }

    /**
     * Render with the indicator used when this annotation leaves its own indicator inferred.
     */
    public void codegen(CodegenState state, AnnotationIndicator defaultIndicator) {
        render(state, Optional.of(defaultIndicator));
    }

    private void render(CodegenState state, Optional<AnnotationIndicator> defaultIndicator) {
        var resolved = indicator.explicitValue()
                                .or(() -> defaultIndicator)
                                .orElseThrow(() -> CodegenException.of(Annotation.class,
                                                                       "Must specify a concrete default indicator "
                                                                       + "if the indicator is inferred."));
        if (whitespaceBeforeIndicator instanceof MaybeSentinel.Explicit<SimpleWhitespace> explicit) {
            explicit.value().codegen(state);
        } else if (whitespaceBeforeIndicator.isInferred() && resolved == AnnotationIndicator.ARROW) {
            state.add(" ");
        }
        state.add(resolved.token());
        whitespaceAfterIndicator.codegen(state);
        annotation.codegen(state);
    }
}
