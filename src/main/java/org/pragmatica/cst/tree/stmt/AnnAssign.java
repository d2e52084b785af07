package org.pragmatica.cst.tree.stmt;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.AnnotationIndicator;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.expr.Annotation;
import org.pragmatica.cst.tree.expr.Expression;
import org.pragmatica.cst.tree.op.AssignEqual;
import org.pragmatica.cst.tree.op.Semicolon;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.Optional;

/**
 * An annotated assignment, {@code target: annotation} with an optional {@code = value}.
 *
 * @param equal when inferred, {@code " = "} is rendered if there is a value
 */
public record AnnAssign(Expression target,
                        Annotation annotation,
                        Optional<Expression> value,
                        MaybeSentinel<AssignEqual> equal,
                        MaybeSentinel<Semicolon> semicolon) implements SmallStatement {
    public AnnAssign {
        SingleTarget.validate(AnnAssign.class, target);
        ValidationException.check(value.isPresent() || !equal.isExplicit(),
                                  AnnAssign.class,
                                  "Must have a value when specifying an AssignEqual.");
        ValidationException.check(value.isEmpty() || !equal.isOmitted(),
                                  AnnAssign.class,
                                  "Cannot omit the AssignEqual of an annotated assignment with a value.");
        annotation.indicator()
                  .explicitValue()
                  .ifPresent(indicator -> ValidationException.check(indicator == AnnotationIndicator.COLON,
                                                                   AnnAssign.class,
                                                                   "An AnnAssign Annotation must be denoted "
                                                                   + "with a ':'."));
    }

    public AnnAssign(Expression target, Annotation annotation) {
        this(target, annotation, Optional.empty(), MaybeSentinel.inferred(), MaybeSentinel.inferred());
    }

    public AnnAssign(Expression target, Annotation annotation, Expression value) {
        this(target, annotation, Optional.of(value), MaybeSentinel.inferred(), MaybeSentinel.inferred());
    }

    @Override
    public AnnAssign visitChildren(CstVisitor visitor) {
        var target = visitor.visitRequired("target", this.target, Expression.class);
        var annotation = visitor.visitRequired("annotation", this.annotation, Annotation.class);
        var equal = visitor.visitSentinel("equal", this.equal, AssignEqual.class);
        var value = visitor.visitOptional("value", this.value, Expression.class);
        var semicolon = visitor.visitSentinel("semicolon", this.semicolon, Semicolon.class);
        return new AnnAssign(target, annotation, value, equal, semicolon);
    }

    @Override
    public void codegen(CodegenState state, boolean defaultSemicolon) {
        target.codegen(state);
        annotation.codegen(state, AnnotationIndicator.COLON);
        if (equal instanceof MaybeSentinel.Explicit<AssignEqual> explicit) {
            explicit.value().codegen(state);
        } else if (equal.isInferred() && value.isPresent()) {
            state.add(" = ");
        }
        value.ifPresent(v -> v.codegen(state));
        Semicolons.render(state, semicolon, defaultSemicolon);
    }
}
