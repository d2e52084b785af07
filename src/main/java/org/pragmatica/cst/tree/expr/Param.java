package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.CodegenException;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.AnnotationIndicator;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.tree.StarPrefix;
import org.pragmatica.cst.tree.op.AssignEqual;
import org.pragmatica.cst.tree.op.Comma;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.Optional;

/**
 * A single function or lambda parameter, as in {@code x}, {@code x: int = 0} or {@code **kwargs}.
 *
 * @param star inferred from the partition of {@link Parameters} holding this param; omitted means no star
 */
public record Param(Name name,
                    Optional<Annotation> annotation,
                    MaybeSentinel<AssignEqual> equal,
                    Optional<Expression> defaultValue,
                    MaybeSentinel<Comma> comma,
                    MaybeSentinel<StarPrefix> star,
                    SimpleWhitespace whitespaceAfterStar,
                    SimpleWhitespace whitespaceAfterParam) implements StarArg {
    public Param {
        ValidationException.check(defaultValue.isPresent() || !equal.isExplicit(),
                                  Param.class,
                                  "Must have a default when specifying an AssignEqual.");
        ValidationException.check(defaultValue.isEmpty() || !equal.isOmitted(),
                                  Param.class,
                                  "Cannot omit the AssignEqual of a param with a default.");
        annotation.flatMap(value -> value.indicator().explicitValue())
                  .ifPresent(indicator -> ValidationException.check(indicator == AnnotationIndicator.COLON,
                                                                   Param.class,
                                                                   "A param Annotation must be denoted with a ':'."));
    }

    public Param(Name name) {
        this(name,
             Optional.empty(),
             MaybeSentinel.inferred(),
             Optional.empty(),
             MaybeSentinel.inferred(),
             MaybeSentinel.inferred(),
             SimpleWhitespace.EMPTY,
             SimpleWhitespace.EMPTY);
    }

    public Param withDefault(Expression value) {
        return new Param(name, annotation, equal, Optional.of(value), comma, star, whitespaceAfterStar,
                         whitespaceAfterParam);
    }

    public Param withAnnotation(Annotation value) {
        return new Param(name, Optional.of(value), equal, defaultValue, comma, star, whitespaceAfterStar,
                         whitespaceAfterParam);
    }

    public Param withStar(StarPrefix value) {
        return new Param(name, annotation, equal, defaultValue, comma, MaybeSentinel.explicit(value),
                         whitespaceAfterStar, whitespaceAfterParam);
    }

    /**
     * The star this param renders with when it does not depend on context: explicit, or none when omitted.
     */
    public Optional<StarPrefix> concreteStar() {
        return star.isOmitted()
               ? Optional.of(StarPrefix.NONE)
               : star.explicitValue();
    }

    @Override
    public Param visitChildren(CstVisitor visitor) {
        var afterStar = visitor.visitRequired("whitespaceAfterStar", whitespaceAfterStar, SimpleWhitespace.class);
        var name = visitor.visitRequired("name", this.name, Name.class);
        var annotation = visitor.visitOptional("annotation", this.annotation, Annotation.class);
        var equal = visitor.visitSentinel("equal", this.equal, AssignEqual.class);
        var defaultValue = visitor.visitOptional("defaultValue", this.defaultValue, Expression.class);
        var comma = visitor.visitSentinel("comma", this.comma, Comma.class);
        var afterParam = visitor.visitRequired("whitespaceAfterParam", whitespaceAfterParam, SimpleWhitespace.class);
        return new Param(name, annotation, equal, defaultValue, comma, star, afterStar, afterParam);
    }

    /**
     * Render outside a parameter list. Fails if the star is inferred.
     */
    @Override
    public void codegen(CodegenState state) {
        render(state, Optional.empty(), false);
    }

    /**
     * @param defaultStar  star used when this param leaves its own star inferred
     * @param defaultComma whether an inferred comma should be rendered as {@code ", "}
     */
    public void codegen(CodegenState state, StarPrefix defaultStar, boolean defaultComma) {
        render(state, Optional.of(defaultStar), defaultComma);
    }

    private void render(CodegenState state, Optional<StarPrefix> defaultStar, boolean defaultComma) {
        var resolved = concreteStar().or(() -> defaultStar)
                                     .orElseThrow(() -> CodegenException.of(Param.class,
                                                                            "Must specify a concrete default star "
                                                                            + "if the star is inferred."));
        state.add(resolved.token());
        whitespaceAfterStar.codegen(state);
        name.codegen(state);
        annotation.ifPresent(value -> value.codegen(state, AnnotationIndicator.COLON));
        if (equal instanceof MaybeSentinel.Explicit<AssignEqual> explicit) {
            explicit.value().codegen(state);
        } else if (equal.isInferred() && defaultValue.isPresent()) {
            state.add(" = ");
        }
        defaultValue.ifPresent(value -> value.codegen(state));
        if (comma instanceof MaybeSentinel.Explicit<Comma> explicit) {
            explicit.value().codegen(state);
        } else if (comma.isInferred() && defaultComma) {
            state.add(", ");
        }
        whitespaceAfterParam.codegen(state);
    }
}
