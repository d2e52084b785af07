package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.tree.StarPrefix;
import org.pragmatica.cst.tree.op.AssignEqual;
import org.pragmatica.cst.tree.op.Comma;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.Optional;

/**
 * One argument of a {@link Call}: {@code x}, {@code key=x}, {@code *xs} or {@code **kw}.
 */
public record Arg(Expression value,
                  Optional<Name> keyword,
                  MaybeSentinel<AssignEqual> equal,
                  MaybeSentinel<Comma> comma,
                  StarPrefix star,
                  SimpleWhitespace whitespaceAfterStar,
                  SimpleWhitespace whitespaceAfterArg) implements CstNode {
    /**
     * How an argument takes part in argument ordering.
     */
    public enum Kind {
        POSITIONAL,
        KEYWORD,
        /**
         * {@code *iterable}
         */
        STARRED,
        /**
         * {@code **mapping}
         */
        KWARGS
    }

    public Arg {
        ValidationException.check(keyword.isPresent() || !equal.isExplicit(),
                                  Arg.class,
                                  "Must have a keyword when specifying an AssignEqual.");
        ValidationException.check(keyword.isEmpty() || !equal.isOmitted(),
                                  Arg.class,
                                  "Cannot omit the AssignEqual of a keyword argument.");
        ValidationException.check(star == StarPrefix.NONE || keyword.isEmpty(),
                                  Arg.class,
                                  "Cannot specify a star and a keyword together.");
    }

    public Arg(Expression value) {
        this(value,
             Optional.empty(),
             MaybeSentinel.inferred(),
             MaybeSentinel.inferred(),
             StarPrefix.NONE,
             SimpleWhitespace.EMPTY,
             SimpleWhitespace.EMPTY);
    }

    public static Arg keyword(Name keyword, Expression value) {
        return new Arg(value,
                       Optional.of(keyword),
                       MaybeSentinel.inferred(),
                       MaybeSentinel.inferred(),
                       StarPrefix.NONE,
                       SimpleWhitespace.EMPTY,
                       SimpleWhitespace.EMPTY);
    }

    public static Arg starred(StarPrefix star, Expression value) {
        return new Arg(value,
                       Optional.empty(),
                       MaybeSentinel.inferred(),
                       MaybeSentinel.inferred(),
                       star,
                       SimpleWhitespace.EMPTY,
                       SimpleWhitespace.EMPTY);
    }

    public Kind kind() {
        if (keyword.isPresent()) {
            return Kind.KEYWORD;
        }
        return switch (star) {
            case STAR -> Kind.STARRED;
            case DOUBLE_STAR -> Kind.KWARGS;
            case NONE -> Kind.POSITIONAL;
        };
    }

    @Override
    public Arg visitChildren(CstVisitor visitor) {
        var afterStar = visitor.visitRequired("whitespaceAfterStar", whitespaceAfterStar, SimpleWhitespace.class);
        var keyword = visitor.visitOptional("keyword", this.keyword, Name.class);
        var equal = visitor.visitSentinel("equal", this.equal, AssignEqual.class);
        var value = visitor.visitRequired("value", this.value, Expression.class);
        var comma = visitor.visitSentinel("comma", this.comma, Comma.class);
        var afterArg = visitor.visitRequired("whitespaceAfterArg", whitespaceAfterArg, SimpleWhitespace.class);
        return new Arg(value, keyword, equal, comma, star, afterStar, afterArg);
    }

    /**
     * Render as the last argument: an inferred comma produces nothing.
     */
    @Override
    public void codegen(CodegenState state) {
        codegen(state, false);
    }

    /**
     * @param defaultComma whether an inferred comma should be rendered as {@code ", "}
     */
    public void codegen(CodegenState state, boolean defaultComma) {
        state.add(star.token());
        whitespaceAfterStar.codegen(state);
        keyword.ifPresent(name -> name.codegen(state));
        if (equal instanceof MaybeSentinel.Explicit<AssignEqual> explicit) {
            explicit.value().codegen(state);
        } else if (equal.isInferred() && keyword.isPresent()) {
            state.add(" = ");
        }
        value.codegen(state);
        if (comma instanceof MaybeSentinel.Explicit<Comma> explicit) {
            explicit.value().codegen(state);
        } else if (comma.isInferred() && defaultComma) {
            state.add(", ");
        }
        whitespaceAfterArg.codegen(state);
    }
}
