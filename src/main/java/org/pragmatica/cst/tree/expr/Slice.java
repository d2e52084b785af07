package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.op.Colon;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.Optional;

/**
 * A range slice such as {@code 1:}, {@code ::2} or {@code a:b:c}. The grammar does not allow parentheses around a
 * slice, so it has none.
 *
 * @param secondColon usually inferred; rendered as {@code :} only when a step is present
 */
public record Slice(Optional<Expression> lower,
                    Optional<Expression> upper,
                    Optional<Expression> step,
                    Colon firstColon,
                    MaybeSentinel<Colon> secondColon) implements BaseSlice {
    public Slice {
        ValidationException.check(step.isEmpty() || !secondColon.isOmitted(),
                                  Slice.class,
                                  "Cannot omit the second colon of a slice with a step.");
    }

    public Slice(Optional<Expression> lower, Optional<Expression> upper) {
        this(lower, upper, Optional.empty(), new Colon(), MaybeSentinel.inferred());
    }

    @Override
    public Slice visitChildren(CstVisitor visitor) {
        var lower = visitor.visitOptional("lower", this.lower, Expression.class);
        var firstColon = visitor.visitRequired("firstColon", this.firstColon, Colon.class);
        var upper = visitor.visitOptional("upper", this.upper, Expression.class);
        var secondColon = visitor.visitSentinel("secondColon", this.secondColon, Colon.class);
        var step = visitor.visitOptional("step", this.step, Expression.class);
        return new Slice(lower, upper, step, firstColon, secondColon);
    }

    @Override
    public void codegen(CodegenState state) {
        lower.ifPresent(value -> value.codegen(state));
        firstColon.codegen(state);
        upper.ifPresent(value -> value.codegen(state));
        if (secondColon instanceof MaybeSentinel.Explicit<Colon> colon) {
            colon.value().codegen(state);
        } else if (secondColon.isInferred() && step.isPresent()) {
            state.add(":");
        }
        step.ifPresent(value -> value.codegen(state));
    }
}
