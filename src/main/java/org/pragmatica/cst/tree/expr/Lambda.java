package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.MaybeSentinel;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.tree.op.Colon;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;

/**
 * {@code lambda x, y=1: x + y}
 *
 * @param whitespaceAfterLambda when inferred, one space if there are params and nothing otherwise
 */
public record Lambda(Parameters params,
                     Expression body,
                     Colon colon,
                     MaybeSentinel<SimpleWhitespace> whitespaceAfterLambda,
                     List<LeftParen> lpar,
                     List<RightParen> rpar) implements Expression {
    public Lambda {
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(Lambda.class, lpar, rpar);
        var all = params.allParams();
        if (!all.isEmpty()) {
            for (var param : all) {
                ValidationException.check(param.annotation().isEmpty(),
                                          Lambda.class,
                                          "Lambda params cannot have type annotations.");
            }
            var missingSpace = whitespaceAfterLambda.isOmitted()
                               || whitespaceAfterLambda.explicitValue()
                                                       .filter(SimpleWhitespace::empty)
                                                       .isPresent();
            ValidationException.check(!missingSpace,
                                      Lambda.class,
                                      "Must have at least one space after lambda when specifying params");
        }
    }

    public Lambda(Parameters params, Expression body) {
        this(params,
             body,
             new Colon(SimpleWhitespace.EMPTY, SimpleWhitespace.SPACE),
             MaybeSentinel.inferred(),
             List.of(),
             List.of());
    }

    @Override
    public Lambda visitChildren(CstVisitor visitor) {
        var lpar = visitor.visitSequence("lpar", this.lpar, LeftParen.class);
        var afterLambda = visitor.visitSentinel("whitespaceAfterLambda", whitespaceAfterLambda, SimpleWhitespace.class);
        var params = visitor.visitRequired("params", this.params, Parameters.class);
        var colon = visitor.visitRequired("colon", this.colon, Colon.class);
        var body = visitor.visitRequired("body", this.body, Expression.class);
        var rpar = visitor.visitSequence("rpar", this.rpar, RightParen.class);
        return new Lambda(params, body, colon, afterLambda, lpar, rpar);
    }

    @Override
    public void codegen(CodegenState state) {
        try (var ignored = state.parenthesize(lpar, rpar)) {
            state.add("lambda");
            if (whitespaceAfterLambda instanceof MaybeSentinel.Explicit<SimpleWhitespace> explicit) {
                explicit.value().codegen(state);
            } else if (whitespaceAfterLambda.isInferred() && !params.isEmpty()) {
                state.add(" ");
            }
            params.codegen(state);
            colon.codegen(state);
            body.codegen(state);
        }
    }
}
