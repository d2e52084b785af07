package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;

/**
 * A call such as {@code f(1, *rest, key=2, **extra)}.
 */
public record Call(Expression func,
                   List<Arg> args,
                   SimpleWhitespace whitespaceAfterFunc,
                   SimpleWhitespace whitespaceBeforeArgs,
                   List<LeftParen> lpar,
                   List<RightParen> rpar) implements Expression {
    public Call {
        args = List.copyOf(args);
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(Call.class, lpar, rpar);
        for (int i = 0; i < args.size() - 1; i++) {
            ValidationException.check(!args.get(i).comma().isOmitted(),
                                      Call.class,
                                      "Cannot omit the comma between arguments.");
        }
        ArgumentOrder.validate(args);
    }

    public Call(Expression func, List<Arg> args) {
        this(func, args, SimpleWhitespace.EMPTY, SimpleWhitespace.EMPTY, List.of(), List.of());
    }

    /**
     * A call always ends with {@code )}, so nothing can glue to it from the right.
     */
    @Override
    public boolean safeToUseWithWordOperator(ExpressionPosition position) {
        return position == ExpressionPosition.LEFT || parenthesized();
    }

    @Override
    public Call visitChildren(CstVisitor visitor) {
        var lpar = visitor.visitSequence("lpar", this.lpar, LeftParen.class);
        var func = visitor.visitRequired("func", this.func, Expression.class);
        var afterFunc = visitor.visitRequired("whitespaceAfterFunc", whitespaceAfterFunc, SimpleWhitespace.class);
        var beforeArgs = visitor.visitRequired("whitespaceBeforeArgs", whitespaceBeforeArgs, SimpleWhitespace.class);
        var args = visitor.visitSequence("args", this.args, Arg.class);
        var rpar = visitor.visitSequence("rpar", this.rpar, RightParen.class);
        return new Call(func, args, afterFunc, beforeArgs, lpar, rpar);
    }

    @Override
    public void codegen(CodegenState state) {
        try (var ignored = state.parenthesize(lpar, rpar)) {
            func.codegen(state);
            whitespaceAfterFunc.codegen(state);
            state.add("(");
            whitespaceBeforeArgs.codegen(state);
            var last = args.size() - 1;
            for (int i = 0; i < args.size(); i++) {
                args.get(i).codegen(state, i != last);
            }
            state.add(")");
        }
    }
}
