package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;

/**
 * Conditional expression {@code body if test else orelse}.
 */
public record IfExp(Expression body,
                    Expression test,
                    Expression orelse,
                    SimpleWhitespace whitespaceBeforeIf,
                    SimpleWhitespace whitespaceAfterIf,
                    SimpleWhitespace whitespaceBeforeElse,
                    SimpleWhitespace whitespaceAfterElse,
                    List<LeftParen> lpar,
                    List<RightParen> rpar) implements Expression {
    public IfExp {
        lpar = List.copyOf(lpar);
        rpar = List.copyOf(rpar);
        Parenthesized.validateParens(IfExp.class, lpar, rpar);
        ValidationException.check(!whitespaceBeforeIf.empty() || body.safeToUseWithWordOperator(ExpressionPosition.LEFT),
                                  IfExp.class,
                                  "Must have at least one space before 'if' keyword.");
        ValidationException.check(!whitespaceAfterIf.empty() || test.safeToUseWithWordOperator(ExpressionPosition.RIGHT),
                                  IfExp.class,
                                  "Must have at least one space after 'if' keyword.");
        ValidationException.check(!whitespaceBeforeElse.empty() || test.safeToUseWithWordOperator(ExpressionPosition.LEFT),
                                  IfExp.class,
                                  "Must have at least one space before 'else' keyword.");
        ValidationException.check(!whitespaceAfterElse.empty()
                                  || orelse.safeToUseWithWordOperator(ExpressionPosition.RIGHT),
                                  IfExp.class,
                                  "Must have at least one space after 'else' keyword.");
    }

    public IfExp(Expression body, Expression test, Expression orelse) {
        this(body,
             test,
             orelse,
             SimpleWhitespace.SPACE,
             SimpleWhitespace.SPACE,
             SimpleWhitespace.SPACE,
             SimpleWhitespace.SPACE,
             List.of(),
             List.of());
    }

    @Override
    public IfExp visitChildren(CstVisitor visitor) {
        var lpar = visitor.visitSequence("lpar", this.lpar, LeftParen.class);
        var body = visitor.visitRequired("body", this.body, Expression.class);
        var beforeIf = visitor.visitRequired("whitespaceBeforeIf", whitespaceBeforeIf, SimpleWhitespace.class);
        var afterIf = visitor.visitRequired("whitespaceAfterIf", whitespaceAfterIf, SimpleWhitespace.class);
        var test = visitor.visitRequired("test", this.test, Expression.class);
        var beforeElse = visitor.visitRequired("whitespaceBeforeElse", whitespaceBeforeElse, SimpleWhitespace.class);
        var afterElse = visitor.visitRequired("whitespaceAfterElse", whitespaceAfterElse, SimpleWhitespace.class);
        var orelse = visitor.visitRequired("orelse", this.orelse, Expression.class);
        var rpar = visitor.visitSequence("rpar", this.rpar, RightParen.class);
        return new IfExp(body, test, orelse, beforeIf, afterIf, beforeElse, afterElse, lpar, rpar);
    }

    @Override
    public void codegen(CodegenState state) {
        try (var ignored = state.parenthesize(lpar, rpar)) {
            body.codegen(state);
            whitespaceBeforeIf.codegen(state);
            state.add("if");
            whitespaceAfterIf.codegen(state);
            test.codegen(state);
            whitespaceBeforeElse.codegen(state);
            state.add("else");
            whitespaceAfterElse.codegen(state);
            orelse.codegen(state);
        }
    }
}
