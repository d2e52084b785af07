package org.pragmatica.cst.tree.expr;

import org.junit.jupiter.api.Test;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.tree.op.BinaryOperator;
import org.pragmatica.cst.tree.op.BooleanOperator;
import org.pragmatica.cst.tree.op.ComparisonOperator;
import org.pragmatica.cst.tree.op.UnaryOperator;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.cst.tree.SimpleWhitespace.EMPTY;
import static org.pragmatica.cst.tree.SimpleWhitespace.SPACE;

class OperationTest {

    private static Name parenthesized(String value) {
        return new Name(value, List.of(new LeftParen()), List.of(new RightParen()));
    }

    @Test
    void comparison_chain_rendersEveryTarget() {
        var comparison = new Comparison(new Name("a"),
                                        List.of(new ComparisonTarget(new ComparisonOperator.LessThan(), new Name("b")),
                                                new ComparisonTarget(new ComparisonOperator.LessThanEqual(EMPTY, EMPTY),
                                                                     new Name("c"))));

        assertThat(comparison.code()).isEqualTo("a < b<=c");
    }

    @Test
    void comparison_twoWordOperators_renderBetweenWhitespace() {
        var comparison = new Comparison(new Name("a"),
                                        List.of(new ComparisonTarget(new ComparisonOperator.NotIn(), new Name("b")),
                                                new ComparisonTarget(new ComparisonOperator.IsNot(SPACE,
                                                                                                  SimpleWhitespace.of("  "),
                                                                                                  SPACE),
                                                                     new Name("c"))));

        assertThat(comparison.code()).isEqualTo("a not in b is  not c");
    }

    @Test
    void comparison_noTargets_rejected() {
        assertThatThrownBy(() -> new Comparison(new Name("a"), List.of()))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Comparison: Must have at least one ComparisonTarget.");
    }

    @Test
    void comparison_nameGluedToIn_rejected() {
        var target = new ComparisonTarget(new ComparisonOperator.In(EMPTY, EMPTY), parenthesized("xs"));

        assertThatThrownBy(() -> new Comparison(new Name("x"), List.of(target)))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Comparison: Must have at least one space around comparison operator.");
    }

    @Test
    void comparison_numberGluedToIn_accepted() {
        var target = new ComparisonTarget(new ComparisonOperator.In(EMPTY, EMPTY), parenthesized("xs"));

        assertThat(new Comparison(Number.integer("5"), List.of(target)).code()).isEqualTo("5in(xs)");
    }

    @Test
    void comparison_laterWordOperatorGluedToName_rejected() {
        var first = new ComparisonTarget(new ComparisonOperator.LessThan(), new Name("b"));
        var second = new ComparisonTarget(new ComparisonOperator.Is(EMPTY, SPACE), new Name("c"));

        assertThatThrownBy(() -> new Comparison(new Name("a"), List.of(first, second)))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Comparison: Must have at least one space around comparison operator.");
    }

    @Test
    void comparison_inGluedToMiddleOperand_checkedAgainstThatOperand() {
        var first = new ComparisonTarget(new ComparisonOperator.LessThan(), new Name("b"));
        var glued = new ComparisonTarget(new ComparisonOperator.In(EMPTY, SPACE), new Name("c"));

        assertThatThrownBy(() -> new Comparison(new Name("a"), List.of(first, glued)))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Comparison: Must have at least one space around comparison operator.");

        var parenthesizedMiddle = new ComparisonTarget(new ComparisonOperator.LessThan(), parenthesized("b"));
        assertThat(new Comparison(new Name("a"), List.of(parenthesizedMiddle, glued)).code()).isEqualTo("a < (b)in c");
    }

    @Test
    void comparisonTarget_wordOperatorGluedToName_rejected() {
        assertThatThrownBy(() -> new ComparisonTarget(new ComparisonOperator.In(SPACE, EMPTY), new Name("xs")))
            .isInstanceOf(ValidationException.class)
            .hasMessage("ComparisonTarget: Must have at least one space around comparison operator.");
    }

    @Test
    void comparisonTarget_symbolOperator_needsNoSpace() {
        var target = new ComparisonTarget(new ComparisonOperator.Equal(EMPTY, EMPTY), new Name("b"));

        assertThat(new Comparison(new Name("a"), List.of(target)).code()).isEqualTo("a==b");
    }

    @Test
    void notIn_withoutSpaceBetweenWords_rejected() {
        assertThatThrownBy(() -> new ComparisonOperator.NotIn(SPACE, EMPTY, SPACE))
            .isInstanceOf(ValidationException.class)
            .hasMessage("NotIn: Must have at least one space between 'not' and 'in'.");
    }

    @Test
    void unaryOperation_notGluedToName_rejected() {
        assertThatThrownBy(() -> new UnaryOperation(new UnaryOperator.Not(EMPTY), new Name("x")))
            .isInstanceOf(ValidationException.class)
            .hasMessage("UnaryOperation: Must have at least one space after not operator.");
    }

    @Test
    void unaryOperation_notGluedToParens_accepted() {
        assertThat(new UnaryOperation(new UnaryOperator.Not(EMPTY), parenthesized("x")).code()).isEqualTo("not(x)");
        assertThat(new UnaryOperation(new UnaryOperator.Not(), new Name("x")).code()).isEqualTo("not x");
        assertThat(new UnaryOperation(new UnaryOperator.BitInvert(), new Name("x")).code()).isEqualTo("~x");
    }

    @Test
    void binaryOperation_rendersOperatorWhitespace() {
        var operation = new BinaryOperation(new Name("a"),
                                            new BinaryOperator.LeftShift(EMPTY, SPACE),
                                            new BinaryOperation(new Name("b"),
                                                                new BinaryOperator.Power(EMPTY, EMPTY),
                                                                Number.integer("2"),
                                                                List.of(new LeftParen()),
                                                                List.of(new RightParen())));

        assertThat(operation.code()).isEqualTo("a<< (b**2)");
    }

    @Test
    void booleanOperation_gluedOnEitherSide_rejected() {
        assertThatThrownBy(() -> new BooleanOperation(new Name("a"), new BooleanOperator.And(EMPTY, SPACE), new Name("b")))
            .isInstanceOf(ValidationException.class)
            .hasMessage("BooleanOperation: Must have at least one space around boolean operator.");
        assertThatThrownBy(() -> new BooleanOperation(new Name("a"), new BooleanOperator.Or(SPACE, EMPTY), new Name("b")))
            .isInstanceOf(ValidationException.class)
            .hasMessage("BooleanOperation: Must have at least one space around boolean operator.");
    }

    @Test
    void booleanOperation_callGluedOnTheLeft_accepted() {
        var call = new Call(new Name("f"), List.of());
        var operation = new BooleanOperation(call, new BooleanOperator.And(EMPTY, SPACE), new Name("b"));

        assertThat(operation.code()).isEqualTo("f()and b");
    }

    @Test
    void ifExp_rendersKeywordsWithWhitespace() {
        var ifExp = new IfExp(new Name("a"), new Name("cond"), new Name("b"));

        assertThat(ifExp.code()).isEqualTo("a if cond else b");
    }

    @Test
    void ifExp_gluedKeywords_rejectedPerSide() {
        var a = new Name("a");
        var test = new Name("t");
        var b = new Name("b");

        assertThatThrownBy(() -> new IfExp(a, test, b, EMPTY, SPACE, SPACE, SPACE, List.of(), List.of()))
            .hasMessage("IfExp: Must have at least one space before 'if' keyword.");
        assertThatThrownBy(() -> new IfExp(a, test, b, SPACE, EMPTY, SPACE, SPACE, List.of(), List.of()))
            .hasMessage("IfExp: Must have at least one space after 'if' keyword.");
        assertThatThrownBy(() -> new IfExp(a, test, b, SPACE, SPACE, EMPTY, SPACE, List.of(), List.of()))
            .hasMessage("IfExp: Must have at least one space before 'else' keyword.");
        assertThatThrownBy(() -> new IfExp(a, test, b, SPACE, SPACE, SPACE, EMPTY, List.of(), List.of()))
            .hasMessage("IfExp: Must have at least one space after 'else' keyword.");
    }

    @Test
    void ifExp_parenthesizedOperands_mayGlue() {
        var ifExp = new IfExp(parenthesized("a"),
                              parenthesized("t"),
                              parenthesized("b"),
                              EMPTY,
                              EMPTY,
                              EMPTY,
                              EMPTY,
                              List.of(),
                              List.of());

        assertThat(ifExp.code()).isEqualTo("(a)if(t)else(b)");
    }

    @Test
    void attribute_rendersDottedAccess() {
        var attribute = new Attribute(new Attribute(new Name("a"), new Name("b")), new Name("c"));

        assertThat(attribute.code()).isEqualTo("a.b.c");
        assertThat(attribute.capabilities()).contains(Capability.ASSIGN_TARGET, Capability.DEL_TARGET);
    }

    @Test
    void attribute_parenthesizedName_rejected() {
        assertThatThrownBy(() -> new Attribute(new Name("a"), parenthesized("b")))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Attribute: Cannot parenthesize an attribute name.");
    }

    @Test
    void starred_rendersStarAndWhitespace() {
        var starred = new Starred(new Name("rest"), SPACE, List.of(), List.of());

        assertThat(starred.code()).isEqualTo("* rest");
        assertThat(starred.capabilities()).containsExactly(Capability.ASSIGN_TARGET);
    }
}
