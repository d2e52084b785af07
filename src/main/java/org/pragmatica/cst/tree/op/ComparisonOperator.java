package org.pragmatica.cst.tree.op;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * Comparison operators, including the membership and identity tests.
 */
public sealed interface ComparisonOperator extends CstNode {
    String token();

    SimpleWhitespace whitespaceBefore();

    SimpleWhitespace whitespaceAfter();

    /**
     * True for {@code in}, {@code not in}, {@code is} and {@code is not}.
     */
    default boolean wordOperator() {
        return false;
    }

    @Override
    default void codegen(CodegenState state) {
        whitespaceBefore().codegen(state);
        state.add(token());
        whitespaceAfter().codegen(state);
    }

    /**
     * {@code <}
     */
    record LessThan(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements ComparisonOperator {
        public LessThan() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "<";
        }

        @Override
        public LessThan visitChildren(CstVisitor visitor) {
            return new LessThan(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code >}
     */
    record GreaterThan(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements ComparisonOperator {
        public GreaterThan() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return ">";
        }

        @Override
        public GreaterThan visitChildren(CstVisitor visitor) {
            return new GreaterThan(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                   visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code ==}
     */
    record Equal(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements ComparisonOperator {
        public Equal() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "==";
        }

        @Override
        public Equal visitChildren(CstVisitor visitor) {
            return new Equal(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                             visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code !=}
     */
    record NotEqual(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements ComparisonOperator {
        public NotEqual() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "!=";
        }

        @Override
        public NotEqual visitChildren(CstVisitor visitor) {
            return new NotEqual(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code <=}
     */
    record LessThanEqual(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements ComparisonOperator {
        public LessThanEqual() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "<=";
        }

        @Override
        public LessThanEqual visitChildren(CstVisitor visitor) {
            return new LessThanEqual(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                     visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code >=}
     */
    record GreaterThanEqual(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements ComparisonOperator {
        public GreaterThanEqual() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return ">=";
        }

        @Override
        public GreaterThanEqual visitChildren(CstVisitor visitor) {
            return new GreaterThanEqual(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                        visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code in}
     */
    record In(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements ComparisonOperator {
        public In() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "in";
        }

        @Override
        public boolean wordOperator() {
            return true;
        }

        @Override
        public In visitChildren(CstVisitor visitor) {
            return new In(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                          visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code is}
     */
    record Is(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements ComparisonOperator {
        public Is() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "is";
        }

        @Override
        public boolean wordOperator() {
            return true;
        }

        @Override
        public Is visitChildren(CstVisitor visitor) {
            return new Is(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                          visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code not in}, which owns the whitespace between its two words.
     */
    record NotIn(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceBetween, SimpleWhitespace whitespaceAfter)
    implements ComparisonOperator {
        public NotIn {
            ValidationException.check(!whitespaceBetween.empty(),
                                      NotIn.class,
                                      "Must have at least one space between 'not' and 'in'.");
        }

        public NotIn() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "not in";
        }

        @Override
        public boolean wordOperator() {
            return true;
        }

        @Override
        public NotIn visitChildren(CstVisitor visitor) {
            return new NotIn(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                             visitor.visitRequired("whitespaceBetween", whitespaceBetween, SimpleWhitespace.class),
                             visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }

        @Override
        public void codegen(CodegenState state) {
            whitespaceBefore.codegen(state);
            state.add("not");
            whitespaceBetween.codegen(state);
            state.add("in");
            whitespaceAfter.codegen(state);
        }
    }

    /**
     * {@code is not}, which owns the whitespace between its two words.
     */
    record IsNot(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceBetween, SimpleWhitespace whitespaceAfter)
    implements ComparisonOperator {
        public IsNot {
            ValidationException.check(!whitespaceBetween.empty(),
                                      IsNot.class,
                                      "Must have at least one space between 'is' and 'not'.");
        }

        public IsNot() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "is not";
        }

        @Override
        public boolean wordOperator() {
            return true;
        }

        @Override
        public IsNot visitChildren(CstVisitor visitor) {
            return new IsNot(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                             visitor.visitRequired("whitespaceBetween", whitespaceBetween, SimpleWhitespace.class),
                             visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }

        @Override
        public void codegen(CodegenState state) {
            whitespaceBefore.codegen(state);
            state.add("is");
            whitespaceBetween.codegen(state);
            state.add("not");
            whitespaceAfter.codegen(state);
        }
    }
}
