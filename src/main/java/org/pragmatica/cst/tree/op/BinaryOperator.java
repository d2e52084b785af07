package org.pragmatica.cst.tree.op;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * Infix arithmetic and bitwise operators.
 */
public sealed interface BinaryOperator extends CstNode {
    String token();

    SimpleWhitespace whitespaceBefore();

    SimpleWhitespace whitespaceAfter();

    @Override
    default void codegen(CodegenState state) {
        whitespaceBefore().codegen(state);
        state.add(token());
        whitespaceAfter().codegen(state);
    }

    /**
     * {@code +}
     */
    record Add(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements BinaryOperator {
        public Add() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "+";
        }

        @Override
        public Add visitChildren(CstVisitor visitor) {
            return new Add(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                           visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code -}
     */
    record Subtract(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements BinaryOperator {
        public Subtract() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "-";
        }

        @Override
        public Subtract visitChildren(CstVisitor visitor) {
            return new Subtract(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code *}
     */
    record Multiply(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements BinaryOperator {
        public Multiply() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "*";
        }

        @Override
        public Multiply visitChildren(CstVisitor visitor) {
            return new Multiply(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code /}
     */
    record Divide(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements BinaryOperator {
        public Divide() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "/";
        }

        @Override
        public Divide visitChildren(CstVisitor visitor) {
            return new Divide(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                              visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code //}
     */
    record FloorDivide(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements BinaryOperator {
        public FloorDivide() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "//";
        }

        @Override
        public FloorDivide visitChildren(CstVisitor visitor) {
            return new FloorDivide(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                   visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code %}
     */
    record Modulo(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements BinaryOperator {
        public Modulo() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "%";
        }

        @Override
        public Modulo visitChildren(CstVisitor visitor) {
            return new Modulo(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                              visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code **}
     */
    record Power(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements BinaryOperator {
        public Power() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "**";
        }

        @Override
        public Power visitChildren(CstVisitor visitor) {
            return new Power(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                             visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code <<}
     */
    record LeftShift(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements BinaryOperator {
        public LeftShift() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "<<";
        }

        @Override
        public LeftShift visitChildren(CstVisitor visitor) {
            return new LeftShift(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                 visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code >>}
     */
    record RightShift(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements BinaryOperator {
        public RightShift() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return ">>";
        }

        @Override
        public RightShift visitChildren(CstVisitor visitor) {
            return new RightShift(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                  visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code |}
     */
    record BitOr(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements BinaryOperator {
        public BitOr() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "|";
        }

        @Override
        public BitOr visitChildren(CstVisitor visitor) {
            return new BitOr(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                             visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code &}
     */
    record BitAnd(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements BinaryOperator {
        public BitAnd() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "&";
        }

        @Override
        public BitAnd visitChildren(CstVisitor visitor) {
            return new BitAnd(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                              visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code ^}
     */
    record BitXor(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements BinaryOperator {
        public BitXor() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "^";
        }

        @Override
        public BitXor visitChildren(CstVisitor visitor) {
            return new BitXor(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                              visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code @}
     */
    record MatrixMultiply(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements BinaryOperator {
        public MatrixMultiply() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "@";
        }

        @Override
        public MatrixMultiply visitChildren(CstVisitor visitor) {
            return new MatrixMultiply(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                      visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }
}
