package org.pragmatica.cst.tree.op;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * Operators of an augmented assignment such as {@code x += 1}.
 */
public sealed interface AugOp extends CstNode {
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
     * {@code +=}
     */
    record AddAssign(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements AugOp {
        public AddAssign() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "+=";
        }

        @Override
        public AddAssign visitChildren(CstVisitor visitor) {
            return new AddAssign(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                 visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code -=}
     */
    record SubtractAssign(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements AugOp {
        public SubtractAssign() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "-=";
        }

        @Override
        public SubtractAssign visitChildren(CstVisitor visitor) {
            return new SubtractAssign(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                      visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code *=}
     */
    record MultiplyAssign(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements AugOp {
        public MultiplyAssign() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "*=";
        }

        @Override
        public MultiplyAssign visitChildren(CstVisitor visitor) {
            return new MultiplyAssign(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                      visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code @=}
     */
    record MatrixMultiplyAssign(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements AugOp {
        public MatrixMultiplyAssign() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "@=";
        }

        @Override
        public MatrixMultiplyAssign visitChildren(CstVisitor visitor) {
            return new MatrixMultiplyAssign(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                            visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code /=}
     */
    record DivideAssign(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements AugOp {
        public DivideAssign() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "/=";
        }

        @Override
        public DivideAssign visitChildren(CstVisitor visitor) {
            return new DivideAssign(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                    visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code //=}
     */
    record FloorDivideAssign(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements AugOp {
        public FloorDivideAssign() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "//=";
        }

        @Override
        public FloorDivideAssign visitChildren(CstVisitor visitor) {
            return new FloorDivideAssign(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                         visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code %=}
     */
    record ModuloAssign(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements AugOp {
        public ModuloAssign() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "%=";
        }

        @Override
        public ModuloAssign visitChildren(CstVisitor visitor) {
            return new ModuloAssign(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                    visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code **=}
     */
    record PowerAssign(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements AugOp {
        public PowerAssign() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "**=";
        }

        @Override
        public PowerAssign visitChildren(CstVisitor visitor) {
            return new PowerAssign(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                   visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code <<=}
     */
    record LeftShiftAssign(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements AugOp {
        public LeftShiftAssign() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "<<=";
        }

        @Override
        public LeftShiftAssign visitChildren(CstVisitor visitor) {
            return new LeftShiftAssign(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                       visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code >>=}
     */
    record RightShiftAssign(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements AugOp {
        public RightShiftAssign() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return ">>=";
        }

        @Override
        public RightShiftAssign visitChildren(CstVisitor visitor) {
            return new RightShiftAssign(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                        visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code &=}
     */
    record BitAndAssign(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements AugOp {
        public BitAndAssign() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "&=";
        }

        @Override
        public BitAndAssign visitChildren(CstVisitor visitor) {
            return new BitAndAssign(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                    visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code |=}
     */
    record BitOrAssign(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements AugOp {
        public BitOrAssign() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "|=";
        }

        @Override
        public BitOrAssign visitChildren(CstVisitor visitor) {
            return new BitOrAssign(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                   visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    /**
     * {@code ^=}
     */
    record BitXorAssign(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements AugOp {
        public BitXorAssign() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "^=";
        }

        @Override
        public BitXorAssign visitChildren(CstVisitor visitor) {
            return new BitXorAssign(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                                    visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }
}
