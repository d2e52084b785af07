package org.pragmatica.cst.tree.op;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * Prefix operators. Each owns only the whitespace that follows it.
 */
public sealed interface UnaryOperator extends CstNode {
    String token();

    SimpleWhitespace whitespaceAfter();

    /**
     * True for operators spelled as a keyword, which glue to an adjacent identifier without whitespace.
     */
    default boolean wordOperator() {
        return false;
    }

    @Override
    default void codegen(CodegenState state) {
        state.add(token());
        whitespaceAfter().codegen(state);
    }

    private static SimpleWhitespace after(CstVisitor visitor, SimpleWhitespace whitespace) {
        return visitor.visitRequired("whitespaceAfter", whitespace, SimpleWhitespace.class);
    }

    /**
     * {@code +}
     */
    record Plus(SimpleWhitespace whitespaceAfter) implements UnaryOperator {
        public Plus() {
            this(SimpleWhitespace.EMPTY);
        }

        @Override
        public String token() {
            return "+";
        }

        @Override
        public Plus visitChildren(CstVisitor visitor) {
            return new Plus(after(visitor, whitespaceAfter));
        }
    }

    /**
     * {@code -}
     */
    record Minus(SimpleWhitespace whitespaceAfter) implements UnaryOperator {
        public Minus() {
            this(SimpleWhitespace.EMPTY);
        }

        @Override
        public String token() {
            return "-";
        }

        @Override
        public Minus visitChildren(CstVisitor visitor) {
            return new Minus(after(visitor, whitespaceAfter));
        }
    }

    /**
     * {@code ~}
     */
    record BitInvert(SimpleWhitespace whitespaceAfter) implements UnaryOperator {
        public BitInvert() {
            this(SimpleWhitespace.EMPTY);
        }

        @Override
        public String token() {
            return "~";
        }

        @Override
        public BitInvert visitChildren(CstVisitor visitor) {
            return new BitInvert(after(visitor, whitespaceAfter));
        }
    }

    /**
     * {@code not}
     */
    record Not(SimpleWhitespace whitespaceAfter) implements UnaryOperator {
        public Not() {
            this(SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "not";
        }

        @Override
        public boolean wordOperator() {
            return true;
        }

        @Override
        public Not visitChildren(CstVisitor visitor) {
            return new Not(after(visitor, whitespaceAfter));
        }
    }
}
