package org.pragmatica.cst.tree.op;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.CstNode;
import org.pragmatica.cst.tree.SimpleWhitespace;
import org.pragmatica.cst.visitor.CstVisitor;

/**
 * {@code and} / {@code or}. Both are word operators.
 */
public sealed interface BooleanOperator extends CstNode {
    String token();

    SimpleWhitespace whitespaceBefore();

    SimpleWhitespace whitespaceAfter();

    @Override
    default void codegen(CodegenState state) {
        whitespaceBefore().codegen(state);
        state.add(token());
        whitespaceAfter().codegen(state);
    }

    record And(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements BooleanOperator {
        public And() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "and";
        }

        @Override
        public And visitChildren(CstVisitor visitor) {
            return new And(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                           visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }

    record Or(SimpleWhitespace whitespaceBefore, SimpleWhitespace whitespaceAfter) implements BooleanOperator {
        public Or() {
            this(SimpleWhitespace.SPACE, SimpleWhitespace.SPACE);
        }

        @Override
        public String token() {
            return "or";
        }

        @Override
        public Or visitChildren(CstVisitor visitor) {
            return new Or(visitor.visitRequired("whitespaceBefore", whitespaceBefore, SimpleWhitespace.class),
                          visitor.visitRequired("whitespaceAfter", whitespaceAfter, SimpleWhitespace.class));
        }
    }
}
