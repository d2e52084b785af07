package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.error.ValidationException;
import org.pragmatica.cst.visitor.CstVisitor;

import java.util.List;

/**
 * Content of a subscript: one index or slice, or a comma separated sequence of them.
 */
public sealed interface SubscriptSlice {
    SubscriptSlice visit(CstVisitor visitor);

    void codegen(CodegenState state);

    static SubscriptSlice single(BaseSlice slice) {
        return new Single(slice);
    }

    static SubscriptSlice extended(List<ExtSlice> elements) {
        return new Extended(elements);
    }

    record Single(BaseSlice slice) implements SubscriptSlice {
        @Override
        public Single visit(CstVisitor visitor) {
            return new Single(visitor.visitRequired("slice", slice, BaseSlice.class));
        }

        @Override
        public void codegen(CodegenState state) {
            slice.codegen(state);
        }
    }

    record Extended(List<ExtSlice> elements) implements SubscriptSlice {
        public Extended {
            elements = List.copyOf(elements);
            ValidationException.check(!elements.isEmpty(), Subscript.class, "Cannot have empty ExtSlice.");
            for (int i = 0; i < elements.size() - 1; i++) {
                ValidationException.check(!elements.get(i).comma().isOmitted(),
                                          Subscript.class,
                                          "Cannot omit the comma between ExtSlice entries.");
            }
        }

        @Override
        public Extended visit(CstVisitor visitor) {
            return new Extended(visitor.visitSequence("slice", elements, ExtSlice.class));
        }

        @Override
        public void codegen(CodegenState state) {
            var last = elements.size() - 1;
            for (int i = 0; i < elements.size(); i++) {
                elements.get(i).codegen(state, i != last);
            }
        }
    }
}
