package org.pragmatica.cst.codegen;

import org.pragmatica.cst.tree.CstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable token sink threaded through a single render call.
 */
public final class CodegenState {
    private final CodegenConfig config;
    private final List<String> tokens;

    private CodegenState(CodegenConfig config) {
        this.config = config;
        this.tokens = new ArrayList<>();
    }

    public static CodegenState create() {
        return new CodegenState(CodegenConfig.DEFAULT);
    }

    public static CodegenState create(CodegenConfig config) {
        return new CodegenState(config);
    }

    public CodegenConfig config() {
        return config;
    }

    public void add(String token) {
        tokens.add(token);
    }

    public int tokenCount() {
        return tokens.size();
    }

    /**
     * Everything rendered so far.
     */
    public String code() {
        return String.join("", tokens);
    }

    /**
     * Emit the opening parentheses now and the closing ones when the returned scope closes.
     *
     * <pre>{@code
     * try (var ignored = state.parenthesize(lpar(), rpar())) {
     *     state.add(value);
     * }
     * }</pre>
     */
    public ParenScope parenthesize(List<? extends CstNode> lpar, List<? extends CstNode> rpar) {
        for (var paren : lpar) {
            paren.codegen(this);
        }
        return new ParenScope(this, rpar);
    }

    /**
     * Closing half of {@link #parenthesize(List, List)}.
     */
    public static final class ParenScope implements AutoCloseable {
        private final CodegenState state;
        private final List<? extends CstNode> rpar;

        private ParenScope(CodegenState state, List<? extends CstNode> rpar) {
            this.state = state;
            this.rpar = rpar;
        }

        @Override
        public void close() {
            for (var paren : rpar) {
                paren.codegen(state);
            }
        }
    }
}
