package org.pragmatica.cst;

import org.pragmatica.cst.codegen.CodegenConfig;
import org.pragmatica.cst.codegen.CodegenState;
import org.pragmatica.cst.tree.CstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for turning syntax trees back into source text.
 *
 * <p>Example usage:
 * <pre>{@code
 * var call = new Call(new Name("print"), List.of(new Arg(new Name("x"))));
 *
 * CstCodegen.code(call);                                          // print(x)
 * CstCodegen.builder().newline("\r\n").build().render(line);      // CRLF line endings
 * }</pre>
 */
public final class CstCodegen {
    private static final Logger log = LoggerFactory.getLogger(CstCodegen.class);

    private final CodegenConfig config;

    private CstCodegen(CodegenConfig config) {
        this.config = config;
    }

    /**
     * Render a tree with the default configuration.
     */
    public static String code(CstNode node) {
        return code(node, CodegenConfig.DEFAULT);
    }

    /**
     * Render a tree with custom configuration.
     *
     * @throws org.pragmatica.cst.error.CodegenException if a node cannot resolve one of its inferred fields
     */
    public static String code(CstNode node, CodegenConfig config) {
        var state = CodegenState.create(config);
        node.codegen(state);
        var code = state.code();
        log.debug("Rendered {} into {} characters from {} tokens",
                  node.getClass().getSimpleName(),
                  code.length(),
                  state.tokenCount());
        return code;
    }

    public static CstCodegen create(CodegenConfig config) {
        return new CstCodegen(config);
    }

    /**
     * Create a builder for rendering options.
     */
    public static Builder builder() {
        return new Builder();
    }

    public CodegenConfig config() {
        return config;
    }

    public String render(CstNode node) {
        return code(node, config);
    }

    public static final class Builder {
        private String newline = CodegenConfig.DEFAULT.defaultNewline();

        private Builder() {}

        public Builder newline(String newline) {
            this.newline = newline;
            return this;
        }

        public CstCodegen build() {
            return new CstCodegen(new CodegenConfig(newline));
        }
    }
}
