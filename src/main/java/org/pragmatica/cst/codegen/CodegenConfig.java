package org.pragmatica.cst.codegen;

import org.pragmatica.cst.error.ValidationException;

import java.util.Set;

/**
 * Rendering options.
 *
 * @param defaultNewline line terminator used where a node leaves its newline undecided
 */
public record CodegenConfig(String defaultNewline) {
    private static final Set<String> NEWLINES = Set.of("\n", "\r\n", "\r");

    public static final CodegenConfig DEFAULT = new CodegenConfig("\n");

    public CodegenConfig {
        ValidationException.check(NEWLINES.contains(defaultNewline),
                                  CodegenConfig.class,
                                  "Default newline must be one of '\\n', '\\r\\n' or '\\r'.");
    }
}
