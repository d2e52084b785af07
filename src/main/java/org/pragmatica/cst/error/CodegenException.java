package org.pragmatica.cst.error;

/**
 * Thrown while rendering when a sentinel field has no concrete default in the current context.
 */
public final class CodegenException extends CstException {
    public CodegenException(CstError.Codegen error) {
        super(error);
    }

    public static CodegenException of(Class<?> nodeType, String reason) {
        return new CodegenException(new CstError.Codegen(nodeType.getSimpleName(), reason));
    }
}
