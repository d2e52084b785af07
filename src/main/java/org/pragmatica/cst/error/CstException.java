package org.pragmatica.cst.error;

/**
 * Base of the exceptions thrown by tree construction and rendering.
 */
public abstract sealed class CstException extends RuntimeException permits ValidationException, CodegenException {
    private final CstError error;

    protected CstException(CstError error) {
        super(error.message());
        this.error = error;
    }

    public CstError error() {
        return error;
    }

    public String reason() {
        return error.reason();
    }
}
