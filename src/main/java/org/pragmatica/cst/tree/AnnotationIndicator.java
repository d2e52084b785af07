package org.pragmatica.cst.tree;

import org.pragmatica.cst.error.ValidationException;

/**
 * Token introducing a type annotation: {@code :} for parameters and variables, {@code ->} for return types.
 */
public enum AnnotationIndicator {
    COLON(":"),
    ARROW("->");

    private final String token;

    AnnotationIndicator(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static AnnotationIndicator of(String token) {
        for (var indicator : values()) {
            if (indicator.token.equals(token)) {
                return indicator;
            }
        }
        throw ValidationException.of(AnnotationIndicator.class, "An Annotation indicator must be one of ':', '->'.");
    }
}
