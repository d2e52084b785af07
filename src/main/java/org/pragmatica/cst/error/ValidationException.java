package org.pragmatica.cst.error;

/**
 * Thrown from a node constructor when its fields break a structural rule. The node is never created.
 */
public final class ValidationException extends CstException {
    public ValidationException(CstError.Validation error) {
        super(error);
    }

    public static ValidationException of(Class<?> nodeType, String reason) {
        return new ValidationException(new CstError.Validation(nodeType.getSimpleName(), reason));
    }

    /**
     * Throw unless the condition holds.
     */
    public static void check(boolean condition, Class<?> nodeType, String reason) {
        if (!condition) {
            throw of(nodeType, reason);
        }
    }
}
