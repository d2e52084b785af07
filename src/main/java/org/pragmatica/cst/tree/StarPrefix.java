package org.pragmatica.cst.tree;

import org.pragmatica.cst.error.ValidationException;

/**
 * Star in front of an argument or parameter: none, {@code *} or {@code **}.
 */
public enum StarPrefix {
    NONE(""),
    STAR("*"),
    DOUBLE_STAR("**");

    private final String token;

    StarPrefix(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static StarPrefix of(String token) {
        for (var prefix : values()) {
            if (prefix.token.equals(token)) {
                return prefix;
            }
        }
        throw ValidationException.of(StarPrefix.class, "Must specify either '', '*' or '**' for star.");
    }
}
