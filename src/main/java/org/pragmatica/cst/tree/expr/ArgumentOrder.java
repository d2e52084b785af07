package org.pragmatica.cst.tree.expr;

import org.pragmatica.cst.error.ValidationException;

import java.util.List;

/**
 * States of the left-to-right check over call arguments.
 *
 * <pre>
 * POSITIONAL         -- positional, *  --> POSITIONAL
 * POSITIONAL         -- keyword        --> STARRED_OR_KEYWORD
 * POSITIONAL         -- **             --> KWARGS_OR_KEYWORD
 * STARRED_OR_KEYWORD -- keyword, *     --> STARRED_OR_KEYWORD
 * STARRED_OR_KEYWORD -- **             --> KWARGS_OR_KEYWORD
 * KWARGS_OR_KEYWORD  -- keyword, **    --> KWARGS_OR_KEYWORD
 * </pre>
 * <p>
 * Every other transition is an error.
 */
public enum ArgumentOrder {
    POSITIONAL,
    STARRED_OR_KEYWORD,
    KWARGS_OR_KEYWORD;

    /**
     * @throws ValidationException if an argument of the given kind may not appear in this state
     */
    public ArgumentOrder next(Arg.Kind kind) {
        return switch (this) {
            case POSITIONAL -> switch (kind) {
                case KEYWORD -> STARRED_OR_KEYWORD;
                case KWARGS -> KWARGS_OR_KEYWORD;
                case POSITIONAL, STARRED -> POSITIONAL;
            };
            case STARRED_OR_KEYWORD -> switch (kind) {
                case KWARGS -> KWARGS_OR_KEYWORD;
                case KEYWORD, STARRED -> STARRED_OR_KEYWORD;
                case POSITIONAL -> throw ValidationException.of(Call.class,
                                                                "Cannot have positional argument after keyword "
                                                                + "argument.");
            };
            case KWARGS_OR_KEYWORD -> switch (kind) {
                case KEYWORD, KWARGS -> KWARGS_OR_KEYWORD;
                case STARRED -> throw ValidationException.of(Call.class,
                                                             "Cannot have iterable argument unpacking after "
                                                             + "keyword argument unpacking.");
                case POSITIONAL -> throw ValidationException.of(Call.class,
                                                                "Cannot have positional argument after keyword "
                                                                + "argument unpacking.");
            };
        };
    }

    /**
     * Run the arguments through the state machine; the first violation is reported.
     */
    public static void validate(List<Arg> args) {
        var state = POSITIONAL;
        for (var arg : args) {
            state = state.next(arg.kind());
        }
    }
}
