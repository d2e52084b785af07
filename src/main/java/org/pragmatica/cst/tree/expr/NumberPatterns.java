package org.pragmatica.cst.tree.expr;

import java.util.regex.Pattern;

/**
 * Numeric token grammar, underscores between digits included.
 */
final class NumberPatterns {
    private static final String DIGITS = "[0-9](?:_?[0-9])*";
    private static final String HEX = "0[xX](?:_?[0-9a-fA-F])+";
    private static final String BIN = "0[bB](?:_?[01])+";
    private static final String OCT = "0[oO](?:_?[0-7])+";
    private static final String DEC = "(?:0(?:_?0)*|[1-9](?:_?[0-9])*)";
    private static final String EXPONENT = "[eE][-+]?" + DIGITS;
    private static final String POINT_FLOAT = "(?:" + DIGITS + "\\.(?:" + DIGITS + ")?|\\." + DIGITS + ")(?:" + EXPONENT + ")?";
    private static final String EXP_FLOAT = DIGITS + EXPONENT;
    private static final String FLOAT = "(?:" + POINT_FLOAT + "|" + EXP_FLOAT + ")";

    static final Pattern INTEGER = Pattern.compile(HEX + "|" + BIN + "|" + OCT + "|" + DEC);
    static final Pattern FLOATING = Pattern.compile(FLOAT);
    static final Pattern IMAGINARY = Pattern.compile("(?:" + DIGITS + "|" + FLOAT + ")[jJ]");

    private NumberPatterns() {}
}
