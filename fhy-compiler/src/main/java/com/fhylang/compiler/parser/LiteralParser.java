package com.fhylang.compiler.parser;

import java.util.regex.Pattern;

/**
 * Decodes numeric literal tokens.
 *
 * <ul>
 *   <li>integers: decimal, {@code 0b}/{@code 0B}, {@code 0o}/{@code 0O}, {@code 0x}/{@code 0X}</li>
 *   <li>floats: {@code 1.0}, {@code .2}, {@code 1.}, {@code 1e2}, {@code 1.2e-3}</li>
 *   <li>complex: an integer or float mantissa followed by {@code j}/{@code J}</li>
 * </ul>
 *
 * <p>{@code _} digit separators are ignored. Values that do not fit are rejected with a
 * {@link LiteralError}, never truncated.</p>
 */
public final class LiteralParser {

    private static final Pattern DECIMAL_FLOAT =
            Pattern.compile("(?:[0-9]+\\.?[0-9]*|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");

    private LiteralParser() {
    }

    /**
     * Declared kind of a literal token
     */
    public enum LiteralKind {
        INT,
        FLOAT,
        COMPLEX
    }

    /**
     * Decodes {@code text} as the given kind.
     *
     * @return {@link Long} for INT, {@link Double} for FLOAT, and the imaginary part as a
     *         {@link Double} for COMPLEX
     */
    public static Number decode(String text, LiteralKind kind) {
        switch (kind) {
            case INT:     return parseInt(text);
            case FLOAT:   return parseFloat(text);
            case COMPLEX: return parseImaginary(text);
            default:      throw new IllegalArgumentException("Unknown literal kind: " + kind);
        }
    }

    public static long parseInt(String text) {
        String digits = stripUnderscores(text);
        int radix = 10;
        if (digits.length() > 2 && digits.charAt(0) == '0') {
            switch (Character.toLowerCase(digits.charAt(1))) {
                case 'b': radix = 2; break;
                case 'o': radix = 8; break;
                case 'x': radix = 16; break;
                default: break;
            }
            if (radix != 10) {
                digits = digits.substring(2);
            }
        }
        if (digits.isEmpty() || !Character.isLetterOrDigit(digits.charAt(0))) {
            throw new LiteralError("Invalid integer literal: " + text, text);
        }
        try {
            return Long.parseLong(digits, radix);
        } catch (NumberFormatException e) {
            throw new LiteralError(describeIntFailure(digits, radix, text), text, null, e);
        }
    }

    public static double parseFloat(String text) {
        String digits = stripUnderscores(text);
        if (!DECIMAL_FLOAT.matcher(digits).matches() || !containsDigit(digits)) {
            throw new LiteralError("Invalid float literal: " + text, text);
        }
        double value;
        try {
            value = Double.parseDouble(digits);
        } catch (NumberFormatException e) {
            throw new LiteralError("Invalid float literal: " + text, text, null, e);
        }
        if (Double.isInfinite(value)) {
            throw new LiteralError("Float literal out of range: " + text, text);
        }
        return value;
    }

    /** Imaginary part of a complex literal such as {@code 2.5j}. */
    public static double parseImaginary(String text) {
        if (text.length() < 2 || Character.toLowerCase(text.charAt(text.length() - 1)) != 'j') {
            throw new LiteralError("Invalid complex literal: " + text, text);
        }
        String mantissa = text.substring(0, text.length() - 1);
        try {
            return parseFloat(mantissa);
        } catch (LiteralError e) {
            throw new LiteralError("Invalid complex literal: " + text, text, null, e);
        }
    }

    private static String describeIntFailure(String digits, int radix, String text) {
        for (int i = 0; i < digits.length(); i++) {
            if (Character.digit(digits.charAt(i), radix) < 0) {
                return "Invalid digit '" + digits.charAt(i) + "' for base " + radix + " in integer literal: " + text;
            }
        }
        return "Integer literal out of range: " + text;
    }

    private static boolean containsDigit(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isDigit(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static String stripUnderscores(String text) {
        return text.indexOf('_') < 0 ? text : text.replace("_", "");
    }
}
