package com.fhylang.compiler.parser;

import com.fhylang.compiler.ast.SourceLocation;

/**
 * Numeric literal cannot be decoded: overflow or digits invalid for its base.
 */
public class LiteralError extends FhYError {
    private final String literal;

    public LiteralError(String message, String literal) {
        this(message, literal, null, null);
    }

    public LiteralError(String message, String literal, SourceLocation location, Throwable cause) {
        super(message, location, cause);
        this.literal = literal;
    }

    public String getLiteral() {
        return literal;
    }

    /** Same error, positioned at the given span. */
    public LiteralError at(SourceLocation location) {
        return new LiteralError(getRawMessage(), literal, location, getCause());
    }
}
