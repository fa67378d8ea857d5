package com.fhylang.compiler.parser;

import com.fhylang.compiler.ast.SourceLocation;

/**
 * Source does not form a valid FhY program, either because the grammar rejects it or
 * because a construct the grammar accepts lacks a mandatory element.
 */
public class FhYSyntaxError extends FhYError {

    public FhYSyntaxError(String message, SourceLocation location) {
        super(message, location);
    }

    public FhYSyntaxError(String message, SourceLocation location, Throwable cause) {
        super(message, location, cause);
    }
}
