package com.fhylang.compiler.parser;

import com.fhylang.compiler.ast.SourceLocation;

/**
 * Base class of front-end errors. Aborts the current conversion; no partial result exists.
 */
public abstract class FhYError extends RuntimeException {
    private final SourceLocation location;

    protected FhYError(String message, SourceLocation location) {
        super(message);
        this.location = location;
    }

    protected FhYError(String message, SourceLocation location, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    /** Offending span, or {@code null} when the error has no source position. */
    public SourceLocation getLocation() {
        return location;
    }

    /** The message without position information. */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (location != null && location.isKnown()) {
            sb.append(" at line ").append(location.getStartLine());
            sb.append(", column ").append(location.getStartColumn());
            if (location.getFile() != null) {
                sb.append(" (").append(location.getFile()).append(')');
            }
        }
        return sb.toString();
    }
}
