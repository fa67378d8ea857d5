package com.fhylang.utils;

/**
 * Thrown when an ordering would make a {@link PartiallyOrderedSet} cyclic.
 */
public class PosetOrderViolation extends RuntimeException {

    private final Object lower;
    private final Object upper;

    public PosetOrderViolation(String message, Object lower, Object upper) {
        super(message);
        this.lower = lower;
        this.upper = upper;
    }

    /** The element that was asserted to be smaller. */
    public Object getLower() {
        return lower;
    }

    /** The element that was asserted to be greater. */
    public Object getUpper() {
        return upper;
    }
}
