package com.fhylang.compiler.ast;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Unique reference to a named entity.
 *
 * <p>Every instance receives a fresh id from a process-wide counter, so two identifiers
 * are equal only if they are the same declaration occurrence. The name hint is for
 * diagnostics and never takes part in equality.</p>
 */
public final class Identifier {
    private static final AtomicLong NEXT_ID = new AtomicLong();

    private final long id;
    private final String nameHint;

    /**
     * Allocates a new identifier; never equal to any existing one.
     */
    public Identifier(String nameHint) {
        this.nameHint = Objects.requireNonNull(nameHint, "nameHint");
        this.id = NEXT_ID.getAndIncrement();
    }

    /**
     * Process-wide unique id.
     */
    public long getId() {
        return id;
    }

    /**
     * Source spelling; dotted for module paths.
     */
    public String getNameHint() {
        return nameHint;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Identifier)) return false;
        return id == ((Identifier) o).id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return nameHint + "#" + id;
    }
}
