package com.fhylang.compiler.ast;

/**
 * Source span of a node: file plus start and end positions.
 *
 * <p>Lines and columns are 1-based; the end column points just past the last character.
 * Spans are informational and never take part in node equality.</p>
 */
public final class SourceLocation {
    private final String file;
    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0, 0);

    public SourceLocation(String file, int startLine, int startColumn, int endLine, int endColumn) {
        this.file = file != null ? file.intern() : null;
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    /**
     * File name given to the parser, or {@code <source>}.
     */
    public String getFile() {
        return file;
    }

    /**
     * 1-based line of the first character.
     */
    public int getStartLine() {
        return startLine;
    }

    /**
     * 1-based column of the first character.
     */
    public int getStartColumn() {
        return startColumn;
    }

    /**
     * 1-based line of the last character.
     */
    public int getEndLine() {
        return endLine;
    }

    /**
     * Column just past the last character.
     */
    public int getEndColumn() {
        return endColumn;
    }

    /**
     * Whether this span came from source text.
     */
    public boolean isKnown() {
        return this != UNKNOWN && startLine > 0;
    }

    @Override
    public String toString() {
        return file + ":" + startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
