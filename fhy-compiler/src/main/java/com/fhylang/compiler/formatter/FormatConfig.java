package com.fhylang.compiler.formatter;

/**
 * Layout options for {@link AstPrinter}.
 */
public class FormatConfig {
    private int indentSize = 4;
    private boolean useSpaces = true;
    private boolean separateFunctions = true;
    private boolean collapseEmptyBodies = true;

    public FormatConfig() {
    }

    public FormatConfig(int indentSize, boolean useSpaces) {
        setIndentSize(indentSize);
        this.useSpaces = useSpaces;
    }

    public int getIndentSize() {
        return indentSize;
    }

    /**
     * Spaces per body level; ignored when indenting with tabs.
     */
    public void setIndentSize(int indentSize) {
        if (indentSize < 0) {
            throw new IllegalArgumentException("indentSize must not be negative: " + indentSize);
        }
        this.indentSize = indentSize;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    /**
     * Whether top-level {@code proc}/{@code op} declarations are set off by an empty line.
     */
    public boolean isSeparateFunctions() {
        return separateFunctions;
    }

    public void setSeparateFunctions(boolean separateFunctions) {
        this.separateFunctions = separateFunctions;
    }

    /**
     * Whether an empty function, {@code if}, {@code else} or {@code forall} body prints as {@code {}}.
     */
    public boolean isCollapseEmptyBodies() {
        return collapseEmptyBodies;
    }

    public void setCollapseEmptyBodies(boolean collapseEmptyBodies) {
        this.collapseEmptyBodies = collapseEmptyBodies;
    }
}
