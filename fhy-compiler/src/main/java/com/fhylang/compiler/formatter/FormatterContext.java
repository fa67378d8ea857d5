package com.fhylang.compiler.formatter;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * FhY layout state of one {@link AstPrinter} run.
 *
 * <p>Statements end their own line: simple statements through {@link #endStatement()},
 * compound ones through {@link #closeBlock(boolean)}. Top-level spacing is decided by
 * {@link #beginTopLevel(boolean)}.</p>
 */
public class FormatterContext {
    private final StringBuilder output = new StringBuilder();
    private final FormatConfig config;
    private final String indentUnit;
    private final Deque<Boolean> openBodies = new ArrayDeque<>();
    private int depth = 0;
    private boolean atLineStart = true;
    private boolean anyTopLevel = false;
    private boolean lastTopLevelWasFunction = false;

    public FormatterContext(FormatConfig config) {
        this.config = config;
        this.indentUnit = config.isUseSpaces() ? " ".repeat(config.getIndentSize()) : "\t";
    }

    /**
     * Appends text, indenting to the current body depth first when at the start of a line.
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            for (int i = 0; i < depth; i++) {
                output.append(indentUnit);
            }
            atLineStart = false;
        }
        output.append(text);
    }

    /**
     * Terminates an import, declaration, expression or return statement.
     */
    public void endStatement() {
        append(";");
        newLine();
    }

    /**
     * Opens a statement body. An empty body stays on the line when empty bodies collapse.
     */
    public void openBlock(boolean empty) {
        boolean collapsed = empty && config.isCollapseEmptyBodies();
        openBodies.push(collapsed);
        append("{");
        if (!collapsed) {
            newLine();
            depth++;
        }
    }

    /**
     * Closes the innermost body. With {@code continued} the line stays open for {@code else}.
     */
    public void closeBlock(boolean continued) {
        if (openBodies.isEmpty()) {
            throw new IllegalStateException("closeBlock without a matching openBlock");
        }
        if (!openBodies.pop()) {
            depth--;
        }
        append("}");
        if (continued) {
            append(" ");
        } else {
            newLine();
        }
    }

    /**
     * Starts the next top-level statement, inserting an empty line when it or its
     * predecessor is a function declaration.
     */
    public void beginTopLevel(boolean isFunction) {
        if (anyTopLevel && config.isSeparateFunctions() && (isFunction || lastTopLevelWasFunction)) {
            output.append("\n");
            atLineStart = true;
        }
        anyTopLevel = true;
        lastTopLevelWasFunction = isFunction;
    }

    public String getOutput() {
        return output.toString();
    }

    private void newLine() {
        output.append("\n");
        atLineStart = true;
    }
}
