package com.fhylang.compiler.ast.decl;

import com.fhylang.compiler.ast.Identifier;
import com.fhylang.compiler.ast.SourceLocation;
import com.fhylang.compiler.ast.stmt.Statement;
import com.fhylang.compiler.ast.type.TemplateDataType;

import java.util.List;

/**
 * Shared shape of procedures and operations:
 * {@code keyword name<templates>[indices](args) { body }}
 */
public abstract class FunctionDecl extends Statement {
    private final Identifier name;
    private final List<TemplateDataType> templates;
    private final List<Identifier> indices;
    private final List<Argument> args;
    private final List<Statement> body;

    protected FunctionDecl(SourceLocation location, Identifier name, List<TemplateDataType> templates,
                           List<Identifier> indices, List<Argument> args, List<Statement> body) {
        super(location);
        this.name = name;
        this.templates = immutable(templates);
        this.indices = immutable(indices);
        this.args = immutable(args);
        this.body = immutable(body);
    }

    /**
     * Declared name.
     */
    public Identifier getName() {
        return name;
    }

    /**
     * Template parameters in declaration order; each shares its identifier with every use.
     */
    public List<TemplateDataType> getTemplates() {
        return templates;
    }

    /**
     * Index parameters from the {@code [...]} list.
     */
    public List<Identifier> getIndices() {
        return indices;
    }

    /**
     * Arguments in declaration order.
     */
    public List<Argument> getArgs() {
        return args;
    }

    /**
     * Body statements; empty for {@code {}}.
     */
    public List<Statement> getBody() {
        return body;
    }

    /** Source keyword of this declaration kind. */
    public abstract String getKeyword();
}
