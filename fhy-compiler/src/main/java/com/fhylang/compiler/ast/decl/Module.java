package com.fhylang.compiler.ast.decl;

import com.fhylang.compiler.ast.AstNode;
import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.SourceLocation;
import com.fhylang.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * Compilation unit: the top-level statements of one source, in source order.
 */
public class Module extends AstNode {
    private final List<Statement> statements;

    public Module(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = immutable(statements);
    }

    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModule(this, context);
    }
}
