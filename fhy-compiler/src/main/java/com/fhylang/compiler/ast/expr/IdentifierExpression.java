package com.fhylang.compiler.ast.expr;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.Identifier;
import com.fhylang.compiler.ast.SourceLocation;

/**
 * Reference to a named entity. Module-qualified names keep their dotted spelling in
 * the identifier's hint ({@code module.method}).
 */
public class IdentifierExpression extends Expression {
    private final Identifier identifier;

    public IdentifierExpression(SourceLocation location, Identifier identifier) {
        super(location);
        this.identifier = identifier;
    }

    public Identifier getIdentifier() {
        return identifier;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifierExpression(this, context);
    }
}
