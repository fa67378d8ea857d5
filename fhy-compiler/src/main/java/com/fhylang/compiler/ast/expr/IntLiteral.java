package com.fhylang.compiler.ast.expr;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.SourceLocation;

/**
 * Integer literal, any base.
 */
public class IntLiteral extends Expression {
    private final long value;

    public IntLiteral(SourceLocation location, long value) {
        super(location);
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIntLiteral(this, context);
    }
}
