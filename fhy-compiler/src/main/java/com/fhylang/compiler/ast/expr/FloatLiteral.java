package com.fhylang.compiler.ast.expr;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.SourceLocation;

/**
 * Floating point literal.
 */
public class FloatLiteral extends Expression {
    private final double value;

    public FloatLiteral(SourceLocation location, double value) {
        super(location);
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFloatLiteral(this, context);
    }
}
