package com.fhylang.compiler.ast.expr;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.SourceLocation;

/**
 * Complex literal. Source literals such as {@code 2.5j} are purely imaginary, so the
 * converter always produces a zero real part.
 */
public class ComplexLiteral extends Expression {
    private final double real;
    private final double imaginary;

    public ComplexLiteral(SourceLocation location, double real, double imaginary) {
        super(location);
        this.real = real;
        this.imaginary = imaginary;
    }

    public double getReal() {
        return real;
    }

    public double getImaginary() {
        return imaginary;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitComplexLiteral(this, context);
    }
}
