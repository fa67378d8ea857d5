package com.fhylang.compiler.ast.expr;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.SourceLocation;

/**
 * Tuple element access: {@code t.1}
 */
public class TupleAccessExpression extends Expression {
    private final Expression tupleExpression;
    private final int elementIndex;  // zero-based

    public TupleAccessExpression(SourceLocation location, Expression tupleExpression, int elementIndex) {
        super(location);
        this.tupleExpression = tupleExpression;
        this.elementIndex = elementIndex;
    }

    public Expression getTupleExpression() {
        return tupleExpression;
    }

    public int getElementIndex() {
        return elementIndex;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTupleAccessExpression(this, context);
    }
}
