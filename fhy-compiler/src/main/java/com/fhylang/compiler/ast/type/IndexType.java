package com.fhylang.compiler.ast.type;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.SourceLocation;
import com.fhylang.compiler.ast.expr.Expression;

/**
 * Index range type: {@code index[low:high]} or {@code index[low:high:stride]}
 */
public class IndexType extends Type {
    private final Expression lowerBound;
    private final Expression upperBound;
    private final Expression stride;  // optional

    public IndexType(SourceLocation location, Expression lowerBound, Expression upperBound, Expression stride) {
        super(location);
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.stride = stride;
    }

    public Expression getLowerBound() {
        return lowerBound;
    }

    public Expression getUpperBound() {
        return upperBound;
    }

    public Expression getStride() {
        return stride;
    }

    public boolean hasStride() {
        return stride != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndexType(this, context);
    }
}
