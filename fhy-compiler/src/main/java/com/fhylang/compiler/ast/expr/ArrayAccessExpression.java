package com.fhylang.compiler.ast.expr;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * Array element access: {@code A[i, j]}
 */
public class ArrayAccessExpression extends Expression {
    private final Expression arrayExpression;
    private final List<Expression> indices;

    public ArrayAccessExpression(SourceLocation location, Expression arrayExpression, List<Expression> indices) {
        super(location);
        this.arrayExpression = arrayExpression;
        this.indices = immutable(indices);
    }

    public Expression getArrayExpression() {
        return arrayExpression;
    }

    public List<Expression> getIndices() {
        return indices;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayAccessExpression(this, context);
    }
}
