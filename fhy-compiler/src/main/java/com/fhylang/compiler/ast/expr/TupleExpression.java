package com.fhylang.compiler.ast.expr;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * Tuple construction: {@code (a,)} or {@code (a, b)}
 */
public class TupleExpression extends Expression {
    private final List<Expression> expressions;

    public TupleExpression(SourceLocation location, List<Expression> expressions) {
        super(location);
        this.expressions = immutable(expressions);
    }

    public List<Expression> getExpressions() {
        return expressions;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTupleExpression(this, context);
    }
}
