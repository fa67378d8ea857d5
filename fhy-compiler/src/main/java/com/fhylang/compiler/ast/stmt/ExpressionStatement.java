package com.fhylang.compiler.ast.stmt;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.SourceLocation;
import com.fhylang.compiler.ast.expr.Expression;

/**
 * Expression statement, optionally assigning to a target: {@code A[i] = f(x);}
 */
public class ExpressionStatement extends Statement {
    private final Expression left;   // assignment target, optional
    private final Expression right;

    public ExpressionStatement(SourceLocation location, Expression left, Expression right) {
        super(location);
        this.left = left;
        this.right = right;
    }

    /**
     * Assignment target, or {@code null} when the value is discarded.
     */
    public Expression getLeft() {
        return left;
    }

    /**
     * Evaluated expression.
     */
    public Expression getRight() {
        return right;
    }

    public boolean isAssignment() {
        return left != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExpressionStatement(this, context);
    }
}
