package com.fhylang.compiler.ast.stmt;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.SourceLocation;
import com.fhylang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * Iteration over an index: {@code forall (i) { ... }}
 */
public class ForAllStatement extends Statement {
    private final Expression index;
    private final List<Statement> body;

    public ForAllStatement(SourceLocation location, Expression index, List<Statement> body) {
        super(location);
        this.index = index;
        this.body = immutable(body);
    }

    /**
     * Index being iterated over.
     */
    public Expression getIndex() {
        return index;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForAllStatement(this, context);
    }
}
