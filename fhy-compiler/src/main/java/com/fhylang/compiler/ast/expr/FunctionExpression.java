package com.fhylang.compiler.ast.expr;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.SourceLocation;
import com.fhylang.compiler.ast.type.DataType;

import java.util.List;

/**
 * Call: {@code f<T>[i](a, b)}
 *
 * <p>Template and index lists are empty when omitted; {@code f()} and {@code f<>()}
 * produce the same node.</p>
 */
public class FunctionExpression extends Expression {
    private final Expression function;
    private final List<DataType> templateTypes;
    private final List<Expression> indices;
    private final List<Expression> args;

    public FunctionExpression(SourceLocation location, Expression function, List<DataType> templateTypes,
                              List<Expression> indices, List<Expression> args) {
        super(location);
        this.function = function;
        this.templateTypes = immutable(templateTypes);
        this.indices = immutable(indices);
        this.args = immutable(args);
    }

    public Expression getFunction() {
        return function;
    }

    public List<DataType> getTemplateTypes() {
        return templateTypes;
    }

    public List<Expression> getIndices() {
        return indices;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionExpression(this, context);
    }
}
