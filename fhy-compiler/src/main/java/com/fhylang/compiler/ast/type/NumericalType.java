package com.fhylang.compiler.ast.type;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.SourceLocation;
import com.fhylang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * Scalar or tensor type: {@code int32}, {@code T[m, n]}
 */
public class NumericalType extends Type {
    private final DataType dataType;
    private final List<Expression> shape;  // empty for scalars

    public NumericalType(SourceLocation location, DataType dataType, List<Expression> shape) {
        super(location);
        this.dataType = dataType;
        this.shape = immutable(shape);
    }

    public DataType getDataType() {
        return dataType;
    }

    public List<Expression> getShape() {
        return shape;
    }

    public boolean isScalar() {
        return shape.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNumericalType(this, context);
    }
}
