package com.fhylang.compiler.ast.type;

import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * Tuple type: {@code tuple[int32[m], float32]}
 */
public class TupleType extends Type {
    private final List<Type> types;

    public TupleType(SourceLocation location, List<Type> types) {
        super(location);
        if (types == null || types.isEmpty()) {
            throw new IllegalArgumentException("Tuple type requires at least one component type");
        }
        this.types = immutable(types);
    }

    public List<Type> getTypes() {
        return types;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTupleType(this, context);
    }
}
