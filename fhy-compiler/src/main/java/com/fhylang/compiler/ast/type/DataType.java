package com.fhylang.compiler.ast.type;

import com.fhylang.compiler.ast.SourceLocation;

/**
 * Element type of a numerical type: either a core data type or a template placeholder.
 */
public abstract class DataType extends Type {

    protected DataType(SourceLocation location) {
        super(location);
    }
}
