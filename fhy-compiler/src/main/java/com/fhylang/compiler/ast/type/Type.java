package com.fhylang.compiler.ast.type;

import com.fhylang.compiler.ast.AstNode;
import com.fhylang.compiler.ast.SourceLocation;

/**
 * Base class of types.
 */
public abstract class Type extends AstNode {

    protected Type(SourceLocation location) {
        super(location);
    }
}
