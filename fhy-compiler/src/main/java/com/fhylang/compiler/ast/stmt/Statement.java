package com.fhylang.compiler.ast.stmt;

import com.fhylang.compiler.ast.AstNode;
import com.fhylang.compiler.ast.SourceLocation;

/**
 * Base class of statements, including the top-level declarations.
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
