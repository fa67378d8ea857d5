package com.fhylang.compiler.ast.expr;

import com.fhylang.compiler.ast.AstNode;
import com.fhylang.compiler.ast.SourceLocation;

/**
 * Base class of expressions. Expressions are side-effect-free data.
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
