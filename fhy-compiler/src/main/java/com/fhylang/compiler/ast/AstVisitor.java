package com.fhylang.compiler.ast;

import com.fhylang.compiler.ast.decl.*;
import com.fhylang.compiler.ast.decl.Module;
import com.fhylang.compiler.ast.expr.*;
import com.fhylang.compiler.ast.stmt.*;
import com.fhylang.compiler.ast.type.*;

/**
 * AST visitor.
 *
 * <p>There is one method per concrete node kind and none has a default, so adding a node
 * kind breaks every visitor at compile time until it handles the new kind.</p>
 */
public interface AstVisitor<R, C> {

    // ============ Declarations ============

    R visitModule(Module node, C ctx);

    R visitImport(Import node, C ctx);

    R visitProcedure(Procedure node, C ctx);

    R visitOperation(Operation node, C ctx);

    R visitArgument(Argument node, C ctx);

    // ============ Statements ============

    R visitDeclarationStatement(DeclarationStatement node, C ctx);

    R visitExpressionStatement(ExpressionStatement node, C ctx);

    R visitSelectionStatement(SelectionStatement node, C ctx);

    R visitForAllStatement(ForAllStatement node, C ctx);

    R visitReturnStatement(ReturnStatement node, C ctx);

    // ============ Expressions ============

    R visitIntLiteral(IntLiteral node, C ctx);

    R visitFloatLiteral(FloatLiteral node, C ctx);

    R visitComplexLiteral(ComplexLiteral node, C ctx);

    R visitIdentifierExpression(IdentifierExpression node, C ctx);

    R visitTupleExpression(TupleExpression node, C ctx);

    R visitTupleAccessExpression(TupleAccessExpression node, C ctx);

    R visitArrayAccessExpression(ArrayAccessExpression node, C ctx);

    R visitFunctionExpression(FunctionExpression node, C ctx);

    R visitUnaryExpression(UnaryExpression node, C ctx);

    R visitBinaryExpression(BinaryExpression node, C ctx);

    R visitTernaryExpression(TernaryExpression node, C ctx);

    // ============ Types ============

    R visitQualifiedType(QualifiedType node, C ctx);

    R visitNumericalType(NumericalType node, C ctx);

    R visitIndexType(IndexType node, C ctx);

    R visitTupleType(TupleType node, C ctx);

    R visitPrimitiveDataType(PrimitiveDataType node, C ctx);

    R visitTemplateDataType(TemplateDataType node, C ctx);
}
