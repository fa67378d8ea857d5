package com.fhylang.compiler.formatter;

import com.fhylang.compiler.ast.*;
import com.fhylang.compiler.ast.decl.*;
import com.fhylang.compiler.ast.decl.Module;
import com.fhylang.compiler.ast.expr.*;
import com.fhylang.compiler.ast.stmt.*;
import com.fhylang.compiler.ast.type.*;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * Renders an AST back to FhY source.
 *
 * <p>Output is canonical: one statement per line, bodies indented one level, and operands
 * of operators wrapped in parentheses whenever they are themselves binary or ternary
 * expressions. Parsing the output yields an AST with the same shape as the input.</p>
 */
public class AstPrinter implements AstVisitor<Void, FormatterContext> {

    public String print(Module module, FormatConfig config) {
        FormatterContext ctx = new FormatterContext(config);
        visitModule(module, ctx);
        return ctx.getOutput();
    }

    public String print(Module module) {
        return print(module, new FormatConfig());
    }

    /**
     * Renders a single node, e.g. an expression or a type.
     */
    public String print(AstNode node) {
        FormatterContext ctx = new FormatterContext(new FormatConfig());
        node.accept(this, ctx);
        return ctx.getOutput();
    }

    // ============ Declarations ============

    @Override
    public Void visitModule(Module node, FormatterContext ctx) {
        List<Statement> statements = node.getStatements();
        for (Statement statement : statements) {
            ctx.beginTopLevel(statement instanceof FunctionDecl);
            statement.accept(this, ctx);
        }
        return null;
    }

    @Override
    public Void visitImport(Import node, FormatterContext ctx) {
        ctx.append("import ");
        ctx.append(node.getName().getNameHint());
        if (node.hasAlias()) {
            ctx.append(" as ");
            ctx.append(node.getAlias().getNameHint());
        }
        ctx.endStatement();
        return null;
    }

    @Override
    public Void visitProcedure(Procedure node, FormatterContext ctx) {
        formatFunction(node, null, ctx);
        return null;
    }

    @Override
    public Void visitOperation(Operation node, FormatterContext ctx) {
        formatFunction(node, node.getReturnType(), ctx);
        return null;
    }

    private void formatFunction(FunctionDecl node, QualifiedType returnType, FormatterContext ctx) {
        ctx.append(node.getKeyword());
        ctx.append(" ");
        ctx.append(node.getName().getNameHint());
        if (!node.getTemplates().isEmpty()) {
            ctx.append("<");
            formatJoined(node.getTemplates(), ctx, ", ", this::formatNode);
            ctx.append(">");
        }
        if (!node.getIndices().isEmpty()) {
            ctx.append("[");
            formatJoined(node.getIndices(), ctx, ", ", (id, c) -> c.append(id.getNameHint()));
            ctx.append("]");
        }
        ctx.append("(");
        formatJoined(node.getArgs(), ctx, ", ", this::formatNode);
        ctx.append(")");
        if (returnType != null) {
            ctx.append(" -> ");
            returnType.accept(this, ctx);
        }
        ctx.append(" ");
        formatBlock(node.getBody(), ctx, false);
    }

    @Override
    public Void visitArgument(Argument node, FormatterContext ctx) {
        node.getQualifiedType().accept(this, ctx);
        ctx.append(" ");
        ctx.append(node.getName().getNameHint());
        return null;
    }

    // ============ Statements ============

    @Override
    public Void visitDeclarationStatement(DeclarationStatement node, FormatterContext ctx) {
        node.getVariableType().accept(this, ctx);
        ctx.append(" ");
        ctx.append(node.getVariableName().getNameHint());
        if (node.hasExpression()) {
            ctx.append(" = ");
            formatExpression(node.getExpression(), ctx);
        }
        ctx.endStatement();
        return null;
    }

    @Override
    public Void visitExpressionStatement(ExpressionStatement node, FormatterContext ctx) {
        if (node.isAssignment()) {
            formatExpression(node.getLeft(), ctx);
            ctx.append(" = ");
        }
        formatExpression(node.getRight(), ctx);
        ctx.endStatement();
        return null;
    }

    @Override
    public Void visitSelectionStatement(SelectionStatement node, FormatterContext ctx) {
        ctx.append("if (");
        formatExpression(node.getCondition(), ctx);
        ctx.append(") ");
        formatBlock(node.getTrueBody(), ctx, node.hasElse());
        if (node.hasElse()) {
            ctx.append("else ");
            List<Statement> falseBody = node.getFalseBody();
            if (falseBody.size() == 1 && falseBody.get(0) instanceof SelectionStatement) {
                falseBody.get(0).accept(this, ctx);
            } else {
                formatBlock(falseBody, ctx, false);
            }
        }
        return null;
    }

    @Override
    public Void visitForAllStatement(ForAllStatement node, FormatterContext ctx) {
        ctx.append("forall (");
        formatExpression(node.getIndex(), ctx);
        ctx.append(") ");
        formatBlock(node.getBody(), ctx, false);
        return null;
    }

    @Override
    public Void visitReturnStatement(ReturnStatement node, FormatterContext ctx) {
        ctx.append("return ");
        formatExpression(node.getExpression(), ctx);
        ctx.endStatement();
        return null;
    }

    // ============ Expressions ============

    @Override
    public Void visitIntLiteral(IntLiteral node, FormatterContext ctx) {
        ctx.append(Long.toString(node.getValue()));
        return null;
    }

    @Override
    public Void visitFloatLiteral(FloatLiteral node, FormatterContext ctx) {
        ctx.append(Double.toString(node.getValue()));
        return null;
    }

    @Override
    public Void visitComplexLiteral(ComplexLiteral node, FormatterContext ctx) {
        if (node.getReal() != 0.0) {
            // no literal form for a real part
            ctx.append("(" + Double.toString(node.getReal()) + " + " + Double.toString(node.getImaginary()) + "j)");
        } else {
            ctx.append(Double.toString(node.getImaginary()) + "j");
        }
        return null;
    }

    @Override
    public Void visitIdentifierExpression(IdentifierExpression node, FormatterContext ctx) {
        ctx.append(node.getIdentifier().getNameHint());
        return null;
    }

    @Override
    public Void visitTupleExpression(TupleExpression node, FormatterContext ctx) {
        ctx.append("(");
        formatJoined(node.getExpressions(), ctx, ", ", this::formatExpression);
        if (node.getExpressions().size() == 1) {
            ctx.append(",");
        }
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitTupleAccessExpression(TupleAccessExpression node, FormatterContext ctx) {
        formatAccessTarget(node.getTupleExpression(), ctx);
        ctx.append(".");
        ctx.append(Integer.toString(node.getElementIndex()));
        return null;
    }

    @Override
    public Void visitArrayAccessExpression(ArrayAccessExpression node, FormatterContext ctx) {
        formatAccessTarget(node.getArrayExpression(), ctx);
        ctx.append("[");
        formatJoined(node.getIndices(), ctx, ", ", this::formatExpression);
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitFunctionExpression(FunctionExpression node, FormatterContext ctx) {
        formatExpression(node.getFunction(), ctx);
        if (!node.getTemplateTypes().isEmpty()) {
            ctx.append("<");
            formatJoined(node.getTemplateTypes(), ctx, ", ", this::formatNode);
            ctx.append(">");
        }
        if (!node.getIndices().isEmpty()) {
            ctx.append("[");
            formatJoined(node.getIndices(), ctx, ", ", this::formatExpression);
            ctx.append("]");
        }
        ctx.append("(");
        formatJoined(node.getArgs(), ctx, ", ", this::formatExpression);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitUnaryExpression(UnaryExpression node, FormatterContext ctx) {
        ctx.append(node.getOperator().toSourceString());
        formatOperand(node.getOperand(), ctx);
        return null;
    }

    @Override
    public Void visitBinaryExpression(BinaryExpression node, FormatterContext ctx) {
        formatOperand(node.getLeft(), ctx);
        ctx.append(" ");
        ctx.append(node.getOperator().toSourceString());
        ctx.append(" ");
        formatOperand(node.getRight(), ctx);
        return null;
    }

    @Override
    public Void visitTernaryExpression(TernaryExpression node, FormatterContext ctx) {
        formatOperand(node.getCondition(), ctx);
        ctx.append(" ? ");
        formatOperand(node.getTrueExpression(), ctx);
        ctx.append(" : ");
        formatOperand(node.getFalseExpression(), ctx);
        return null;
    }

    // ============ Types ============

    @Override
    public Void visitQualifiedType(QualifiedType node, FormatterContext ctx) {
        ctx.append(node.getTypeQualifier().getKeyword());
        ctx.append(" ");
        node.getBaseType().accept(this, ctx);
        return null;
    }

    @Override
    public Void visitNumericalType(NumericalType node, FormatterContext ctx) {
        node.getDataType().accept(this, ctx);
        if (!node.isScalar()) {
            ctx.append("[");
            formatJoined(node.getShape(), ctx, ", ", this::formatExpression);
            ctx.append("]");
        }
        return null;
    }

    @Override
    public Void visitIndexType(IndexType node, FormatterContext ctx) {
        ctx.append("index[");
        formatExpression(node.getLowerBound(), ctx);
        ctx.append(":");
        formatExpression(node.getUpperBound(), ctx);
        if (node.hasStride()) {
            ctx.append(":");
            formatExpression(node.getStride(), ctx);
        }
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitTupleType(TupleType node, FormatterContext ctx) {
        ctx.append("tuple[");
        formatJoined(node.getTypes(), ctx, ", ", this::formatNode);
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitPrimitiveDataType(PrimitiveDataType node, FormatterContext ctx) {
        ctx.append(node.getCoreDataType().getKeyword());
        return null;
    }

    @Override
    public Void visitTemplateDataType(TemplateDataType node, FormatterContext ctx) {
        ctx.append(node.getDataType().getNameHint());
        return null;
    }

    // ============ Helpers ============

    private <T> void formatJoined(List<T> items, FormatterContext ctx, String separator,
                                   BiConsumer<T, FormatterContext> formatter) {
        for (int i = 0; i < items.size(); i++) {
            formatter.accept(items.get(i), ctx);
            if (i < items.size() - 1) {
                ctx.append(separator);
            }
        }
    }

    private void formatNode(AstNode node, FormatterContext ctx) {
        node.accept(this, ctx);
    }

    private void formatExpression(Expression expr, FormatterContext ctx) {
        if (expr != null) {
            expr.accept(this, ctx);
        }
    }

    private void formatOperand(Expression operand, FormatterContext ctx) {
        boolean nested = operand instanceof BinaryExpression || operand instanceof TernaryExpression;
        if (nested) {
            ctx.append("(");
        }
        formatExpression(operand, ctx);
        if (nested) {
            ctx.append(")");
        }
    }

    private void formatAccessTarget(Expression target, FormatterContext ctx) {
        boolean bare = target instanceof IdentifierExpression || target instanceof FunctionExpression
                || target instanceof TupleExpression || target instanceof TupleAccessExpression
                || target instanceof ArrayAccessExpression;
        if (!bare) {
            ctx.append("(");
        }
        formatExpression(target, ctx);
        if (!bare) {
            ctx.append(")");
        }
    }

    private void formatBlock(List<Statement> body, FormatterContext ctx, boolean continued) {
        ctx.openBlock(body.isEmpty());
        for (Statement stmt : body) {
            stmt.accept(this, ctx);
        }
        ctx.closeBlock(continued);
    }
}
