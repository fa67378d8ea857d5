package com.fhylang.compiler.serialization;

import com.fhylang.compiler.ast.AstNode;
import com.fhylang.compiler.ast.AstVisitor;
import com.fhylang.compiler.ast.Identifier;
import com.fhylang.compiler.ast.SourceLocation;
import com.fhylang.compiler.ast.decl.*;
import com.fhylang.compiler.ast.decl.Module;
import com.fhylang.compiler.ast.expr.*;
import com.fhylang.compiler.ast.stmt.*;
import com.fhylang.compiler.ast.type.*;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

import java.util.List;

/**
 * Dumps an AST as JSON for debugging and golden-file tests.
 *
 * <p>Every node becomes an object whose {@code "kind"} is the node class name, followed by
 * its {@code "span"} and its fields in declaration order. Identifiers are
 * {@code {"id": ..., "name": ...}} so that shared bindings stay visible in the dump.
 * Absent optional children are written as {@code null}.</p>
 */
public class AstJsonSerializer implements AstVisitor<JsonElement, Void> {

    private final Gson gson = new GsonBuilder().serializeNulls().setPrettyPrinting().create();

    public String toJson(AstNode node) {
        return gson.toJson(toJsonTree(node));
    }

    public JsonElement toJsonTree(AstNode node) {
        if (node == null) {
            return JsonNull.INSTANCE;
        }
        return node.accept(this, null);
    }

    // ============ Declarations ============

    @Override
    public JsonElement visitModule(Module node, Void ctx) {
        JsonObject json = start(node);
        json.add("statements", array(node.getStatements()));
        return json;
    }

    @Override
    public JsonElement visitImport(Import node, Void ctx) {
        JsonObject json = start(node);
        json.add("name", identifier(node.getName()));
        json.add("alias", identifier(node.getAlias()));
        return json;
    }

    @Override
    public JsonElement visitProcedure(Procedure node, Void ctx) {
        return function(node);
    }

    @Override
    public JsonElement visitOperation(Operation node, Void ctx) {
        JsonObject json = function(node);
        json.add("returnType", toJsonTree(node.getReturnType()));
        return json;
    }

    private JsonObject function(FunctionDecl node) {
        JsonObject json = start(node);
        json.add("name", identifier(node.getName()));
        json.add("templates", array(node.getTemplates()));
        JsonArray indices = new JsonArray();
        for (Identifier index : node.getIndices()) {
            indices.add(identifier(index));
        }
        json.add("indices", indices);
        json.add("args", array(node.getArgs()));
        json.add("body", array(node.getBody()));
        return json;
    }

    @Override
    public JsonElement visitArgument(Argument node, Void ctx) {
        JsonObject json = start(node);
        json.add("name", identifier(node.getName()));
        json.add("qualifiedType", toJsonTree(node.getQualifiedType()));
        return json;
    }

    // ============ Statements ============

    @Override
    public JsonElement visitDeclarationStatement(DeclarationStatement node, Void ctx) {
        JsonObject json = start(node);
        json.add("variableName", identifier(node.getVariableName()));
        json.add("variableType", toJsonTree(node.getVariableType()));
        json.add("expression", toJsonTree(node.getExpression()));
        return json;
    }

    @Override
    public JsonElement visitExpressionStatement(ExpressionStatement node, Void ctx) {
        JsonObject json = start(node);
        json.add("left", toJsonTree(node.getLeft()));
        json.add("right", toJsonTree(node.getRight()));
        return json;
    }

    @Override
    public JsonElement visitSelectionStatement(SelectionStatement node, Void ctx) {
        JsonObject json = start(node);
        json.add("condition", toJsonTree(node.getCondition()));
        json.add("trueBody", array(node.getTrueBody()));
        json.add("falseBody", array(node.getFalseBody()));
        return json;
    }

    @Override
    public JsonElement visitForAllStatement(ForAllStatement node, Void ctx) {
        JsonObject json = start(node);
        json.add("index", toJsonTree(node.getIndex()));
        json.add("body", array(node.getBody()));
        return json;
    }

    @Override
    public JsonElement visitReturnStatement(ReturnStatement node, Void ctx) {
        JsonObject json = start(node);
        json.add("expression", toJsonTree(node.getExpression()));
        return json;
    }

    // ============ Expressions ============

    @Override
    public JsonElement visitIntLiteral(IntLiteral node, Void ctx) {
        JsonObject json = start(node);
        json.addProperty("value", node.getValue());
        return json;
    }

    @Override
    public JsonElement visitFloatLiteral(FloatLiteral node, Void ctx) {
        JsonObject json = start(node);
        json.addProperty("value", node.getValue());
        return json;
    }

    @Override
    public JsonElement visitComplexLiteral(ComplexLiteral node, Void ctx) {
        JsonObject json = start(node);
        json.addProperty("real", node.getReal());
        json.addProperty("imaginary", node.getImaginary());
        return json;
    }

    @Override
    public JsonElement visitIdentifierExpression(IdentifierExpression node, Void ctx) {
        JsonObject json = start(node);
        json.add("identifier", identifier(node.getIdentifier()));
        return json;
    }

    @Override
    public JsonElement visitTupleExpression(TupleExpression node, Void ctx) {
        JsonObject json = start(node);
        json.add("expressions", array(node.getExpressions()));
        return json;
    }

    @Override
    public JsonElement visitTupleAccessExpression(TupleAccessExpression node, Void ctx) {
        JsonObject json = start(node);
        json.add("tupleExpression", toJsonTree(node.getTupleExpression()));
        json.addProperty("elementIndex", node.getElementIndex());
        return json;
    }

    @Override
    public JsonElement visitArrayAccessExpression(ArrayAccessExpression node, Void ctx) {
        JsonObject json = start(node);
        json.add("arrayExpression", toJsonTree(node.getArrayExpression()));
        json.add("indices", array(node.getIndices()));
        return json;
    }

    @Override
    public JsonElement visitFunctionExpression(FunctionExpression node, Void ctx) {
        JsonObject json = start(node);
        json.add("function", toJsonTree(node.getFunction()));
        json.add("templateTypes", array(node.getTemplateTypes()));
        json.add("indices", array(node.getIndices()));
        json.add("args", array(node.getArgs()));
        return json;
    }

    @Override
    public JsonElement visitUnaryExpression(UnaryExpression node, Void ctx) {
        JsonObject json = start(node);
        json.addProperty("operator", node.getOperator().name());
        json.add("operand", toJsonTree(node.getOperand()));
        return json;
    }

    @Override
    public JsonElement visitBinaryExpression(BinaryExpression node, Void ctx) {
        JsonObject json = start(node);
        json.addProperty("operator", node.getOperator().name());
        json.add("left", toJsonTree(node.getLeft()));
        json.add("right", toJsonTree(node.getRight()));
        return json;
    }

    @Override
    public JsonElement visitTernaryExpression(TernaryExpression node, Void ctx) {
        JsonObject json = start(node);
        json.add("condition", toJsonTree(node.getCondition()));
        json.add("trueExpression", toJsonTree(node.getTrueExpression()));
        json.add("falseExpression", toJsonTree(node.getFalseExpression()));
        return json;
    }

    // ============ Types ============

    @Override
    public JsonElement visitQualifiedType(QualifiedType node, Void ctx) {
        JsonObject json = start(node);
        json.addProperty("typeQualifier", node.getTypeQualifier().name());
        json.add("baseType", toJsonTree(node.getBaseType()));
        return json;
    }

    @Override
    public JsonElement visitNumericalType(NumericalType node, Void ctx) {
        JsonObject json = start(node);
        json.add("dataType", toJsonTree(node.getDataType()));
        json.add("shape", array(node.getShape()));
        return json;
    }

    @Override
    public JsonElement visitIndexType(IndexType node, Void ctx) {
        JsonObject json = start(node);
        json.add("lowerBound", toJsonTree(node.getLowerBound()));
        json.add("upperBound", toJsonTree(node.getUpperBound()));
        json.add("stride", toJsonTree(node.getStride()));
        return json;
    }

    @Override
    public JsonElement visitTupleType(TupleType node, Void ctx) {
        JsonObject json = start(node);
        json.add("types", array(node.getTypes()));
        return json;
    }

    @Override
    public JsonElement visitPrimitiveDataType(PrimitiveDataType node, Void ctx) {
        JsonObject json = start(node);
        json.addProperty("coreDataType", node.getCoreDataType().name());
        return json;
    }

    @Override
    public JsonElement visitTemplateDataType(TemplateDataType node, Void ctx) {
        JsonObject json = start(node);
        json.add("dataType", identifier(node.getDataType()));
        return json;
    }

    // ============ Helpers ============

    private static JsonObject start(AstNode node) {
        JsonObject json = new JsonObject();
        json.addProperty("kind", node.getClass().getSimpleName());
        json.add("span", span(node.getLocation()));
        return json;
    }

    private static JsonElement span(SourceLocation location) {
        if (!location.isKnown()) {
            return JsonNull.INSTANCE;
        }
        JsonObject json = new JsonObject();
        json.addProperty("file", location.getFile());
        json.addProperty("startLine", location.getStartLine());
        json.addProperty("startColumn", location.getStartColumn());
        json.addProperty("endLine", location.getEndLine());
        json.addProperty("endColumn", location.getEndColumn());
        return json;
    }

    private static JsonElement identifier(Identifier id) {
        if (id == null) {
            return JsonNull.INSTANCE;
        }
        JsonObject json = new JsonObject();
        json.addProperty("id", id.getId());
        json.addProperty("name", id.getNameHint());
        return json;
    }

    private JsonArray array(List<? extends AstNode> nodes) {
        JsonArray json = new JsonArray();
        for (AstNode node : nodes) {
            json.add(toJsonTree(node));
        }
        return json;
    }
}
