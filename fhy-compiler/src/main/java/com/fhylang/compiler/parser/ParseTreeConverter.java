package com.fhylang.compiler.parser;

import com.fhylang.compiler.ast.AstNode;
import com.fhylang.compiler.ast.Identifier;
import com.fhylang.compiler.ast.SourceLocation;
import com.fhylang.compiler.ast.decl.*;
import com.fhylang.compiler.ast.decl.Module;
import com.fhylang.compiler.ast.expr.*;
import com.fhylang.compiler.ast.stmt.*;
import com.fhylang.compiler.ast.type.*;
import com.fhylang.compiler.parser.FhYParser.*;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts an FhY parse tree into the AST.
 *
 * <p>Each grammar production has one conversion method; children are converted first and
 * assembled into the parent node, which receives the production's span. Beyond what the
 * grammar checks, the converter rejects constructs that lack a mandatory element (unnamed
 * arguments, operations without a return type, unknown declaration keywords) and binds
 * every use of a template parameter to the identifier created at its declaration.</p>
 *
 * <p>Conversion stops at the first error. An instance keeps per-declaration template
 * scopes while converting and must not be shared between threads.</p>
 */
public class ParseTreeConverter extends FhYBaseVisitor<AstNode> {

    private static final String PROCEDURE_KEYWORD = "proc";
    private static final String OPERATION_KEYWORD = "op";
    private static final Pattern TUPLE_INDEX = Pattern.compile("[0-9]+");

    private final String fileName;

    /** Template parameters visible in the declaration being converted, innermost first. */
    private final Deque<Map<String, Identifier>> templateScopes = new ArrayDeque<Map<String, Identifier>>();

    public ParseTreeConverter(String fileName) {
        this.fileName = fileName;
    }

    public ParseTreeConverter() {
        this("<source>");
    }

    /**
     * Converts a whole module.
     *
     * @throws FhYSyntaxError when a construct is structurally invalid
     * @throws LiteralError   when a numeric literal cannot be decoded
     */
    public Module convert(ModuleContext ctx) {
        templateScopes.clear();
        return convert(ctx, Module.class);
    }

    // ============ Module ============

    @Override
    public AstNode visitModule(ModuleContext ctx) {
        List<Statement> statements = new ArrayList<Statement>();
        for (TopLevelStatementContext statement : ctx.topLevelStatement()) {
            statements.add(convert(statement, Statement.class));
        }
        return new Module(locationOf(ctx), statements);
    }

    @Override
    public AstNode visitTopLevelStatement(TopLevelStatementContext ctx) {
        if (ctx.importStatement() != null) {
            return ctx.importStatement().accept(this);
        }
        if (ctx.functionDeclaration() != null) {
            return ctx.functionDeclaration().accept(this);
        }
        return ctx.statement().accept(this);
    }

    @Override
    public AstNode visitAbsoluteImport(AbsoluteImportContext ctx) {
        Identifier name = new Identifier(pathOf(ctx.identifierPath()));
        return new Import(locationOf(ctx), name, aliasOf(ctx.alias));
    }

    @Override
    public AstNode visitFromImport(FromImportContext ctx) {
        Identifier name = new Identifier(pathOf(ctx.identifierPath()) + "." + ctx.member.getText());
        return new Import(locationOf(ctx), name, aliasOf(ctx.alias));
    }

    // ============ Procedures and operations ============

    @Override
    public AstNode visitFunctionDeclaration(FunctionDeclarationContext ctx) {
        String keyword = ctx.functionKeyword().getText();
        String name = ctx.name.getText();
        if (!PROCEDURE_KEYWORD.equals(keyword) && !OPERATION_KEYWORD.equals(keyword)) {
            throw error("Invalid function keyword '" + keyword + "', expected '"
                    + PROCEDURE_KEYWORD + "' or '" + OPERATION_KEYWORD + "'", ctx.functionKeyword());
        }
        boolean isOperation = OPERATION_KEYWORD.equals(keyword);
        if (isOperation && ctx.returnType == null) {
            throw error("Operation '" + name + "' must declare a return type", ctx);
        }
        if (!isOperation && ctx.returnType != null) {
            throw error("Procedure '" + name + "' cannot declare a return type", ctx.returnType);
        }

        templateScopes.push(new HashMap<String, Identifier>());
        try {
            List<TemplateDataType> templates = convertTemplateParameters(ctx.templateParameters());
            List<Identifier> indices = convertIndexParameters(ctx.indexParameters());
            List<Argument> args = new ArrayList<Argument>();
            if (ctx.argumentList() != null) {
                for (ArgumentContext arg : ctx.argumentList().argument()) {
                    args.add(convert(arg, Argument.class));
                }
            }
            QualifiedType returnType = isOperation ? convert(ctx.returnType, QualifiedType.class) : null;
            List<Statement> body = convertBlock(ctx.block());

            Identifier identifier = new Identifier(name);
            if (isOperation) {
                return new Operation(locationOf(ctx), identifier, templates, indices, args, returnType, body);
            }
            return new Procedure(locationOf(ctx), identifier, templates, indices, args, body);
        } finally {
            templateScopes.pop();
        }
    }

    private List<TemplateDataType> convertTemplateParameters(TemplateParametersContext ctx) {
        if (ctx == null) {
            return Collections.emptyList();
        }
        Map<String, Identifier> scope = templateScopes.peek();
        List<TemplateDataType> templates = new ArrayList<TemplateDataType>();
        for (TerminalNode parameter : ctx.IDENTIFIER()) {
            String spelling = parameter.getText();
            if (scope.containsKey(spelling)) {
                throw error("Duplicate template parameter '" + spelling + "'", parameter.getSymbol());
            }
            Identifier id = new Identifier(spelling);
            scope.put(spelling, id);
            templates.add(new TemplateDataType(locationOf(parameter.getSymbol()), id));
        }
        return templates;
    }

    private List<Identifier> convertIndexParameters(IndexParametersContext ctx) {
        if (ctx == null) {
            return Collections.emptyList();
        }
        Map<String, Identifier> seen = new LinkedHashMap<String, Identifier>();
        for (TerminalNode parameter : ctx.IDENTIFIER()) {
            String spelling = parameter.getText();
            if (seen.containsKey(spelling)) {
                throw error("Duplicate index parameter '" + spelling + "'", parameter.getSymbol());
            }
            seen.put(spelling, new Identifier(spelling));
        }
        return new ArrayList<Identifier>(seen.values());
    }

    @Override
    public AstNode visitArgument(ArgumentContext ctx) {
        if (ctx.IDENTIFIER() == null) {
            throw error("Argument of type '" + textOf(ctx.qualifiedType()) + "' is missing a name", ctx);
        }
        QualifiedType type = convert(ctx.qualifiedType(), QualifiedType.class);
        return new Argument(locationOf(ctx), new Identifier(ctx.IDENTIFIER().getText()), type);
    }

    // ============ Statements ============

    private List<Statement> convertBlock(BlockContext ctx) {
        List<Statement> statements = new ArrayList<Statement>();
        for (StatementContext statement : ctx.statement()) {
            statements.add(convert(statement, Statement.class));
        }
        return statements;
    }

    @Override
    public AstNode visitStatement(StatementContext ctx) {
        // exactly one child, the concrete statement production
        return ctx.getChild(0).accept(this);
    }

    @Override
    public AstNode visitDeclarationStatement(DeclarationStatementContext ctx) {
        QualifiedType type = convert(ctx.qualifiedType(), QualifiedType.class);
        Expression initializer = ctx.expression() != null ? convert(ctx.expression(), Expression.class) : null;
        return new DeclarationStatement(locationOf(ctx), new Identifier(ctx.IDENTIFIER().getText()),
                type, initializer);
    }

    @Override
    public AstNode visitExpressionStatement(ExpressionStatementContext ctx) {
        Expression left = ctx.left != null ? convert(ctx.left, Expression.class) : null;
        Expression right = convert(ctx.right, Expression.class);
        return new ExpressionStatement(locationOf(ctx), left, right);
    }

    @Override
    public AstNode visitSelectionStatement(SelectionStatementContext ctx) {
        Expression condition = convert(ctx.expression(), Expression.class);
        List<Statement> trueBody = convertBlock(ctx.trueBody);
        List<Statement> falseBody;
        if (ctx.falseBody != null) {
            falseBody = convertBlock(ctx.falseBody);
        } else if (ctx.selectionStatement() != null) {
            falseBody = Collections.<Statement>singletonList(
                    convert(ctx.selectionStatement(), SelectionStatement.class));
        } else {
            falseBody = Collections.emptyList();
        }
        return new SelectionStatement(locationOf(ctx), condition, trueBody, falseBody);
    }

    @Override
    public AstNode visitIterationStatement(IterationStatementContext ctx) {
        Expression index = convert(ctx.expression(), Expression.class);
        return new ForAllStatement(locationOf(ctx), index, convertBlock(ctx.block()));
    }

    @Override
    public AstNode visitReturnStatement(ReturnStatementContext ctx) {
        return new ReturnStatement(locationOf(ctx), convert(ctx.expression(), Expression.class));
    }

    // ============ Types ============

    @Override
    public AstNode visitQualifiedType(QualifiedTypeContext ctx) {
        TypeQualifier qualifier = TypeQualifier.fromKeyword(ctx.typeQualifier().getText());
        if (qualifier == null) {
            throw error("Unknown type qualifier '" + ctx.typeQualifier().getText() + "'", ctx.typeQualifier());
        }
        return new QualifiedType(locationOf(ctx), qualifier, convert(ctx.type(), Type.class));
    }

    @Override
    public AstNode visitIndexType(IndexTypeContext ctx) {
        if (ctx.dataType().INDEX() == null) {
            throw error("Range bounds are only valid on the 'index' type, found '"
                    + ctx.dataType().getText() + "'", ctx);
        }
        RangeContext range = ctx.range();
        Expression low = convert(range.low, Expression.class);
        Expression high = convert(range.high, Expression.class);
        Expression stride = range.stride != null ? convert(range.stride, Expression.class) : null;
        return new IndexType(locationOf(ctx), low, high, stride);
    }

    @Override
    public AstNode visitNumericalType(NumericalTypeContext ctx) {
        if (ctx.dataType().INDEX() != null) {
            throw error("Index type requires a range such as 'index[1:n]'", ctx);
        }
        DataType dataType = convert(ctx.dataType(), DataType.class);
        return new NumericalType(locationOf(ctx), dataType, convertExpressions(ctx.expressionList()));
    }

    @Override
    public AstNode visitTupleType(TupleTypeContext ctx) {
        List<Type> types = new ArrayList<Type>();
        for (TypeContext component : ctx.type()) {
            types.add(convert(component, Type.class));
        }
        return new TupleType(locationOf(ctx), types);
    }

    @Override
    public AstNode visitDataType(DataTypeContext ctx) {
        if (ctx.PRIMITIVE_DATA_TYPE() != null) {
            String keyword = ctx.PRIMITIVE_DATA_TYPE().getText();
            CoreDataType core = CoreDataType.fromKeyword(keyword);
            if (core == null) {
                throw error("Unknown data type '" + keyword + "'", ctx);
            }
            return new PrimitiveDataType(locationOf(ctx), core);
        }
        if (ctx.INDEX() != null) {
            throw error("'index' cannot be used as a data type here", ctx);
        }
        String spelling = ctx.IDENTIFIER().getText();
        Identifier template = lookupTemplate(spelling);
        if (template == null) {
            if (ctx.getParent() instanceof TemplateArgumentsContext
                    && ctx.getParent().getParent() instanceof FunctionExpressionContext) {
                String callee = ((FunctionExpressionContext) ctx.getParent().getParent()).identifierPath().getText();
                throw error("Undefined data type '" + spelling + "' in template arguments of call to '"
                        + callee + "'", ctx);
            }
            throw error("Undefined data type '" + spelling + "'", ctx);
        }
        return new TemplateDataType(locationOf(ctx), template);
    }

    private Identifier lookupTemplate(String spelling) {
        for (Map<String, Identifier> scope : templateScopes) {
            Identifier id = scope.get(spelling);
            if (id != null) {
                return id;
            }
        }
        return null;
    }

    // ============ Expressions ============

    @Override
    public AstNode visitParenthesizedExpression(ParenthesizedExpressionContext ctx) {
        return ctx.expression().accept(this);
    }

    @Override
    public AstNode visitUnaryExpression(UnaryExpressionContext ctx) {
        UnaryExpression.UnaryOp operator = UnaryExpression.UnaryOp.fromSource(ctx.op.getText());
        if (operator == null) {
            throw error("Unknown unary operator '" + ctx.op.getText() + "'", ctx.op);
        }
        return new UnaryExpression(locationOf(ctx), operator, convert(ctx.expression(), Expression.class));
    }

    @Override
    public AstNode visitBinaryExpression(BinaryExpressionContext ctx) {
        BinaryExpression.BinaryOp operator = BinaryExpression.BinaryOp.fromSource(ctx.op.getText());
        if (operator == null) {
            throw error("Unknown binary operator '" + ctx.op.getText() + "'", ctx.op);
        }
        Expression left = convert(ctx.expression(0), Expression.class);
        Expression right = convert(ctx.expression(1), Expression.class);
        return new BinaryExpression(locationOf(ctx), operator, left, right);
    }

    @Override
    public AstNode visitTernaryExpression(TernaryExpressionContext ctx) {
        Expression condition = convert(ctx.expression(0), Expression.class);
        Expression whenTrue = convert(ctx.expression(1), Expression.class);
        Expression whenFalse = convert(ctx.expression(2), Expression.class);
        return new TernaryExpression(locationOf(ctx), condition, whenTrue, whenFalse);
    }

    @Override
    public AstNode visitPrimitive(PrimitiveContext ctx) {
        return ctx.primitiveExpression().accept(this);
    }

    @Override
    public AstNode visitTupleAccessExpression(TupleAccessExpressionContext ctx) {
        Expression tuple = convert(ctx.primitiveExpression(), Expression.class);
        return new TupleAccessExpression(locationOf(ctx), tuple, tupleIndexOf(ctx.tupleIndex()));
    }

    private int tupleIndexOf(TupleIndexContext ctx) {
        // either DOT INT_LITERAL or a leading-dot float token such as ".1"
        String digits = ctx.INT_LITERAL() != null
                ? ctx.INT_LITERAL().getText()
                : ctx.FLOAT_LITERAL().getText().substring(1);
        if (!TUPLE_INDEX.matcher(digits).matches()) {
            throw error("Invalid tuple index '" + ctx.getText() + "', expected '.' followed by digits", ctx);
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new FhYSyntaxError("Tuple index out of range: " + digits, locationOf(ctx), e);
        }
    }

    @Override
    public AstNode visitArrayAccessExpression(ArrayAccessExpressionContext ctx) {
        Expression array = convert(ctx.primitiveExpression(), Expression.class);
        return new ArrayAccessExpression(locationOf(ctx), array, convertExpressions(ctx.expressionList()));
    }

    @Override
    public AstNode visitFunctionExpression(FunctionExpressionContext ctx) {
        IdentifierPathContext path = ctx.identifierPath();
        Expression function = new IdentifierExpression(locationOf(path), new Identifier(pathOf(path)));

        List<DataType> templateTypes = new ArrayList<DataType>();
        if (ctx.templateArguments() != null) {
            for (DataTypeContext templateType : ctx.templateArguments().dataType()) {
                templateTypes.add(convert(templateType, DataType.class));
            }
        }
        List<Expression> indices = ctx.indexArguments() != null
                ? convertExpressions(ctx.indexArguments().expressionList())
                : Collections.<Expression>emptyList();
        List<Expression> args = convertExpressions(ctx.expressionList());
        return new FunctionExpression(locationOf(ctx), function, templateTypes, indices, args);
    }

    @Override
    public AstNode visitIdentifierExpression(IdentifierExpressionContext ctx) {
        return new IdentifierExpression(locationOf(ctx), new Identifier(pathOf(ctx.identifierPath())));
    }

    @Override
    public AstNode visitTupleExpression(TupleExpressionContext ctx) {
        List<Expression> elements = new ArrayList<Expression>();
        for (ExpressionContext element : ctx.expression()) {
            elements.add(convert(element, Expression.class));
        }
        return new TupleExpression(locationOf(ctx), elements);
    }

    @Override
    public AstNode visitLiteralExpression(LiteralExpressionContext ctx) {
        return ctx.literal().accept(this);
    }

    @Override
    public AstNode visitLiteral(LiteralContext ctx) {
        SourceLocation location = locationOf(ctx);
        String text = ctx.getText();
        try {
            switch (ctx.getStart().getType()) {
                case FhYLexer.INT_LITERAL:
                    return new IntLiteral(location, LiteralParser.parseInt(text));
                case FhYLexer.FLOAT_LITERAL:
                    return new FloatLiteral(location, LiteralParser.parseFloat(text));
                case FhYLexer.COMPLEX_LITERAL:
                    return new ComplexLiteral(location, 0.0, LiteralParser.parseImaginary(text));
                default:
                    throw error("Unknown literal '" + text + "'", ctx);
            }
        } catch (LiteralError e) {
            throw e.at(location);
        }
    }

    private List<Expression> convertExpressions(ExpressionListContext ctx) {
        if (ctx == null) {
            return Collections.emptyList();
        }
        List<Expression> expressions = new ArrayList<Expression>();
        for (ExpressionContext expression : ctx.expression()) {
            expressions.add(convert(expression, Expression.class));
        }
        return expressions;
    }

    // ============ Helpers ============

    private <T extends AstNode> T convert(ParserRuleContext ctx, Class<T> kind) {
        AstNode node = ctx.accept(this);
        if (!kind.isInstance(node)) {
            throw new IllegalStateException("Expected " + kind.getSimpleName() + " for '" + textOf(ctx)
                    + "', got " + (node == null ? "nothing" : node.getClass().getSimpleName()));
        }
        return kind.cast(node);
    }

    private static String pathOf(IdentifierPathContext ctx) {
        StringBuilder sb = new StringBuilder();
        for (TerminalNode part : ctx.IDENTIFIER()) {
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(part.getText());
        }
        return sb.toString();
    }

    private static Identifier aliasOf(Token alias) {
        return alias != null ? new Identifier(alias.getText()) : null;
    }

    /** Source text of a production with its tokens separated by single spaces. */
    private static String textOf(ParserRuleContext ctx) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < ctx.getChildCount(); i++) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(ctx.getChild(i).getText());
        }
        return sb.toString();
    }

    private SourceLocation locationOf(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop() != null ? ctx.getStop() : start;
        if (stop.getTokenIndex() < start.getTokenIndex()) {
            stop = start;  // empty production
        }
        return new SourceLocation(fileName, start.getLine(), start.getCharPositionInLine() + 1,
                stop.getLine(), stop.getCharPositionInLine() + 1 + tokenLength(stop));
    }

    private SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getCharPositionInLine() + 1,
                token.getLine(), token.getCharPositionInLine() + 1 + tokenLength(token));
    }

    private static int tokenLength(Token token) {
        if (token.getType() == Token.EOF || token.getText() == null) {
            return 0;
        }
        return token.getText().length();
    }

    private FhYSyntaxError error(String message, ParserRuleContext ctx) {
        return new FhYSyntaxError(message, locationOf(ctx));
    }

    private FhYSyntaxError error(String message, Token token) {
        return new FhYSyntaxError(message, locationOf(token));
    }
}
