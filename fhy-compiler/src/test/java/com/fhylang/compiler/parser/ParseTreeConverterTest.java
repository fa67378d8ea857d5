package com.fhylang.compiler.parser;

import com.fhylang.compiler.ast.AstNode;
import com.fhylang.compiler.ast.Identifier;
import com.fhylang.compiler.ast.SourceLocation;
import com.fhylang.compiler.ast.decl.*;
import com.fhylang.compiler.ast.decl.Module;
import com.fhylang.compiler.ast.expr.*;
import com.fhylang.compiler.ast.stmt.*;
import com.fhylang.compiler.ast.type.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parse tree to AST conversion tests
 */
class ParseTreeConverterTest {

    private Module parse(String source) {
        return new SourceParser(source, "<test>").parse();
    }

    private Statement single(String source) {
        Module module = parse(source);
        assertEquals(1, module.getStatements().size());
        return module.getStatements().get(0);
    }

    private Expression initializer(String source) {
        Statement statement = single(source);
        assertInstanceOf(DeclarationStatement.class, statement);
        return ((DeclarationStatement) statement).getExpression();
    }

    private Expression rightHandSide(String source) {
        Statement statement = single(source);
        assertInstanceOf(ExpressionStatement.class, statement);
        return ((ExpressionStatement) statement).getRight();
    }

    // Identifier references are compared by name hint: scoped lookup is not part of conversion.
    private static void assertIdentifier(String expectedHint, Expression expression) {
        assertInstanceOf(IdentifierExpression.class, expression);
        assertEquals(expectedHint, ((IdentifierExpression) expression).getIdentifier().getNameHint());
    }

    private static void assertIntLiteral(long expected, Expression expression) {
        assertInstanceOf(IntLiteral.class, expression);
        assertEquals(expected, ((IntLiteral) expression).getValue());
    }

    private static void assertShape(List<Expression> shape, String... expectedHints) {
        assertEquals(expectedHints.length, shape.size());
        for (int i = 0; i < expectedHints.length; i++) {
            assertIdentifier(expectedHints[i], shape.get(i));
        }
    }

    private static NumericalType assertNumericalType(Type type, CoreDataType expectedCore) {
        assertInstanceOf(NumericalType.class, type);
        NumericalType numerical = (NumericalType) type;
        assertInstanceOf(PrimitiveDataType.class, numerical.getDataType());
        assertEquals(expectedCore, ((PrimitiveDataType) numerical.getDataType()).getCoreDataType());
        return numerical;
    }

    // ============ Module ============

    @Nested
    @DisplayName("Module")
    class ModuleTests {

        @Test
        @DisplayName("empty source gives an empty module")
        void testEmptySource() {
            assertTrue(parse("").getStatements().isEmpty());
        }

        @Test
        @DisplayName("a lone comment gives an empty module")
        void testLineComment() {
            assertTrue(parse("# this is a comment!").getStatements().isEmpty());
        }

        @Test
        @DisplayName("statements keep source order")
        void testStatementOrder() {
            Module module = parse("import a; temp int32 x; proc p() {} x = 1;");
            assertEquals(4, module.getStatements().size());
            assertInstanceOf(Import.class, module.getStatements().get(0));
            assertInstanceOf(DeclarationStatement.class, module.getStatements().get(1));
            assertInstanceOf(Procedure.class, module.getStatements().get(2));
            assertInstanceOf(ExpressionStatement.class, module.getStatements().get(3));
        }

        @Test
        @DisplayName("procedure after a comment line starts on line 2, column 1")
        void testLocationAfterComment() {
            Statement proc = single("# this is a comment!\nproc foo(input int32[m,n] A) {}");
            assertInstanceOf(Procedure.class, proc);
            SourceLocation location = proc.getLocation();
            assertEquals(2, location.getStartLine());
            assertEquals(1, location.getStartColumn());
            assertEquals("<test>", location.getFile());
        }

        @Test
        @DisplayName("spans cover the whole production")
        void testSpanEnd() {
            Statement statement = single("temp int32 abc;");
            SourceLocation location = statement.getLocation();
            assertEquals(1, location.getStartLine());
            assertEquals(1, location.getStartColumn());
            assertEquals(1, location.getEndLine());
            assertEquals(16, location.getEndColumn());
        }
    }

    // ============ Procedures and operations ============

    @Nested
    @DisplayName("Procedures and operations")
    class FunctionTests {

        @ParameterizedTest
        @ValueSource(strings = {"proc foo(){}", "proc foo<>() {}", "proc foo[]() {}", "proc foo<>[]() {}"})
        @DisplayName("empty procedure")
        void testEmptyProcedure(String source) {
            Statement statement = single(source);
            assertInstanceOf(Procedure.class, statement);
            Procedure proc = (Procedure) statement;
            assertEquals("foo", proc.getName().getNameHint());
            assertTrue(proc.getTemplates().isEmpty());
            assertTrue(proc.getIndices().isEmpty());
            assertTrue(proc.getArgs().isEmpty());
            assertTrue(proc.getBody().isEmpty());
            assertEquals("proc", proc.getKeyword());
        }

        @ParameterizedTest
        @ValueSource(strings = {"x", "arg", "arg1", "arg_1", "importer", "from_there", "astype", "tuples",
                "indexed", "proctor", "operator", "natives", "reduction", "if_true", "else_if", "return_value"})
        @DisplayName("argument names, including keyword-like names")
        void testArgumentNames(String name) {
            Procedure proc = (Procedure) single("proc foo(input int32 " + name + "){}");
            assertEquals(1, proc.getArgs().size());
            Argument arg = proc.getArgs().get(0);
            assertEquals(name, arg.getName().getNameHint());
            assertEquals(TypeQualifier.INPUT, arg.getQualifiedType().getTypeQualifier());
            NumericalType type = assertNumericalType(arg.getQualifiedType().getBaseType(), CoreDataType.INT32);
            assertTrue(type.isScalar());
        }

        @Test
        @DisplayName("argument with shape")
        void testArgumentShape() {
            Procedure proc = (Procedure) single("proc foo(input int32[m, n] x){}");
            Argument arg = proc.getArgs().get(0);
            assertEquals("x", arg.getName().getNameHint());
            NumericalType type = assertNumericalType(arg.getQualifiedType().getBaseType(), CoreDataType.INT32);
            assertShape(type.getShape(), "m", "n");
        }

        @Test
        @DisplayName("trailing comma in argument list")
        void testTrailingComma() {
            Procedure proc = (Procedure) single("proc foo(input int32 a, output float32 b,){}");
            assertEquals(2, proc.getArgs().size());
            assertEquals(TypeQualifier.OUTPUT, proc.getArgs().get(1).getQualifiedType().getTypeQualifier());
        }

        @Test
        @DisplayName("index parameters")
        void testIndexParameters() {
            Procedure proc = (Procedure) single("proc foo[i, j](input int32[i, j] A){}");
            assertEquals(2, proc.getIndices().size());
            assertEquals("i", proc.getIndices().get(0).getNameHint());
            assertEquals("j", proc.getIndices().get(1).getNameHint());
        }

        @ParameterizedTest
        @ValueSource(strings = {"op foo() -> output int32 {}", "op foo<>() -> output int32 {}",
                "op foo[]() -> output int32 {}", "op foo<>[]() -> output int32 {}"})
        @DisplayName("empty operation")
        void testEmptyOperation(String source) {
            Statement statement = single(source);
            assertInstanceOf(Operation.class, statement);
            Operation op = (Operation) statement;
            assertEquals("foo", op.getName().getNameHint());
            assertTrue(op.getArgs().isEmpty());
            assertTrue(op.getBody().isEmpty());
            assertEquals("op", op.getKeyword());
        }

        @Test
        @DisplayName("operation return type")
        void testOperationReturnType() {
            Operation op = (Operation) single("op foo(input int32[n, m] x) -> output int32[n, m] {}");
            NumericalType argType = assertNumericalType(
                    op.getArgs().get(0).getQualifiedType().getBaseType(), CoreDataType.INT32);
            assertShape(argType.getShape(), "n", "m");

            QualifiedType returnType = op.getReturnType();
            assertEquals(TypeQualifier.OUTPUT, returnType.getTypeQualifier());
            NumericalType returnBase = assertNumericalType(returnType.getBaseType(), CoreDataType.INT32);
            assertShape(returnBase.getShape(), "n", "m");
        }

        @ParameterizedTest
        @ValueSource(strings = {"T", "T, K", "V, Ex, F"})
        @DisplayName("template parameters")
        void testTemplateParameters(String templates) {
            Operation op = (Operation) single("op foo<" + templates + ">(input int32[n, m] x) -> output int32[n, m] {}");
            String[] names = templates.split(", ");
            assertEquals(names.length, op.getTemplates().size());
            for (int i = 0; i < names.length; i++) {
                assertEquals(names[i], op.getTemplates().get(i).getDataType().getNameHint());
            }
        }

        @Test
        @DisplayName("template uses in body share the declared identifier")
        void testTemplateIdentityInBody() {
            Operation op = (Operation) single("op foo<T>(input T[n, m] x) -> output int32[n, m] {temp T[n, m] A;}");
            TemplateDataType template = op.getTemplates().get(0);
            DeclarationStatement decl = (DeclarationStatement) op.getBody().get(0);
            NumericalType numerical = (NumericalType) decl.getVariableType().getBaseType();
            assertInstanceOf(TemplateDataType.class, numerical.getDataType());
            TemplateDataType use = (TemplateDataType) numerical.getDataType();
            assertEquals(template.getDataType().getId(), use.getDataType().getId());
            assertTrue(template.isSameParameter(use));
        }

        @Test
        @DisplayName("template uses in arguments and call template arguments share the declared identifier")
        void testTemplateIdentityInCall() {
            Procedure proc = (Procedure) single("proc foo<T>(input T[m,n] A) { bar<T>(); }");
            Identifier declared = proc.getTemplates().get(0).getDataType();

            NumericalType argType = (NumericalType) proc.getArgs().get(0).getQualifiedType().getBaseType();
            assertEquals(declared, ((TemplateDataType) argType.getDataType()).getDataType());

            ExpressionStatement call = (ExpressionStatement) proc.getBody().get(0);
            FunctionExpression function = (FunctionExpression) call.getRight();
            assertEquals(1, function.getTemplateTypes().size());
            assertEquals(declared, ((TemplateDataType) function.getTemplateTypes().get(0)).getDataType());
        }

        @Test
        @DisplayName("each declaration gets its own template identifiers")
        void testTemplateScopesAreSeparate() {
            Module module = parse("proc a<T>(input T x) {} proc b<T>(input T y) {}");
            Identifier first = ((Procedure) module.getStatements().get(0)).getTemplates().get(0).getDataType();
            Identifier second = ((Procedure) module.getStatements().get(1)).getTemplates().get(0).getDataType();
            assertNotEquals(first, second);
        }

        @Test
        @DisplayName("distinct declarations get distinct identifiers")
        void testDistinctIds() {
            Procedure proc = (Procedure) single("proc foo(input int32 a, input int32 b) {}");
            assertNotEquals(proc.getArgs().get(0).getName().getId(), proc.getArgs().get(1).getName().getId());
            assertNotEquals(proc.getName().getId(), proc.getArgs().get(0).getName().getId());
        }
    }

    // ============ Statements ============

    @Nested
    @DisplayName("Statements")
    class StatementTests {

        @Test
        @DisplayName("absolute import")
        void testAbsoluteImport() {
            Import imp = (Import) single("import foo.bar;");
            assertEquals("foo.bar", imp.getName().getNameHint());
            assertFalse(imp.hasAlias());
        }

        @Test
        @DisplayName("import with alias")
        void testImportAlias() {
            Import imp = (Import) single("import foo.bar as baz;");
            assertEquals("foo.bar", imp.getName().getNameHint());
            assertEquals("baz", imp.getAlias().getNameHint());
        }

        @Test
        @DisplayName("from-import joins path and member")
        void testFromImport() {
            Import imp = (Import) single("from foo.bar import baz;");
            assertEquals("foo.bar.baz", imp.getName().getNameHint());
        }

        @Test
        @DisplayName("declaration without initializer")
        void testDeclarationWithoutAssignment() {
            DeclarationStatement decl = (DeclarationStatement) single("temp int32 i;");
            assertEquals("i", decl.getVariableName().getNameHint());
            assertFalse(decl.hasExpression());
            assertEquals(TypeQualifier.TEMP, decl.getVariableType().getTypeQualifier());
            NumericalType type = assertNumericalType(decl.getVariableType().getBaseType(), CoreDataType.INT32);
            assertTrue(type.getShape().isEmpty());
        }

        @Test
        @DisplayName("declaration with initializer")
        void testDeclarationWithAssignment() {
            DeclarationStatement decl = (DeclarationStatement) single("state float64 x = 1;");
            assertEquals(TypeQualifier.STATE, decl.getVariableType().getTypeQualifier());
            assertIntLiteral(1, decl.getExpression());
        }

        @Test
        @DisplayName("expression statement without assignment")
        void testExpressionStatement() {
            ExpressionStatement statement = (ExpressionStatement) single("5 + 5;");
            assertNull(statement.getLeft());
            assertFalse(statement.isAssignment());
            assertInstanceOf(BinaryExpression.class, statement.getRight());
        }

        @Test
        @DisplayName("expression statement with assignment")
        void testAssignment() {
            ExpressionStatement statement = (ExpressionStatement) single("A = 5 + 5;");
            assertIdentifier("A", statement.getLeft());
            assertInstanceOf(BinaryExpression.class, statement.getRight());
        }

        @Test
        @DisplayName("if/else")
        void testSelection() {
            SelectionStatement statement = (SelectionStatement) single("if (1) {i = 1;} else {j = 1;}");
            assertIntLiteral(1, statement.getCondition());
            assertEquals(1, statement.getTrueBody().size());
            assertEquals(1, statement.getFalseBody().size());
        }

        @Test
        @DisplayName("if without else has an empty false body")
        void testSelectionWithoutElse() {
            SelectionStatement statement = (SelectionStatement) single("if (x) {}");
            assertTrue(statement.getFalseBody().isEmpty());
            assertFalse(statement.hasElse());
        }

        @Test
        @DisplayName("else-if nests a selection in the false body")
        void testElseIf() {
            SelectionStatement statement = (SelectionStatement) single("if (a) {} else if (b) {x = 1;} else {}");
            assertEquals(1, statement.getFalseBody().size());
            SelectionStatement nested = (SelectionStatement) statement.getFalseBody().get(0);
            assertIdentifier("b", nested.getCondition());
            assertEquals(1, nested.getTrueBody().size());
        }

        @Test
        @DisplayName("forall")
        void testForAll() {
            ForAllStatement statement = (ForAllStatement) single("forall (i) {}");
            assertIdentifier("i", statement.getIndex());
            assertTrue(statement.getBody().isEmpty());
        }

        @Test
        @DisplayName("return")
        void testReturn() {
            ReturnStatement statement = (ReturnStatement) single("return i;");
            assertIdentifier("i", statement.getExpression());
        }
    }

    // ============ Expressions ============

    @Nested
    @DisplayName("Expressions")
    class ExpressionTests {

        @ParameterizedTest
        @EnumSource(UnaryExpression.UnaryOp.class)
        @DisplayName("unary operators")
        void testUnary(UnaryExpression.UnaryOp operator) {
            Expression expression = initializer("temp int32 i = " + operator.toSourceString() + "5;");
            assertInstanceOf(UnaryExpression.class, expression);
            UnaryExpression unary = (UnaryExpression) expression;
            assertEquals(operator, unary.getOperator());
            assertIntLiteral(5, unary.getOperand());
        }

        @ParameterizedTest
        @EnumSource(BinaryExpression.BinaryOp.class)
        @DisplayName("binary operators")
        void testBinary(BinaryExpression.BinaryOp operator) {
            Expression expression = initializer("temp float32 i = 5 " + operator.toSourceString() + " 6;");
            assertInstanceOf(BinaryExpression.class, expression);
            BinaryExpression binary = (BinaryExpression) expression;
            assertEquals(operator, binary.getOperator());
            assertIntLiteral(5, binary.getLeft());
            assertIntLiteral(6, binary.getRight());
        }

        @Test
        @DisplayName("multiplication binds tighter than addition")
        void testPrecedence() {
            BinaryExpression sum = (BinaryExpression) rightHandSide("1 + 2 * 3;");
            assertEquals(BinaryExpression.BinaryOp.ADD, sum.getOperator());
            assertIntLiteral(1, sum.getLeft());
            assertEquals(BinaryExpression.BinaryOp.MULTIPLY,
                    ((BinaryExpression) sum.getRight()).getOperator());
        }

        @Test
        @DisplayName("subtraction is left-associative")
        void testLeftAssociativity() {
            BinaryExpression outer = (BinaryExpression) rightHandSide("a - b - c;");
            assertIdentifier("c", outer.getRight());
            BinaryExpression inner = (BinaryExpression) outer.getLeft();
            assertIdentifier("a", inner.getLeft());
            assertIdentifier("b", inner.getRight());
        }

        @Test
        @DisplayName("power is right-associative")
        void testRightAssociativity() {
            BinaryExpression outer = (BinaryExpression) rightHandSide("a ** b ** c;");
            assertIdentifier("a", outer.getLeft());
            assertInstanceOf(BinaryExpression.class, outer.getRight());
        }

        @Test
        @DisplayName("parentheses override precedence and leave no node behind")
        void testParentheses() {
            BinaryExpression product = (BinaryExpression) rightHandSide("(1 + 2) * 3;");
            assertEquals(BinaryExpression.BinaryOp.MULTIPLY, product.getOperator());
            assertEquals(BinaryExpression.BinaryOp.ADD, ((BinaryExpression) product.getLeft()).getOperator());
        }

        @Test
        @DisplayName("tuple and array access apply to parenthesized operands")
        void testAccessOnParentheses() {
            TupleAccessExpression plain = (TupleAccessExpression) rightHandSide("x = (a).1;");
            assertEquals(1, plain.getElementIndex());
            assertIdentifier("a", plain.getTupleExpression());

            TupleAccessExpression sum = (TupleAccessExpression) rightHandSide("x = (a + b).0;");
            assertEquals(0, sum.getElementIndex());
            assertEquals(BinaryExpression.BinaryOp.ADD, ((BinaryExpression) sum.getTupleExpression()).getOperator());

            ArrayAccessExpression element = (ArrayAccessExpression) rightHandSide("x = (-a)[i];");
            assertInstanceOf(UnaryExpression.class, element.getArrayExpression());
            assertIdentifier("i", element.getIndices().get(0));
        }

        @Test
        @DisplayName("ternary")
        void testTernary() {
            Expression expression = initializer("temp float32 i = 5 < 6 ? 7 : 8;");
            assertInstanceOf(TernaryExpression.class, expression);
            TernaryExpression ternary = (TernaryExpression) expression;
            assertInstanceOf(BinaryExpression.class, ternary.getCondition());
            assertIntLiteral(7, ternary.getTrueExpression());
            assertIntLiteral(8, ternary.getFalseExpression());
        }

        @ParameterizedTest
        @ValueSource(strings = {"A", "A1", "A_"})
        @DisplayName("tuple access on an identifier")
        void testTupleAccess(String name) {
            ExpressionStatement statement = (ExpressionStatement) single("x = " + name + ".1;");
            assertIdentifier("x", statement.getLeft());
            TupleAccessExpression access = (TupleAccessExpression) statement.getRight();
            assertEquals(1, access.getElementIndex());
            assertIdentifier(name, access.getTupleExpression());
        }

        @Test
        @DisplayName("tuple access on a call result")
        void testTupleAccessOnCall() {
            TupleAccessExpression access = (TupleAccessExpression) rightHandSide("x = f().1;");
            assertEquals(1, access.getElementIndex());
            FunctionExpression call = (FunctionExpression) access.getTupleExpression();
            assertIdentifier("f", call.getFunction());
        }

        @Test
        @DisplayName("chained tuple access")
        void testChainedTupleAccess() {
            TupleAccessExpression outer = (TupleAccessExpression) rightHandSide("x = t.0.12;");
            assertEquals(12, outer.getElementIndex());
            TupleAccessExpression inner = (TupleAccessExpression) outer.getTupleExpression();
            assertEquals(0, inner.getElementIndex());
        }

        @ParameterizedTest
        @CsvSource({
                "'temp int32 i = foo();', 0, foo",
                "'temp int32 i = foo(A);', 1, foo",
                "'temp int32 i = module.method();', 0, module.method",
                "'temp int32 i = module.method(A);', 1, module.method",
                "'temp int32 i = foo[]();', 0, foo",
                "'temp int32 i = foo[](A);', 1, foo",
                "'temp int32 i = module.method[]();', 0, module.method",
                "'temp int32 i = module.method[](A);', 1, module.method",
                "'temp int32 i = foo<>();', 0, foo",
                "'temp int32 i = foo<>(A);', 1, foo",
                "'temp int32 i = module.method<>();', 0, module.method",
                "'temp int32 i = module.method<>(A);', 1, module.method",
                "'temp int32 i = foo<>[]();', 0, foo",
                "'temp int32 i = foo<>[](A);', 1, foo",
                "'temp int32 i = module.method<>[]();', 0, module.method",
                "'temp int32 i = module.method<>[](A);', 1, module.method"
        })
        @DisplayName("function call forms")
        void testFunctionExpression(String source, int argCount, String name) {
            Expression expression = initializer(source);
            assertInstanceOf(FunctionExpression.class, expression);
            FunctionExpression call = (FunctionExpression) expression;
            assertIdentifier(name, call.getFunction());
            assertTrue(call.getTemplateTypes().isEmpty());
            assertTrue(call.getIndices().isEmpty());
            assertEquals(argCount, call.getArgs().size());
            if (argCount > 0) {
                assertIdentifier("A", call.getArgs().get(0));
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {"foo();", "foo<>();", "foo[]();", "foo<>[]();",
                "module.method();", "module.method[]();", "module.method<>();", "module.method<>[]();"})
        @DisplayName("function call as a statement")
        void testFunctionExpressionStatement(String source) {
            ExpressionStatement statement = (ExpressionStatement) single(source);
            assertNull(statement.getLeft());
            assertInstanceOf(FunctionExpression.class, statement.getRight());
        }

        @Test
        @DisplayName("call with index arguments and primitive template arguments")
        void testCallWithIndicesAndTemplates() {
            FunctionExpression call = (FunctionExpression) rightHandSide("foo<float32>[i, j](A, B);");
            assertEquals(1, call.getTemplateTypes().size());
            assertEquals(CoreDataType.FLOAT32,
                    ((PrimitiveDataType) call.getTemplateTypes().get(0)).getCoreDataType());
            assertEquals(2, call.getIndices().size());
            assertIdentifier("i", call.getIndices().get(0));
            assertEquals(2, call.getArgs().size());
        }

        @Test
        @DisplayName("array access")
        void testArrayAccess() {
            ExpressionStatement statement = (ExpressionStatement) single("A[i] = 1;");
            ArrayAccessExpression access = (ArrayAccessExpression) statement.getLeft();
            assertIdentifier("A", access.getArrayExpression());
            assertEquals(1, access.getIndices().size());
            assertIdentifier("i", access.getIndices().get(0));
            assertIntLiteral(1, statement.getRight());
        }

        @Test
        @DisplayName("single-element tuple")
        void testTupleExpression() {
            ExpressionStatement statement = (ExpressionStatement) single("b = (a,);");
            assertIdentifier("b", statement.getLeft());
            TupleExpression tuple = (TupleExpression) statement.getRight();
            assertEquals(1, tuple.getExpressions().size());
            assertIdentifier("a", tuple.getExpressions().get(0));
        }

        @Test
        @DisplayName("multi-element tuple")
        void testMultiTupleExpression() {
            TupleExpression tuple = (TupleExpression) rightHandSide("b = (1, 2, 3);");
            assertEquals(3, tuple.getExpressions().size());
        }
    }

    // ============ Types ============

    @Nested
    @DisplayName("Types")
    class TypeTests {

        @Test
        @DisplayName("index type")
        void testIndexType() {
            DeclarationStatement decl = (DeclarationStatement) single("temp index[1:m] i;");
            assertEquals(TypeQualifier.TEMP, decl.getVariableType().getTypeQualifier());
            IndexType index = (IndexType) decl.getVariableType().getBaseType();
            assertIntLiteral(1, index.getLowerBound());
            assertIdentifier("m", index.getUpperBound());
            assertNull(index.getStride());
            assertFalse(index.hasStride());
        }

        @Test
        @DisplayName("index type with stride")
        void testIndexTypeWithStride() {
            DeclarationStatement decl = (DeclarationStatement) single("param index[0:n:2] i;");
            IndexType index = (IndexType) decl.getVariableType().getBaseType();
            assertIntLiteral(2, index.getStride());
        }

        @ParameterizedTest
        @ValueSource(strings = {"output tuple[int32[m, n], int32] i;", "output tuple[int32[m, n], int32,] i;"})
        @DisplayName("tuple type")
        void testTupleType(String source) {
            DeclarationStatement decl = (DeclarationStatement) single(source);
            assertEquals("i", decl.getVariableName().getNameHint());
            assertEquals(TypeQualifier.OUTPUT, decl.getVariableType().getTypeQualifier());
            TupleType tuple = (TupleType) decl.getVariableType().getBaseType();
            assertEquals(2, tuple.getTypes().size());
            assertShape(assertNumericalType(tuple.getTypes().get(0), CoreDataType.INT32).getShape(), "m", "n");
            assertTrue(assertNumericalType(tuple.getTypes().get(1), CoreDataType.INT32).isScalar());
        }

        @ParameterizedTest
        @EnumSource(CoreDataType.class)
        @DisplayName("every primitive data type keyword")
        void testPrimitiveDataTypes(CoreDataType core) {
            DeclarationStatement decl = (DeclarationStatement) single("temp " + core.getKeyword() + " x;");
            assertNumericalType(decl.getVariableType().getBaseType(), core);
        }

        @ParameterizedTest
        @EnumSource(TypeQualifier.class)
        @DisplayName("every type qualifier keyword")
        void testQualifiers(TypeQualifier qualifier) {
            DeclarationStatement decl = (DeclarationStatement) single(qualifier.getKeyword() + " int8 x;");
            assertEquals(qualifier, decl.getVariableType().getTypeQualifier());
        }
    }

    // ============ Literals ============

    @Nested
    @DisplayName("Literals")
    class LiteralTests {

        @ParameterizedTest
        @CsvSource({"'1;', 1", "'0b0101;', 5", "'0B01;', 1", "'0x1;', 1", "'0XFF;', 255",
                "'0o1;', 1", "'0O7;', 7", "'1_000;', 1000"})
        @DisplayName("integer literal forms")
        void testIntLiteral(String source, long value) {
            assertIntLiteral(value, rightHandSide(source));
        }

        @ParameterizedTest
        @CsvSource({"'1.0;', 1.0", "'.2;', 0.2", "' 1.;', 1.0", "' 1e2;', 100.0", "'1.2e3;', 1200.0"})
        @DisplayName("float literal forms")
        void testFloatLiteral(String source, double value) {
            Expression expression = rightHandSide(source);
            assertInstanceOf(FloatLiteral.class, expression);
            assertEquals(value, ((FloatLiteral) expression).getValue(), 1e-12);
        }

        @ParameterizedTest
        @CsvSource({"'1.0j;', 1.0", "'1j;', 1.0", "'1e10j;', 1e10", "'0.2j;', 0.2", "'.2j;', 0.2"})
        @DisplayName("complex literal forms")
        void testComplexLiteral(String source, double imaginary) {
            Expression expression = rightHandSide(source);
            assertInstanceOf(ComplexLiteral.class, expression);
            ComplexLiteral complex = (ComplexLiteral) expression;
            assertEquals(0.0, complex.getReal());
            assertEquals(imaginary, complex.getImaginary(), 1e-12);
        }

        @Test
        @DisplayName("out-of-range integer literal reports its position")
        void testIntegerOverflow() {
            LiteralError error = assertThrows(LiteralError.class, () -> parse("x = 99999999999999999999;"));
            assertEquals("99999999999999999999", error.getLiteral());
            assertEquals(1, error.getLocation().getStartLine());
            assertEquals(5, error.getLocation().getStartColumn());
        }
    }

    // ============ Errors ============

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        private FhYSyntaxError assertSyntaxError(String source) {
            return assertThrows(FhYSyntaxError.class, () -> parse(source));
        }

        @Test
        @DisplayName("argument without a name")
        void testArgumentWithoutName() {
            FhYSyntaxError error = assertSyntaxError("op foo(input int32[m,n]) -> output int32 {}");
            assertTrue(error.getMessage().contains("missing a name"));
        }

        @Test
        @DisplayName("procedure without a name")
        void testProcedureWithoutName() {
            assertSyntaxError("proc () {}");
        }

        @Test
        @DisplayName("operation without a name")
        void testOperationWithoutName() {
            assertSyntaxError("op (input int32[m,n] A) -> output int32 {}");
        }

        @Test
        @DisplayName("operation without a return type")
        void testOperationWithoutReturnType() {
            FhYSyntaxError error = assertSyntaxError("op func(input int32[m,n] A) {}");
            assertTrue(error.getMessage().contains("return type"));
        }

        @Test
        @DisplayName("procedure with a return type")
        void testProcedureWithReturnType() {
            assertSyntaxError("proc func(input int32 A) -> output int32 {}");
        }

        @Test
        @DisplayName("invalid function keyword")
        void testInvalidKeyword() {
            FhYSyntaxError error = assertSyntaxError("def foo(input int32[m,n] A) -> output int32[m,n] {}");
            assertTrue(error.getMessage().contains("'def'"));
            assertEquals(1, error.getLocation().getStartColumn());
        }

        @ParameterizedTest
        @ValueSource(strings = {"lorem ipsum dolor sit amet;", "lorem ipsum dolor sit amet"})
        @DisplayName("gibberish")
        void testGibberish(String source) {
            assertSyntaxError(source);
        }

        @Test
        @DisplayName("undeclared template type")
        void testUndeclaredTemplate() {
            FhYSyntaxError error = assertSyntaxError("proc foo(input T x) {}");
            assertTrue(error.getMessage().contains("'T'"));
        }

        @Test
        @DisplayName("template name outside its declaration")
        void testTemplateOutOfScope() {
            assertSyntaxError("proc foo<T>(input T x) {} temp T y;");
        }

        @Test
        @DisplayName("duplicate template parameter")
        void testDuplicateTemplate() {
            assertSyntaxError("proc foo<T, T>() {}");
        }

        @Test
        @DisplayName("range on a non-index type")
        void testRangeOnNumericalType() {
            assertSyntaxError("temp int32[1:n] x;");
        }

        @Test
        @DisplayName("index type without a range")
        void testIndexWithoutRange() {
            assertSyntaxError("temp index x;");
        }

        @Test
        @DisplayName("comparison chain read as a call names the callee")
        void testComparisonReadAsCall() {
            FhYSyntaxError error = assertSyntaxError("x = a < b > (c);");
            assertTrue(error.getMessage().contains("Undefined data type 'b' in template arguments of call to 'a'"));
        }

        @Test
        @DisplayName("tuple index with an exponent")
        void testTupleIndexWithExponent() {
            assertSyntaxError("x = a.1e2;");
        }

        @Test
        @DisplayName("unexpected character")
        void testLexerError() {
            FhYSyntaxError error = assertSyntaxError("x = 1 @ 2;");
            assertEquals(1, error.getLocation().getStartLine());
            assertEquals(7, error.getLocation().getStartColumn());
        }

        @Test
        @DisplayName("error message carries the position")
        void testMessagePosition() {
            FhYSyntaxError error = assertSyntaxError("\n\nproc () {}");
            assertEquals(3, error.getLocation().getStartLine());
            assertTrue(error.getMessage().contains("line 3"));
        }
    }

    // ============ Converter entry point ============

    @Test
    @DisplayName("converter accepts a parse tree built by the caller")
    void testConverterDirectly() {
        FhYLexer lexer = new FhYLexer(org.antlr.v4.runtime.CharStreams.fromString("temp int32 x;"));
        FhYParser parser = new FhYParser(new org.antlr.v4.runtime.CommonTokenStream(lexer));
        AstNode node = new ParseTreeConverter("direct.fhy").convert(parser.module());
        assertInstanceOf(Module.class, node);
        assertEquals("direct.fhy", node.getLocation().getFile());
    }
}
