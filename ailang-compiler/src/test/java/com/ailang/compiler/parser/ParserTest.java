package com.ailang.compiler.parser;

import com.ailang.compiler.Diagnostic;
import com.ailang.compiler.ast.decl.FunctionDef;
import com.ailang.compiler.ast.decl.Program;
import com.ailang.compiler.ast.expr.*;
import com.ailang.compiler.ast.stmt.*;
import com.ailang.compiler.lexer.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Program parse(String source) {
        return new Parser(new Lexer(source, "test.ai"), "test.ai").parse();
    }

    /** 解析顶层语句，返回合成入口函数的语句列表 */
    private List<Statement> statements(String source) {
        Program program = parse(source);
        FunctionDef main = program.getFunctions().get(program.getFunctions().size() - 1);
        assertTrue(main.isSynthetic(), "Expected synthetic entry function");
        return main.getBody();
    }

    /** 解析单个表达式语句 */
    private Expression expr(String source) {
        List<Statement> stmts = statements(source);
        assertEquals(1, stmts.size());
        Statement stmt = stmts.get(0);
        if (stmt instanceof AssignStmt) {
            return ((AssignStmt) stmt).getValue();
        }
        return ((ExpressionStmt) stmt).getExpression();
    }

    private ParseException parseError(String source) {
        return assertThrows(ParseException.class, () -> parse(source));
    }

    // ================================================================
    // 函数
    // ================================================================

    @Nested
    @DisplayName("函数定义")
    class FunctionTests {

        @Test
        @DisplayName("def 与 func 产生相同的结构")
        void testIntroducerSynonyms() {
            Program a = parse("def f(x, y): return x; end");
            Program b = parse("func f(x, y): return x; end");
            FunctionDef fa = a.getFunctions().get(0);
            FunctionDef fb = b.getFunctions().get(0);
            assertEquals(fa.getName(), fb.getName());
            assertEquals(List.of("x", "y"), fa.getParams());
            assertEquals(fa.getParams(), fb.getParams());
            assertEquals(1, fa.getBody().size());
            assertEquals(1, fb.getBody().size());
            assertFalse(fa.isSynthetic());
        }

        @Test
        @DisplayName("类型注解被忽略")
        void testTypeAnnotations() {
            FunctionDef f = parse("def f(a: int, b: list[str]) -> None:\n    return a\nend")
                    .getFunctions().get(0);
            assertEquals(List.of("a", "b"), f.getParams());
        }

        @Test
        @DisplayName("pass 作为块结束符")
        void testPassCloses() {
            Program program = parse("def f():\n    x = 1\n    pass\ndef g():\n    pass\n");
            assertEquals(2, program.getFunctions().size());
            assertEquals(2, program.getFunctions().get(0).getBody().size());
            assertTrue(program.getFunctions().get(0).getBody().get(1) instanceof PassStmt);
        }

        @Test
        @DisplayName("pass 后紧跟 end 只是空语句")
        void testPassBeforeEnd() {
            FunctionDef f = parse("def f():\n    pass\nend\nprint(1)").getFunctions().get(0);
            assertEquals(1, f.getBody().size());
            assertEquals(2, parse("def f():\n    pass\nend\nprint(1)").getFunctions().size());
        }

        @Test
        @DisplayName("嵌套函数定义报错")
        void testNestedFunction() {
            ParseException e = parseError("def f():\n    def g():\n    end\nend");
            assertEquals("Nested function definitions are not supported", e.getRawMessage());
            assertEquals(2, e.getLine());
        }

        @Test
        @DisplayName("未闭合的函数体")
        void testUnterminatedBody() {
            ParseException e = parseError("def f():\n    x = 1\n");
            assertTrue(e.getRawMessage().startsWith("Unterminated block: 'def f' opened at line 1"));
            assertEquals("'end'", e.getExpected());
            assertTrue(e.getMessage().contains("found end of input"));
        }
    }

    // ================================================================
    // 顶层语句
    // ================================================================

    @Nested
    @DisplayName("顶层语句与入口函数")
    class TopLevelTests {

        @Test
        @DisplayName("顶层语句合成 main，位于所有函数之后")
        void testSyntheticMain() {
            Program program = parse("x = 1\ndef f(): return 2; end\nprint(x)");
            List<FunctionDef> functions = program.getFunctions();
            assertEquals(2, functions.size());
            assertEquals("f", functions.get(0).getName());
            FunctionDef main = functions.get(1);
            assertEquals("main", main.getName());
            assertTrue(main.isSynthetic());
            assertEquals(2, main.getBody().size());
            assertEquals(1, main.getLocation().getLine());
        }

        @Test
        @DisplayName("只有函数时没有合成 main")
        void testNoTopLevel() {
            Program program = parse("def f(): pass");
            assertEquals(1, program.getFunctions().size());
            assertFalse(program.getFunctions().get(0).isSynthetic());
        }

        @Test
        @DisplayName("自定义入口函数名")
        void testCustomMainName() {
            Parser parser = new Parser(new Lexer("print(1)", "t.ai"));
            parser.setMainFunctionName("__entry");
            assertEquals("__entry", parser.parse().getFunctions().get(0).getName());
        }

        @Test
        @DisplayName("空程序")
        void testEmpty() {
            assertTrue(parse("# nothing\n").getFunctions().isEmpty());
        }

        @Test
        @DisplayName("程序末尾多余的 end 报错并指向该位置")
        void testUnmatchedEnd() {
            ParseException e = parseError("def f(x): return x + 1; end;\nend;");
            assertEquals("Unmatched 'end': no open block to close", e.getRawMessage());
            assertEquals(Diagnostic.Phase.PARSE, e.getPhase());
            assertEquals(2, e.getLine());
            assertEquals(1, e.getColumn());
            assertEquals("test.ai", e.toDiagnostic().getFile());
        }
    }

    // ================================================================
    // 语句
    // ================================================================

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("分号可选")
        void testOptionalSemicolons() {
            List<Statement> withSemi = statements("x = 1; y = 2; print(x);");
            List<Statement> without = statements("x = 1\ny = 2\nprint(x)");
            assertEquals(3, withSemi.size());
            assertEquals(3, without.size());
        }

        @Test
        @DisplayName("同一行的两条语句之间无法判定边界时报错")
        void testMissingSeparator() {
            ParseException e = parseError("x = 1 )");
            assertEquals("Unexpected token after statement", e.getRawMessage());
        }

        @Test
        @DisplayName("各类赋值")
        void testAssignments() {
            List<Statement> stmts = statements("x = 1\nx += 2\na[0] = 3\nb: int = 4\na[1] -= 1");
            assertTrue(stmts.get(0) instanceof AssignStmt);
            AugAssignStmt aug = (AugAssignStmt) stmts.get(1);
            assertEquals(BinaryExpr.BinaryOp.ADD, aug.getOperator());
            assertTrue(stmts.get(2) instanceof IndexAssignStmt);
            assertEquals("b", ((AssignStmt) stmts.get(3)).getTarget());
            AugAssignStmt indexed = (AugAssignStmt) stmts.get(4);
            assertEquals(BinaryExpr.BinaryOp.SUB, indexed.getOperator());
            assertTrue(indexed.getTarget() instanceof IndexExpr);
        }

        @Test
        @DisplayName("不支持的赋值形式")
        void testUnsupportedAssignments() {
            assertEquals("Chained assignment is not supported", parseError("a = b = 1").getRawMessage());
            assertEquals("Multiple assignment targets are not supported", parseError("a, b = 1, 2").getRawMessage());
            assertEquals("Invalid assignment target", parseError("f(x) = 1").getRawMessage());
            assertEquals("Invalid assignment target", parseError("1 += 1").getRawMessage());
        }

        @Test
        @DisplayName("return 只取同一行的值")
        void testReturnNewline() {
            FunctionDef f = parse("def f():\n    return\n    x\nend").getFunctions().get(0);
            assertEquals(2, f.getBody().size());
            assertFalse(((ReturnStmt) f.getBody().get(0)).hasValue());

            FunctionDef g = parse("def g(): return 1 + 2; end").getFunctions().get(0);
            ReturnStmt ret = (ReturnStmt) g.getBody().get(0);
            assertTrue(ret.getValue() instanceof BinaryExpr);
        }

        @Test
        @DisplayName("换行后的 '(' 开始新语句")
        void testParenOnNewLine() {
            List<Statement> stmts = statements("x = y\n(z)");
            assertEquals(2, stmts.size());
            assertTrue(((AssignStmt) stmts.get(0)).getValue() instanceof Identifier);
        }

        @Test
        @DisplayName("原样块语句")
        void testRawBlocks() {
            List<Statement> stmts = statements("asm { nop }\nailang {x = 1};");
            RawBlockStmt asm = (RawBlockStmt) stmts.get(0);
            assertEquals("asm", asm.getOpener());
            assertEquals(" nop ", asm.getPayload());
            assertEquals("ailang", ((RawBlockStmt) stmts.get(1)).getOpener());
        }
    }

    // ================================================================
    // 控制流
    // ================================================================

    @Nested
    @DisplayName("控制流")
    class ControlFlowTests {

        @Test
        @DisplayName("if/elif/else 由一个 end 结束")
        void testIfChain() {
            List<Statement> stmts = statements(
                    "if x > 0:\n    a = 1\nelif x < 0:\n    a = 2\nelif x == 0:\n    a = 3\nelse:\n    a = 4\nend\nprint(a)");
            assertEquals(2, stmts.size());
            IfStmt ifStmt = (IfStmt) stmts.get(0);
            assertEquals(3, ifStmt.getBranches().size());
            assertTrue(ifStmt.hasElse());
            assertEquals(1, ifStmt.getElseBody().size());
        }

        @Test
        @DisplayName("分支中的 pass 不结束整个 if")
        void testPassInBranch() {
            IfStmt ifStmt = (IfStmt) statements("if x:\n    pass\nelse:\n    y = 1\nend").get(0);
            assertEquals(1, ifStmt.getBranches().get(0).getBody().size());
            assertTrue(ifStmt.hasElse());
        }

        @Test
        @DisplayName("没有 else 的 if")
        void testIfWithoutElse() {
            IfStmt ifStmt = (IfStmt) statements("if x: y = 1; end").get(0);
            assertFalse(ifStmt.hasElse());
            assertEquals(1, ifStmt.getBranches().size());
        }

        @Test
        @DisplayName("end 之后的 else 没有对应的 if")
        void testElseAfterEnd() {
            ParseException e = parseError("if x:\n    y = 1\nend\nelse:\n    y = 2\nend");
            assertEquals("Unexpected 'else': no open 'if' branch", e.getRawMessage());
            assertEquals(4, e.getLine());
        }

        @Test
        @DisplayName("while 循环")
        void testWhile() {
            WhileStmt loop = (WhileStmt) statements("while i < 10:\n    i += 1\n    if i == 5: break; end\n    continue\nend").get(0);
            assertEquals(3, loop.getBody().size());
            assertTrue(loop.getBody().get(2) instanceof ContinueStmt);
        }

        @Test
        @DisplayName("range 的一到三个参数")
        void testForRange() {
            ForRangeStmt one = (ForRangeStmt) statements("for i in range(10): pass").get(0);
            assertNull(one.getStart());
            assertEquals(10L, ((NumberLiteral) one.getStop()).getValue());
            assertNull(one.getStep());

            ForRangeStmt two = (ForRangeStmt) statements("for i in range(2, n): pass").get(0);
            assertEquals(2L, ((NumberLiteral) two.getStart()).getValue());
            assertTrue(two.getStop() instanceof Identifier);

            ForRangeStmt three = (ForRangeStmt) statements("for i in range(10, 0, -1): pass").get(0);
            assertTrue(three.getStep() instanceof UnaryExpr);
        }

        @Test
        @DisplayName("range 参数个数错误")
        void testRangeArity() {
            assertEquals("range() takes 1 to 3 arguments, got 0", parseError("for i in range(): pass").getRawMessage());
            assertEquals("range() takes 1 to 3 arguments, got 4",
                    parseError("for i in range(1, 2, 3, 4): pass").getRawMessage());
        }

        @Test
        @DisplayName("遍历其它可迭代对象")
        void testForEach() {
            ForEachStmt loop = (ForEachStmt) statements("for v in [1, 2, 3]: print(v); end;").get(0);
            assertEquals("v", loop.getVariable());
            assertEquals(3, ((ListLiteral) loop.getIterable()).getElements().size());
            assertEquals(1, loop.getBody().size());
        }

        @Test
        @DisplayName("多个循环变量报错")
        void testMultipleLoopVariables() {
            assertEquals("Multiple loop variables are not supported",
                    parseError("for k, v in d: pass").getRawMessage());
        }
    }

    // ================================================================
    // 表达式
    // ================================================================

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testArithmeticPrecedence() {
            BinaryExpr add = (BinaryExpr) expr("x = 1 + 2 * 3");
            assertEquals(BinaryExpr.BinaryOp.ADD, add.getOperator());
            assertEquals(BinaryExpr.BinaryOp.MUL, ((BinaryExpr) add.getRight()).getOperator());
        }

        @Test
        @DisplayName("减法左结合")
        void testLeftAssociative() {
            BinaryExpr outer = (BinaryExpr) expr("x = a - b - c");
            assertTrue(outer.getLeft() instanceof BinaryExpr);
            assertTrue(outer.getRight() instanceof Identifier);
        }

        @Test
        @DisplayName("幂右结合且高于一元负号")
        void testPower() {
            BinaryExpr pow = (BinaryExpr) expr("x = 2 ** 3 ** 2");
            assertEquals(BinaryExpr.BinaryOp.POW, pow.getOperator());
            assertEquals(BinaryExpr.BinaryOp.POW, ((BinaryExpr) pow.getRight()).getOperator());

            UnaryExpr neg = (UnaryExpr) expr("x = -2 ** 2");
            assertEquals(UnaryExpr.UnaryOp.NEG, neg.getOperator());
            assertTrue(neg.getOperand() instanceof BinaryExpr);

            BinaryExpr negExponent = (BinaryExpr) expr("x = 2 ** -1");
            assertTrue(negExponent.getRight() instanceof UnaryExpr);
        }

        @Test
        @DisplayName("not 低于比较，and 高于 or")
        void testLogical() {
            UnaryExpr not = (UnaryExpr) expr("x = not a == b");
            assertEquals(UnaryExpr.UnaryOp.NOT, not.getOperator());
            assertEquals(BinaryExpr.BinaryOp.EQ, ((BinaryExpr) not.getOperand()).getOperator());

            BinaryExpr or = (BinaryExpr) expr("x = a or b and c");
            assertEquals(BinaryExpr.BinaryOp.OR, or.getOperator());
            assertEquals(BinaryExpr.BinaryOp.AND, ((BinaryExpr) or.getRight()).getOperator());
        }

        @Test
        @DisplayName("括号改变优先级")
        void testParentheses() {
            BinaryExpr mul = (BinaryExpr) expr("x = (a + b) * c");
            assertEquals(BinaryExpr.BinaryOp.MUL, mul.getOperator());
            assertEquals(BinaryExpr.BinaryOp.ADD, ((BinaryExpr) mul.getLeft()).getOperator());
        }

        @Test
        @DisplayName("常量 True/False/None")
        void testConstants() {
            assertEquals(1L, ((NumberLiteral) expr("x = True")).getValue());
            assertEquals(0L, ((NumberLiteral) expr("x = False")).getValue());
            assertEquals(0L, ((NumberLiteral) expr("x = None")).getValue());
        }

        @Test
        @DisplayName("调用、方法调用和下标")
        void testPostfix() {
            CallExpr call = (CallExpr) expr("print(1, 2, 3,)");
            assertEquals("print", call.getCallee());
            assertEquals(3, call.getArgs().size());

            MethodCallExpr method = (MethodCallExpr) expr("xs.append(4)");
            assertEquals("append", method.getMethod());
            assertEquals(1, method.getArgs().size());

            IndexExpr index = (IndexExpr) expr("x = m[\"k\"][0]");
            assertTrue(index.getTarget() instanceof IndexExpr);
        }

        @Test
        @DisplayName("列表与字典字面量")
        void testLiterals() {
            assertEquals(0, ((ListLiteral) expr("x = []")).getElements().size());
            DictLiteral dict = (DictLiteral) expr("x = {\"a\": 1, \"b\": 2,}");
            assertEquals(2, dict.size());
        }

        @Test
        @DisplayName("不支持的表达式形式")
        void testUnsupported() {
            assertEquals("Attribute access without a call is not supported", parseError("x = a.b").getRawMessage());
            assertEquals("Only named functions can be called", parseError("x = f(1)(2)").getRawMessage());
            assertEquals("Tuples are not supported", parseError("x = (1, 2)").getRawMessage());
        }

        @Test
        @DisplayName("缺少表达式时的错误信息")
        void testExpectedExpression() {
            ParseException e = parseError("x = ");
            assertEquals("Expected expression", e.getRawMessage());
            assertEquals("expression", e.getExpected());
            assertEquals("Expected expression at line 1, column 5 (found end of input), expected: expression",
                    e.getMessage());
        }
    }
}
