package com.ailang.compiler.formatter;

import com.ailang.compiler.ast.decl.Program;
import com.ailang.compiler.lexer.Lexer;
import com.ailang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 格式化器测试
 */
class AilangFormatterTest {

    private final AilangFormatter formatter = new AilangFormatter();

    private Program parse(String source) {
        return new Parser(new Lexer(source, "fmt.ai")).parse();
    }

    private String format(String source) {
        return formatter.format(parse(source));
    }

    /** 格式化结果解析出的 AST 与原 AST 结构相同，且再次格式化后不变 */
    private void assertStable(String source) {
        Program original = parse(source);
        String once = formatter.format(original);
        Program reparsed = parse(once);
        assertEquals(AstDump.dump(original), AstDump.dump(reparsed), "AST changed after formatting:\n" + once);
        assertEquals(once, formatter.format(reparsed), "Formatting is not stable for:\n" + source);
    }

    @Nested
    @DisplayName("语句块输出")
    class BlockTests {

        @Test
        @DisplayName("函数与顶层语句")
        void testFunctionAndTopLevel() {
            String out = format("func add(a: int, b: int) -> int:\n  return a+b\npass\nprint(add(1,2))");
            // 结束性的 pass 保留为空语句
            assertEquals("def add(a, b):\n    return a + b;\n    pass;\nend;\n\nprint(add(1, 2));\n", out);
        }

        @Test
        @DisplayName("if 链只输出一个 end")
        void testIfChain() {
            String out = format("if x: a = 1\nelif y: a = 2\nelse: a = 3\nend");
            assertEquals("if x:\n    a = 1;\nelif y:\n    a = 2;\nelse:\n    a = 3;\nend;\n", out);
        }

        @Test
        @DisplayName("range 循环保留原参数形式")
        void testForRange() {
            assertEquals("for i in range(0, n, 2):\n    print(i);\nend;\n", format("for i in range(0,n,2): print(i); end"));
            assertEquals("for i in range(n):\n    pass;\nend;\n", format("for i in range(n): pass"));
        }

        @Test
        @DisplayName("不加分号的配置")
        void testNoSemicolons() {
            FormatConfig config = new FormatConfig();
            config.setSemicolons(false);
            config.setIndentSize(2);
            String out = formatter.format(parse("while x: x -= 1; end"), config);
            assertEquals("while x:\n  x -= 1\nend\n", out);
        }

        @Test
        @DisplayName("原样块内容逐字节保留")
        void testRawBlock() {
            String out = format("def f():\n    asm {\n  mov rax, {1}\n}\nend");
            assertTrue(out.contains("asm {\n  mov rax, {1}\n}"), out);
            assertStable("def f():\n    asm {\n  mov rax, {1}\n}\nend");
        }
    }

    @Nested
    @DisplayName("表达式括号")
    class ParenthesesTests {

        @Test
        @DisplayName("只在优先级需要时加括号")
        void testMinimalParentheses() {
            assertEquals("x = (a + b) * c;\n", format("x = ((a + b)) * (c)"));
            assertEquals("x = a + b * c;\n", format("x = a + (b * c)"));
            assertEquals("x = a - (b - c);\n", format("x = a - (b - c)"));
            assertEquals("x = a - b - c;\n", format("x = (a - b) - c"));
        }

        @Test
        @DisplayName("幂运算的结合性")
        void testPower() {
            assertEquals("x = 2 ** 3 ** 2;\n", format("x = 2 ** (3 ** 2)"));
            assertEquals("x = (2 ** 3) ** 2;\n", format("x = (2 ** 3) ** 2"));
            assertEquals("x = (-2) ** 2;\n", format("x = (-2) ** 2"));
            assertEquals("x = -2 ** 2;\n", format("x = -(2 ** 2)"));
        }

        @Test
        @DisplayName("not 与比较")
        void testNot() {
            assertEquals("x = not a == b;\n", format("x = not (a == b)"));
            assertEquals("x = (not a) == b;\n", format("x = (not a) == b"));
        }

        @Test
        @DisplayName("常量和字符串转义")
        void testLiterals() {
            assertEquals("x = [1, 0, \"a\\\"b\\n\"];\n", format("x = [True, None, 'a\"b\\n']"));
            assertEquals("d = {\"k\": 1.5};\n", format("d = {'k': 1.5}"));
        }

        @Test
        @DisplayName("省略的括号不改变运算结构")
        void testParenthesesPreserveStructure() {
            assertStable("x = ((a + b)) * (c)");
            assertStable("x = a - (b - c) + (d - e) - f");
            assertStable("x = 2 ** (3 ** 2) + (2 ** 3) ** 2");
            assertStable("x = (-2) ** 2 - -(2 ** 2)");
            assertStable("x = a // (b * c) % (d / e)");
            assertStable("x = not (a == b) and (not a) == b");
            assertStable("x = (a or b) and c or not (d and e)");
            assertStable("x = (a < b) == (c > d)");
            assertStable("x = (5).bit() + xs[(i + 1) * 2]");
        }

        @Test
        @DisplayName("数字接收者加括号")
        void testNumberReceiver() {
            assertEquals("x = (5).bit();\n", format("x = (5).bit()"));
        }
    }

    @Test
    @DisplayName("格式化结果是稳定的")
    void testStability() {
        assertStable("def fib(n):\n"
                + "    if n < 2: return n\n"
                + "    end\n"
                + "    return fib(n - 1) + fib(n - 2)\n"
                + "end\n"
                + "items = [1, 2, 3]\n"
                + "for v in items:\n"
                + "    if v % 2 == 0:\n"
                + "        continue\n"
                + "    elif v > 2:\n"
                + "        break\n"
                + "    else:\n"
                + "        pass\n"
                + "    end\n"
                + "    items[0] += -v\n"
                + "end\n"
                + "print(fib(10), \"done\".upper())\n");
    }
}
