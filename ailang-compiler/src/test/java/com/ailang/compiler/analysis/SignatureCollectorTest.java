package com.ailang.compiler.analysis;

import com.ailang.compiler.ast.decl.Program;
import com.ailang.compiler.lexer.Lexer;
import com.ailang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 签名收集测试
 */
class SignatureCollectorTest {

    private static final Set<String> RESERVED = new HashSet<String>(Arrays.asList("print", "len", "range"));

    private SignatureTable collect(String source) {
        Program program = new Parser(new Lexer(source, "sig.ai")).parse();
        return new SignatureCollector(RESERVED).collect(program);
    }

    @Test
    @DisplayName("登记所有函数，包括在调用之后定义的函数")
    void testCollectAll() {
        SignatureTable table = collect("print(g(1))\ndef f(): return 1; end\ndef g(a): return a; end");
        assertEquals(3, table.size());
        assertEquals(0, table.lookup("f").getArity());
        assertEquals(1, table.lookup("g").getArity());
        assertTrue(table.lookup("main").isSynthetic());
        assertFalse(table.contains("h"));
    }

    @Test
    @DisplayName("重复函数名报错并指出首次定义的行")
    void testDuplicateFunction() {
        NameResolutionException e = assertThrows(NameResolutionException.class,
                () -> collect("def f(): pass\n\ndef f(x): pass"));
        assertEquals("Duplicate function 'f' (first defined at line 1)", e.getRawMessage());
        assertEquals(3, e.getLine());
    }

    @Test
    @DisplayName("函数名不能与内置函数重名")
    void testShadowBuiltin() {
        NameResolutionException e = assertThrows(NameResolutionException.class,
                () -> collect("def len(x): return 0; end"));
        assertEquals("Function 'len' shadows a built-in", e.getRawMessage());
        assertThrows(NameResolutionException.class, () -> collect("def range(n): pass"));
    }

    @Test
    @DisplayName("重复参数名")
    void testDuplicateParameter() {
        NameResolutionException e = assertThrows(NameResolutionException.class,
                () -> collect("def f(a, a): pass"));
        assertEquals("Duplicate parameter 'a' in function 'f'", e.getRawMessage());
    }

    @Test
    @DisplayName("用户定义的 main 与顶层语句冲突")
    void testMainConflict() {
        NameResolutionException e = assertThrows(NameResolutionException.class,
                () -> collect("x = 1\ndef main(): pass"));
        assertTrue(e.getRawMessage().contains("conflicts with the entry function"));
        assertEquals(2, e.getLine());

        // 没有顶层语句时可以定义 main
        assertEquals(1, collect("def main(): print(1); end").size());
    }

    @Test
    @DisplayName("签名表不可修改")
    void testImmutable() {
        SignatureTable table = collect("def f(): pass");
        assertThrows(UnsupportedOperationException.class, () -> table.getSignatures().clear());
    }
}
