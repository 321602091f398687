package com.ailang.compiler.analysis;

import com.ailang.compiler.Diagnostic;
import com.ailang.compiler.ast.SourceLocation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 函数作用域与值种类合并测试
 */
class FunctionScopeTest {

    private static SourceLocation at(int line, int column) {
        return new SourceLocation("scope.ai", line, column, 0, 1);
    }

    @Nested
    @DisplayName("符号声明与解析")
    class ScopeTests {

        @Test
        @DisplayName("首次赋值处为声明位置，再次赋值返回同一符号")
        void testDeclareOnce() {
            FunctionScope scope = new FunctionScope("f");
            Symbol first = scope.declare("x", SymbolKind.VARIABLE, at(2, 5), ValueKind.NUMBER);
            Symbol second = scope.declare("x", SymbolKind.VARIABLE, at(7, 5), ValueKind.STRING);
            assertSame(first, second);
            assertEquals(2, first.getLocation().getLine());
            assertEquals("f", first.getFunctionName());
        }

        @Test
        @DisplayName("参数在函数体之前注册")
        void testParameters() {
            FunctionScope scope = new FunctionScope("f");
            scope.defineParameter("a", at(1, 7));
            scope.defineParameter("b", at(1, 10));
            assertEquals(SymbolKind.PARAMETER, scope.resolve("a", at(3, 1)).getKind());
            assertEquals(ValueKind.UNKNOWN, scope.lookup("b").getValueKind());
            assertEquals(2, scope.getSymbols().size());
        }

        @Test
        @DisplayName("重复参数报错")
        void testDuplicateParameter() {
            FunctionScope scope = new FunctionScope("f");
            scope.defineParameter("a", at(1, 7));
            NameResolutionException e = assertThrows(NameResolutionException.class,
                    () -> scope.defineParameter("a", at(1, 10)));
            assertEquals(Diagnostic.Phase.RESOLVE, e.getPhase());
        }

        @Test
        @DisplayName("读取未声明的变量报错，位置为读取处")
        void testUndefinedName() {
            FunctionScope scope = new FunctionScope("g");
            NameResolutionException e = assertThrows(NameResolutionException.class,
                    () -> scope.resolve("y", at(4, 9)));
            assertEquals("Name 'y' is not defined in function 'g'", e.getRawMessage());
            assertEquals(4, e.getLine());
            assertEquals(9, e.getColumn());
        }

        @Test
        @DisplayName("符号按声明顺序返回")
        void testSymbolOrder() {
            FunctionScope scope = new FunctionScope("f");
            scope.declare("b", SymbolKind.VARIABLE, at(1, 1), ValueKind.NUMBER);
            scope.declare("a", SymbolKind.LOOP_VARIABLE, at(2, 1), ValueKind.NUMBER);
            assertEquals("b", scope.getSymbols().get(0).getName());
            assertEquals(SymbolKind.LOOP_VARIABLE, scope.getSymbols().get(1).getKind());
            assertTrue(scope.isDeclared("a"));
            assertFalse(scope.isDeclared("c"));
        }
    }

    @Nested
    @DisplayName("值种类合并")
    class ValueKindTests {

        @Test
        @DisplayName("相同种类保持不变")
        void testSame() {
            assertEquals(ValueKind.LIST, ValueKind.LIST.merge(ValueKind.LIST));
            assertEquals(ValueKind.NUMBER, ValueKind.NUMBER.merge(null));
        }

        @Test
        @DisplayName("不同的具体种类合并为 AMBIGUOUS")
        void testConflict() {
            assertEquals(ValueKind.AMBIGUOUS, ValueKind.LIST.merge(ValueKind.DICT));
            assertEquals(ValueKind.AMBIGUOUS, ValueKind.AMBIGUOUS.merge(ValueKind.UNKNOWN));
            assertEquals(ValueKind.AMBIGUOUS, ValueKind.UNKNOWN.merge(ValueKind.AMBIGUOUS));
        }

        @Test
        @DisplayName("UNKNOWN 与具体种类合并为 UNKNOWN")
        void testUnknown() {
            assertEquals(ValueKind.UNKNOWN, ValueKind.STRING.merge(ValueKind.UNKNOWN));
            assertEquals(ValueKind.UNKNOWN, ValueKind.UNKNOWN.merge(ValueKind.NUMBER));
            assertFalse(ValueKind.UNKNOWN.isConcrete());
            assertTrue(ValueKind.DICT.isConcrete());
            assertEquals("dict", ValueKind.DICT.getDisplayName());
        }
    }
}
