package com.ailang.ir.backend;

import com.ailang.ir.AilangIrCompiler;
import com.ailang.ir.CompilerOptions;
import com.ailang.ir.inst.IrProgram;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * IR JSON 交接格式测试
 */
class IrJsonWriterTest {

    private IrProgram compile(String source) {
        CompilerOptions options = new CompilerOptions();
        options.setDumpIr(false);
        return new AilangIrCompiler(options).compileOrThrow(source, "json.ai");
    }

    private JsonObject writeAndParse(String source) {
        String json = new IrJsonWriter(false).write(compile(source));
        return JsonParser.parseString(json).getAsJsonObject();
    }

    private JsonArray instructions(JsonObject root, int function) {
        return root.getAsJsonArray("functions").get(function).getAsJsonObject().getAsJsonArray("instructions");
    }

    @Test
    @DisplayName("程序和函数的结构")
    void testProgramShape() {
        JsonObject root = writeAndParse("def f(x): return x + 1; end\nprint(f(2))");
        assertThat(root.get("file").getAsString()).isEqualTo("json.ai");

        JsonArray functions = root.getAsJsonArray("functions");
        assertThat(functions.size()).isEqualTo(2);
        JsonObject f = functions.get(0).getAsJsonObject();
        assertThat(f.get("name").getAsString()).isEqualTo("f");
        assertThat(f.getAsJsonArray("params").get(0).getAsString()).isEqualTo("x");
        assertThat(f.get("synthetic").getAsBoolean()).isFalse();
        assertThat(functions.get(1).getAsJsonObject().get("synthetic").getAsBoolean()).isTrue();
    }

    @Test
    @DisplayName("TempAssign 与操作数标记")
    void testTempAssign() {
        JsonObject add = instructions(writeAndParse("def f(x): return x + 1; end"), 0).get(0).getAsJsonObject();
        assertThat(add.get("kind").getAsString()).isEqualTo("TempAssign");
        assertThat(add.get("line").getAsInt()).isEqualTo(1);
        assertThat(add.get("target").getAsString()).isEqualTo("t0");
        assertThat(add.get("op").getAsString()).isEqualTo("ADD");
        JsonArray operands = add.getAsJsonArray("operands");
        assertThat(operands.get(0).getAsJsonObject().get("var").getAsString()).isEqualTo("x");
        assertThat(operands.get(1).getAsJsonObject().get("num").getAsLong()).isEqualTo(1L);
    }

    @Test
    @DisplayName("无结果的调用输出 null")
    void testNullResult() {
        JsonObject call = instructions(writeAndParse("print(\"<hi>\")"), 0).get(0).getAsJsonObject();
        assertThat(call.get("kind").getAsString()).isEqualTo("BuiltinCall");
        assertThat(call.get("entry").getAsString()).isEqualTo("rt_print");
        assertThat(call.get("result").isJsonNull()).isTrue();
        assertThat(call.getAsJsonArray("operands").get(0).getAsJsonObject().get("str").getAsString())
                .isEqualTo("<hi>");
    }

    @Test
    @DisplayName("结构化控制流嵌套输出")
    void testControlFlow() {
        JsonArray main = instructions(writeAndParse("i = 0\nwhile i < 3:\n    if i == 1: break; end\n    i += 1\nend"), 0);
        JsonObject loop = main.get(1).getAsJsonObject();
        assertThat(loop.get("kind").getAsString()).isEqualTo("WhileBlock");
        assertThat(loop.getAsJsonArray("conditionCode").size()).isEqualTo(1);
        assertThat(loop.getAsJsonObject("condition").get("var").getAsString()).isEqualTo("t0");

        JsonObject ifBlock = loop.getAsJsonArray("body").get(1).getAsJsonObject();
        assertThat(ifBlock.get("kind").getAsString()).isEqualTo("IfBlock");
        assertThat(ifBlock.getAsJsonArray("then").get(0).getAsJsonObject().get("kind").getAsString())
                .isEqualTo("Break");
        assertThat(ifBlock.getAsJsonArray("else").size()).isZero();
    }

    @Test
    @DisplayName("原样块内容和函数调用")
    void testRawAndInvoke() {
        JsonArray main = instructions(writeAndParse("def g(): return 1; end\nasm { a\t\"b\" }\nx = g()"), 1);
        JsonObject raw = main.get(0).getAsJsonObject();
        assertThat(raw.get("kind").getAsString()).isEqualTo("RawPassthrough");
        assertThat(raw.get("opener").getAsString()).isEqualTo("asm");
        assertThat(raw.get("payload").getAsString()).isEqualTo(" a\t\"b\" ");

        JsonObject invoke = main.get(1).getAsJsonObject();
        assertThat(invoke.get("kind").getAsString()).isEqualTo("FunctionCall");
        assertThat(invoke.get("function").getAsString()).isEqualTo("g");
        assertThat(invoke.get("result").getAsString()).isEqualTo("x");

        JsonObject ret = main.get(2).getAsJsonObject();
        assertThat(ret.get("kind").getAsString()).isEqualTo("ReturnValue");
        assertThat(ret.getAsJsonObject("value").get("num").getAsLong()).isZero();
    }

    @Test
    @DisplayName("紧凑与缩进输出")
    void testPretty() {
        IrProgram program = compile("x = 1");
        assertThat(new IrJsonWriter(false).write(program)).doesNotContain("\n");
        assertThat(new IrJsonWriter().write(program)).contains("\n  \"functions\": [");
    }
}
