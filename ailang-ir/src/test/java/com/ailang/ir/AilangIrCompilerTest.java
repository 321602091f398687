package com.ailang.ir;

import com.ailang.compiler.CompileException;
import com.ailang.compiler.Diagnostic;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * 编译器门面测试：诊断信息与结果
 */
class AilangIrCompilerTest {

    private AilangIrCompiler compiler() {
        CompilerOptions options = new CompilerOptions();
        options.setDumpIr(false);
        return new AilangIrCompiler(options);
    }

    @Test
    @DisplayName("成功时返回完整程序，没有诊断")
    void testSuccess() {
        CompileResult result = compiler().compile("def f(x): return x + 1; end\nprint(f(1))", "ok.ai");
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getDiagnostic()).isNull();
        assertThat(result.getProgram().getFunctions()).hasSize(2);
        assertThat(result.toString()).contains("2 function(s)");
    }

    @Test
    @DisplayName("词法错误的诊断")
    void testLexDiagnostic() {
        Diagnostic d = compiler().compile("x = 1\ny = \"abc", "lex.ai").getDiagnostic();
        assertThat(d.getPhase()).isEqualTo(Diagnostic.Phase.LEX);
        assertThat(d.getFile()).isEqualTo("lex.ai");
        assertThat(d.getLine()).isEqualTo(2);
        assertThat(d.getColumn()).isEqualTo(5);
        assertThat(d.toString()).isEqualTo("[lex.ai:2:5] lex error: Unterminated string");
    }

    @Test
    @DisplayName("语法错误的诊断包含实际遇到的 token")
    void testParseDiagnostic() {
        CompileResult result = compiler().compile("def f(x): return x + 1; end;\nend;", "p.ai");
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getProgram()).isNull();
        Diagnostic d = result.getDiagnostic();
        assertThat(d.getPhase()).isEqualTo(Diagnostic.Phase.PARSE);
        assertThat(d.getLine()).isEqualTo(2);
        assertThat(d.getMessage()).isEqualTo("Unmatched 'end': no open block to close (found 'end')");
    }

    @Test
    @DisplayName("解析与生成错误的阶段")
    void testResolveAndGenerateDiagnostics() {
        assertThat(compiler().compile("max(1, 2, 3)", "r.ai").getDiagnostic().getPhase())
                .isEqualTo(Diagnostic.Phase.RESOLVE);
        assertThat(compiler().compile("def f(): return y; end", "r.ai").getDiagnostic().getPhase())
                .isEqualTo(Diagnostic.Phase.RESOLVE);
        assertThat(compiler().compile("break", "g.ai").getDiagnostic().getPhase())
                .isEqualTo(Diagnostic.Phase.GENERATE);
    }

    @Test
    @DisplayName("compileOrThrow 抛出带位置的异常")
    void testCompileOrThrow() {
        assertThatThrownBy(() -> compiler().compileOrThrow("x = @", "t.ai"))
                .isInstanceOf(CompileException.class)
                .hasMessage("Unexpected character: @ at line 1, column 5");
    }

    @Test
    @DisplayName("自定义入口函数名")
    void testMainFunctionName() {
        CompilerOptions options = new CompilerOptions();
        options.setDumpIr(false);
        options.setMainFunctionName("__start");
        CompileResult result = new AilangIrCompiler(options).compile("print(1)", "m.ai");
        assertThat(result.getProgram().getFunction("__start")).isNotNull();
        assertThat(result.getProgram().getFunction("main")).isNull();
    }

    @Test
    @DisplayName("打开 IR 转储不影响结果")
    void testDumpIr() {
        CompilerOptions options = new CompilerOptions();
        options.setDumpIr(true);
        CompileResult result = new AilangIrCompiler(options).compile("print(1)", "d.ai");
        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("编译文件")
    void testCompileFile(@TempDir Path dir) throws IOException {
        Path source = dir.resolve("prog.ai");
        Files.write(source, "s = \"é\"\nprint(s.upper())\n".getBytes(StandardCharsets.UTF_8));
        File file = source.toFile();
        CompileResult result = compiler().compileFile(file);
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getProgram().getFileName()).isEqualTo("prog.ai");
    }

    @Test
    @DisplayName("JSON 输出")
    void testCompileToJson() {
        String json = compiler().compileToJson("print(1)", "j.ai");
        assertThat(json).contains("\"entry\": \"rt_print\"");
    }
}
