package com.ailang.ir;

import com.ailang.compiler.CompileException;
import com.ailang.compiler.ast.decl.Program;
import com.ailang.compiler.lexer.Lexer;
import com.ailang.compiler.parser.Parser;
import com.ailang.ir.backend.IrJsonWriter;
import com.ailang.ir.backend.IrPrinter;
import com.ailang.ir.inst.IrProgram;
import com.ailang.ir.lowering.AstToIrLowering;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.logging.Logger;

/**
 * 编译器门面。
 * 管线：源码 → Lexer → Parser → AST → 签名收集 → IR。
 *
 * <p>每次编译使用新的词法、语法和生成器实例，互不共享状态；
 * 遇到第一个错误即终止，不产生部分输出。</p>
 */
public class AilangIrCompiler {

    private static final Logger LOG = Logger.getLogger(AilangIrCompiler.class.getName());

    private final CompilerOptions options;

    public AilangIrCompiler() {
        this(new CompilerOptions());
    }

    public AilangIrCompiler(CompilerOptions options) {
        this.options = options;
    }

    public CompilerOptions getOptions() {
        return options;
    }

    /**
     * 编译源代码。
     *
     * @param source   源代码
     * @param fileName 文件名（用于诊断位置）
     * @return IR 程序或一条诊断
     */
    public CompileResult compile(String source, String fileName) {
        try {
            return CompileResult.success(compileOrThrow(source, fileName));
        } catch (CompileException e) {
            LOG.fine("Compilation failed: " + e.toDiagnostic());
            return CompileResult.failure(e.toDiagnostic());
        }
    }

    /**
     * 编译源代码，失败时抛出 {@link CompileException}
     */
    public IrProgram compileOrThrow(String source, String fileName) {
        Lexer lexer = new Lexer(source, fileName);
        Parser parser = new Parser(lexer, fileName);
        parser.setMainFunctionName(options.getMainFunctionName());
        Program program = parser.parse();
        LOG.fine("Parsed " + fileName + ": " + program.getFunctions().size() + " function(s)");

        IrProgram ir = new AstToIrLowering(options).lower(program, fileName);
        LOG.fine("Generated IR for " + fileName);

        if (options.isDumpIr()) {
            LOG.info("===== IR DUMP " + fileName + " =====\n" + IrPrinter.print(ir) + "===== END IR DUMP =====");
        }
        return ir;
    }

    /**
     * 编译文件。
     */
    public CompileResult compileFile(File file) throws IOException {
        String source = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
        return compile(source, file.getName());
    }

    /**
     * 编译并输出 JSON 交接格式
     */
    public String compileToJson(String source, String fileName) {
        IrProgram ir = compileOrThrow(source, fileName);
        return new IrJsonWriter(options.isPrettyJson()).write(ir);
    }
}
