package com.ailang.ir;

import com.ailang.compiler.Diagnostic;
import com.ailang.ir.inst.IrProgram;

/**
 * 一次编译的结果：要么是完整的 IR 程序，要么是一条诊断，不会有部分输出。
 */
public final class CompileResult {

    private final IrProgram program;
    private final Diagnostic diagnostic;

    private CompileResult(IrProgram program, Diagnostic diagnostic) {
        this.program = program;
        this.diagnostic = diagnostic;
    }

    public static CompileResult success(IrProgram program) {
        return new CompileResult(program, null);
    }

    public static CompileResult failure(Diagnostic diagnostic) {
        return new CompileResult(null, diagnostic);
    }

    public boolean isSuccess() {
        return program != null;
    }

    /** 失败时为 null */
    public IrProgram getProgram() {
        return program;
    }

    /** 成功时为 null */
    public Diagnostic getDiagnostic() {
        return diagnostic;
    }

    @Override
    public String toString() {
        return isSuccess() ? "CompileResult[ok, " + program.getFunctions().size() + " function(s)]"
                : "CompileResult[" + diagnostic + "]";
    }
}
