package com.ailang.ir.lowering;

import com.ailang.compiler.CompileException;
import com.ailang.compiler.Diagnostic;
import com.ailang.compiler.ast.SourceLocation;

/**
 * 代码生成错误：结构合法但无法降级为 IR 的程序
 */
public class GenerationException extends CompileException {

    public GenerationException(String message, SourceLocation location) {
        super(Diagnostic.Phase.GENERATE, message, location);
    }

    protected GenerationException(Diagnostic.Phase phase, String message, SourceLocation location) {
        super(phase, message, location);
    }
}
