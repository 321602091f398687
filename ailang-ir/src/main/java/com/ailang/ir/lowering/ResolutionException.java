package com.ailang.ir.lowering;

import com.ailang.compiler.Diagnostic;
import com.ailang.compiler.ast.SourceLocation;

/**
 * 调用解析错误：未知函数、参数个数不符、接收者种类无法确定等。
 * 属于生成错误的一种，以 resolve 阶段报告。
 */
public class ResolutionException extends GenerationException {

    public ResolutionException(String message, SourceLocation location) {
        super(Diagnostic.Phase.RESOLVE, message, location);
    }
}
