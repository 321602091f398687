package com.ailang.compiler.analysis;

import com.ailang.compiler.CompileException;
import com.ailang.compiler.Diagnostic;
import com.ailang.compiler.ast.SourceLocation;

/**
 * 名称错误：重复定义、先读后写、与内置函数重名等
 */
public class NameResolutionException extends CompileException {

    public NameResolutionException(String message, SourceLocation location) {
        super(Diagnostic.Phase.RESOLVE, message, location);
    }
}
