package com.ailang.compiler.lexer;

import com.ailang.compiler.CompileException;
import com.ailang.compiler.Diagnostic;
import com.ailang.compiler.ast.SourceLocation;

/**
 * 词法异常
 */
public class LexException extends CompileException {

    public LexException(String message, SourceLocation location) {
        super(Diagnostic.Phase.LEX, message, location);
    }
}
