package com.ailang.compiler.ast.stmt;

import com.ailang.compiler.ast.AstNode;
import com.ailang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
