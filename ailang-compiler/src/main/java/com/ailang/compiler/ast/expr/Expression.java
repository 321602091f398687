package com.ailang.compiler.ast.expr;

import com.ailang.compiler.ast.AstNode;
import com.ailang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }

    /**
     * 是否为叶子节点（标识符或字面量）。叶子直接作为操作数，不分配临时变量。
     */
    public boolean isLeaf() {
        return false;
    }
}
