package com.ailang.compiler.ast.decl;

import com.ailang.compiler.ast.AstNode;
import com.ailang.compiler.ast.AstVisitor;
import com.ailang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 程序（编译单元），按源码顺序持有全部函数
 */
public class Program extends AstNode {
    private final List<FunctionDef> functions;

    public Program(SourceLocation location, List<FunctionDef> functions) {
        super(location);
        this.functions = functions;
    }

    public List<FunctionDef> getFunctions() {
        return functions;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
