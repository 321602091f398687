package com.ailang.compiler.ast.decl;

import com.ailang.compiler.ast.AstNode;
import com.ailang.compiler.ast.AstVisitor;
import com.ailang.compiler.ast.SourceLocation;
import com.ailang.compiler.ast.stmt.Statement;

import java.util.List;

/**
 * 函数定义。{@code def} 与 {@code func} 解析为同一节点。
 */
public class FunctionDef extends AstNode {
    private final String name;
    private final List<String> params;
    private final List<Statement> body;
    /** 由顶层语句合成的入口函数 */
    private final boolean synthetic;

    public FunctionDef(SourceLocation location, String name, List<String> params,
                       List<Statement> body, boolean synthetic) {
        super(location);
        this.name = name;
        this.params = params;
        this.body = body;
        this.synthetic = synthetic;
    }

    public String getName() {
        return name;
    }

    public List<String> getParams() {
        return params;
    }

    public List<Statement> getBody() {
        return body;
    }

    public boolean isSynthetic() {
        return synthetic;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDef(this, context);
    }
}
