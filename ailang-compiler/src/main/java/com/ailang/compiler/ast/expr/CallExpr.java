package com.ailang.compiler.ast.expr;

import com.ailang.compiler.ast.AstVisitor;
import com.ailang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 按名称调用：内置函数或程序中定义的函数
 */
public class CallExpr extends Expression {
    private final String callee;
    private final List<Expression> args;

    public CallExpr(SourceLocation location, String callee, List<Expression> args) {
        super(location);
        this.callee = callee;
        this.args = args;
    }

    public String getCallee() {
        return callee;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
