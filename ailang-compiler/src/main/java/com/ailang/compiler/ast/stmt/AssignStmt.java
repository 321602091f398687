package com.ailang.compiler.ast.stmt;

import com.ailang.compiler.ast.AstVisitor;
import com.ailang.compiler.ast.SourceLocation;
import com.ailang.compiler.ast.expr.Expression;

/**
 * 赋值语句 name = value（类型注解已丢弃）
 */
public class AssignStmt extends Statement {
    private final String target;
    private final Expression value;

    public AssignStmt(SourceLocation location, String target, Expression value) {
        super(location);
        this.target = target;
        this.value = value;
    }

    public String getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignStmt(this, context);
    }
}
