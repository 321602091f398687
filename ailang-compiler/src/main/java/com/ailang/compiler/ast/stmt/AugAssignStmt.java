package com.ailang.compiler.ast.stmt;

import com.ailang.compiler.ast.AstVisitor;
import com.ailang.compiler.ast.SourceLocation;
import com.ailang.compiler.ast.expr.BinaryExpr;
import com.ailang.compiler.ast.expr.Expression;

/**
 * 复合赋值 target op= value。target 为标识符或下标表达式。
 */
public class AugAssignStmt extends Statement {
    private final Expression target;
    private final BinaryExpr.BinaryOp operator;
    private final Expression value;

    public AugAssignStmt(SourceLocation location, Expression target,
                         BinaryExpr.BinaryOp operator, Expression value) {
        super(location);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public BinaryExpr.BinaryOp getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAugAssignStmt(this, context);
    }
}
