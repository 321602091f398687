package com.ailang.compiler.ast.stmt;

import com.ailang.compiler.ast.AstVisitor;
import com.ailang.compiler.ast.SourceLocation;
import com.ailang.compiler.ast.expr.Expression;

/**
 * 下标赋值 target[index] = value
 */
public class IndexAssignStmt extends Statement {
    private final Expression target;
    private final Expression index;
    private final Expression value;

    public IndexAssignStmt(SourceLocation location, Expression target, Expression index, Expression value) {
        super(location);
        this.target = target;
        this.index = index;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIndex() {
        return index;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIndexAssignStmt(this, context);
    }
}
