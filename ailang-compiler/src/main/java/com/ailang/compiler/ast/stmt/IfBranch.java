package com.ailang.compiler.ast.stmt;

import com.ailang.compiler.ast.SourceLocation;
import com.ailang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * if / elif 分支：条件加语句块
 */
public final class IfBranch {
    private final SourceLocation location;
    private final Expression condition;
    private final List<Statement> body;

    public IfBranch(SourceLocation location, Expression condition, List<Statement> body) {
        this.location = location;
        this.condition = condition;
        this.body = body;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getBody() {
        return body;
    }
}
