package com.ailang.compiler.ast.stmt;

import com.ailang.compiler.ast.AstVisitor;
import com.ailang.compiler.ast.SourceLocation;
import com.ailang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * for x in range(start, stop, step)
 *
 * <p>start / step 可为 null，分别表示 0 和 1。</p>
 */
public class ForRangeStmt extends Statement {
    private final String variable;
    private final Expression start;
    private final Expression stop;
    private final Expression step;
    private final List<Statement> body;

    public ForRangeStmt(SourceLocation location, String variable, Expression start,
                        Expression stop, Expression step, List<Statement> body) {
        super(location);
        this.variable = variable;
        this.start = start;
        this.stop = stop;
        this.step = step;
        this.body = body;
    }

    public String getVariable() {
        return variable;
    }

    public Expression getStart() {
        return start;
    }

    public Expression getStop() {
        return stop;
    }

    public Expression getStep() {
        return step;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForRangeStmt(this, context);
    }
}
