package com.ailang.compiler.ast.stmt;

import com.ailang.compiler.ast.AstVisitor;
import com.ailang.compiler.ast.SourceLocation;
import com.ailang.compiler.ast.expr.Expression;

import java.util.List;

/**
 * for x in iterable
 */
public class ForEachStmt extends Statement {
    private final String variable;
    private final Expression iterable;
    private final List<Statement> body;

    public ForEachStmt(SourceLocation location, String variable, Expression iterable, List<Statement> body) {
        super(location);
        this.variable = variable;
        this.iterable = iterable;
        this.body = body;
    }

    public String getVariable() {
        return variable;
    }

    public Expression getIterable() {
        return iterable;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForEachStmt(this, context);
    }
}
