package com.ailang.compiler.ast.stmt;

import com.ailang.compiler.ast.AstVisitor;
import com.ailang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * If 语句：第一个分支为 if，其余为 elif
 */
public class IfStmt extends Statement {
    private final List<IfBranch> branches;
    private final List<Statement> elseBody;  // 可选

    public IfStmt(SourceLocation location, List<IfBranch> branches, List<Statement> elseBody) {
        super(location);
        this.branches = branches;
        this.elseBody = elseBody;
    }

    public List<IfBranch> getBranches() {
        return branches;
    }

    public List<Statement> getElseBody() {
        return elseBody;
    }

    public boolean hasElse() {
        return elseBody != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
