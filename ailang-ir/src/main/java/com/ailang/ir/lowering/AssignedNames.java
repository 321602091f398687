package com.ailang.ir.lowering;

import com.ailang.compiler.ast.AstVisitor;
import com.ailang.compiler.ast.expr.Identifier;
import com.ailang.compiler.ast.stmt.*;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 收集一段语句（含嵌套块）中会被重新绑定的变量名，包括内层循环变量。
 */
final class AssignedNames implements AstVisitor<Void, Set<String>> {

    private static final AssignedNames INSTANCE = new AssignedNames();

    private AssignedNames() {
    }

    static Set<String> collect(List<Statement> statements) {
        Set<String> names = new HashSet<String>();
        INSTANCE.visitAll(statements, names);
        return names;
    }

    private void visitAll(List<Statement> statements, Set<String> names) {
        for (Statement stmt : statements) {
            stmt.accept(this, names);
        }
    }

    @Override
    public Void visitAssignStmt(AssignStmt node, Set<String> names) {
        names.add(node.getTarget());
        return null;
    }

    @Override
    public Void visitAugAssignStmt(AugAssignStmt node, Set<String> names) {
        if (node.getTarget() instanceof Identifier) {
            names.add(((Identifier) node.getTarget()).getName());
        }
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, Set<String> names) {
        for (IfBranch branch : node.getBranches()) {
            visitAll(branch.getBody(), names);
        }
        if (node.hasElse()) {
            visitAll(node.getElseBody(), names);
        }
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, Set<String> names) {
        visitAll(node.getBody(), names);
        return null;
    }

    @Override
    public Void visitForRangeStmt(ForRangeStmt node, Set<String> names) {
        names.add(node.getVariable());
        visitAll(node.getBody(), names);
        return null;
    }

    @Override
    public Void visitForEachStmt(ForEachStmt node, Set<String> names) {
        names.add(node.getVariable());
        visitAll(node.getBody(), names);
        return null;
    }
}
