package com.ailang.compiler.ast;

import com.ailang.compiler.ast.decl.*;
import com.ailang.compiler.ast.expr.*;
import com.ailang.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitProgram(Program node, C ctx) { return null; }

    default R visitFunctionDef(FunctionDef node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitWhileStmt(WhileStmt node, C ctx) { return null; }

    default R visitForRangeStmt(ForRangeStmt node, C ctx) { return null; }

    default R visitForEachStmt(ForEachStmt node, C ctx) { return null; }

    default R visitAssignStmt(AssignStmt node, C ctx) { return null; }

    default R visitAugAssignStmt(AugAssignStmt node, C ctx) { return null; }

    default R visitIndexAssignStmt(IndexAssignStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    default R visitBreakStmt(BreakStmt node, C ctx) { return null; }

    default R visitContinueStmt(ContinueStmt node, C ctx) { return null; }

    default R visitPassStmt(PassStmt node, C ctx) { return null; }

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return null; }

    default R visitRawBlockStmt(RawBlockStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitMethodCallExpr(MethodCallExpr node, C ctx) { return null; }

    default R visitIndexExpr(IndexExpr node, C ctx) { return null; }

    default R visitListLiteral(ListLiteral node, C ctx) { return null; }

    default R visitDictLiteral(DictLiteral node, C ctx) { return null; }

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitNumberLiteral(NumberLiteral node, C ctx) { return null; }

    default R visitStringLiteral(StringLiteral node, C ctx) { return null; }
}
