package com.ailang.compiler.formatter;

import com.ailang.compiler.ast.*;
import com.ailang.compiler.ast.decl.*;
import com.ailang.compiler.ast.expr.*;
import com.ailang.compiler.ast.stmt.*;

import java.util.List;

/**
 * AILang AST 代码格式化器
 *
 * <p>遍历 AST，按统一格式规则输出源码：语句块一律以 {@code end} 结束，
 * 只在优先级需要时加括号。合成入口函数的语句输出为顶层语句。</p>
 */
public class AilangFormatter implements AstVisitor<Void, FormatterContext> {

    /** 调用、下标、字面量、标识符的优先级 */
    private static final int ATOM_PRECEDENCE = 9;

    /**
     * 格式化程序
     */
    public String format(Program program, FormatConfig config) {
        FormatterContext ctx = new FormatterContext(config);
        visitProgram(program, ctx);
        return ctx.getOutput();
    }

    /**
     * 使用默认配置格式化
     */
    public String format(Program program) {
        return format(program, new FormatConfig());
    }

    // ============ 声明 ============

    @Override
    public Void visitProgram(Program node, FormatterContext ctx) {
        for (FunctionDef function : node.getFunctions()) {
            // 函数之间空一行
            ctx.blankLine();
            function.accept(this, ctx);
        }
        return null;
    }

    @Override
    public Void visitFunctionDef(FunctionDef node, FormatterContext ctx) {
        if (node.isSynthetic()) {
            formatStatements(node.getBody(), ctx);
            return null;
        }

        ctx.append("def ");
        ctx.append(node.getName());
        ctx.append("(");
        List<String> params = node.getParams();
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) ctx.append(", ");
            ctx.append(params.get(i));
        }
        ctx.append("):");
        formatSuite(node.getBody(), ctx);
        formatEnd(ctx);
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitIfStmt(IfStmt node, FormatterContext ctx) {
        List<IfBranch> branches = node.getBranches();
        for (int i = 0; i < branches.size(); i++) {
            IfBranch branch = branches.get(i);
            ctx.append(i == 0 ? "if " : "elif ");
            formatExpression(branch.getCondition(), ctx);
            ctx.append(":");
            formatSuite(branch.getBody(), ctx);
        }
        if (node.hasElse()) {
            ctx.append("else:");
            formatSuite(node.getElseBody(), ctx);
        }
        formatEnd(ctx);
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, FormatterContext ctx) {
        ctx.append("while ");
        formatExpression(node.getCondition(), ctx);
        ctx.append(":");
        formatSuite(node.getBody(), ctx);
        formatEnd(ctx);
        return null;
    }

    @Override
    public Void visitForRangeStmt(ForRangeStmt node, FormatterContext ctx) {
        ctx.append("for ");
        ctx.append(node.getVariable());
        ctx.append(" in range(");
        if (node.getStart() != null) {
            formatExpression(node.getStart(), ctx);
            ctx.append(", ");
        }
        formatExpression(node.getStop(), ctx);
        if (node.getStep() != null) {
            ctx.append(", ");
            formatExpression(node.getStep(), ctx);
        }
        ctx.append("):");
        formatSuite(node.getBody(), ctx);
        formatEnd(ctx);
        return null;
    }

    @Override
    public Void visitForEachStmt(ForEachStmt node, FormatterContext ctx) {
        ctx.append("for ");
        ctx.append(node.getVariable());
        ctx.append(" in ");
        formatExpression(node.getIterable(), ctx);
        ctx.append(":");
        formatSuite(node.getBody(), ctx);
        formatEnd(ctx);
        return null;
    }

    @Override
    public Void visitAssignStmt(AssignStmt node, FormatterContext ctx) {
        ctx.append(node.getTarget());
        ctx.append(" = ");
        formatExpression(node.getValue(), ctx);
        ctx.endStatement();
        return null;
    }

    @Override
    public Void visitAugAssignStmt(AugAssignStmt node, FormatterContext ctx) {
        formatExpression(node.getTarget(), ctx);
        ctx.append(" " + node.getOperator().toSourceString() + "= ");
        formatExpression(node.getValue(), ctx);
        ctx.endStatement();
        return null;
    }

    @Override
    public Void visitIndexAssignStmt(IndexAssignStmt node, FormatterContext ctx) {
        formatOperand(node.getTarget(), ATOM_PRECEDENCE, ctx);
        ctx.append("[");
        formatExpression(node.getIndex(), ctx);
        ctx.append("] = ");
        formatExpression(node.getValue(), ctx);
        ctx.endStatement();
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, FormatterContext ctx) {
        ctx.append("return");
        if (node.hasValue()) {
            ctx.append(" ");
            formatExpression(node.getValue(), ctx);
        }
        ctx.endStatement();
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, FormatterContext ctx) {
        ctx.append("break");
        ctx.endStatement();
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, FormatterContext ctx) {
        ctx.append("continue");
        ctx.endStatement();
        return null;
    }

    @Override
    public Void visitPassStmt(PassStmt node, FormatterContext ctx) {
        ctx.append("pass");
        ctx.endStatement();
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, FormatterContext ctx) {
        formatExpression(node.getExpression(), ctx);
        ctx.endStatement();
        return null;
    }

    @Override
    public Void visitRawBlockStmt(RawBlockStmt node, FormatterContext ctx) {
        ctx.append(node.getOpener());
        ctx.append(" {");
        ctx.appendRaw(node.getPayload());
        ctx.appendRaw("}");
        ctx.newLine();
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitBinaryExpr(BinaryExpr node, FormatterContext ctx) {
        BinaryExpr.BinaryOp op = node.getOperator();
        int prec = op.getPrecedence();
        boolean rightAssoc = op.isRightAssociative();

        // 同级左结合时右侧加括号，右结合时左侧加括号
        formatOperand(node.getLeft(), rightAssoc ? prec + 1 : prec, ctx);
        ctx.append(" " + op.toSourceString() + " ");
        formatOperand(node.getRight(), rightAssoc ? prec : prec + 1, ctx);
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, FormatterContext ctx) {
        UnaryExpr.UnaryOp op = node.getOperator();
        ctx.append(op.toSourceString());
        formatOperand(node.getOperand(), op.getPrecedence(), ctx);
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, FormatterContext ctx) {
        ctx.append(node.getCallee());
        formatArguments(node.getArgs(), ctx);
        return null;
    }

    @Override
    public Void visitMethodCallExpr(MethodCallExpr node, FormatterContext ctx) {
        Expression receiver = node.getReceiver();
        // 数字后的 '.' 会被当作小数点
        if (receiver instanceof NumberLiteral) {
            ctx.append("(");
            receiver.accept(this, ctx);
            ctx.append(")");
        } else {
            formatOperand(receiver, ATOM_PRECEDENCE, ctx);
        }
        ctx.append(".");
        ctx.append(node.getMethod());
        formatArguments(node.getArgs(), ctx);
        return null;
    }

    @Override
    public Void visitIndexExpr(IndexExpr node, FormatterContext ctx) {
        formatOperand(node.getTarget(), ATOM_PRECEDENCE, ctx);
        ctx.append("[");
        formatExpression(node.getIndex(), ctx);
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitListLiteral(ListLiteral node, FormatterContext ctx) {
        ctx.append("[");
        List<Expression> elements = node.getElements();
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) ctx.append(", ");
            formatExpression(elements.get(i), ctx);
        }
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitDictLiteral(DictLiteral node, FormatterContext ctx) {
        ctx.append("{");
        for (int i = 0; i < node.size(); i++) {
            if (i > 0) ctx.append(", ");
            formatExpression(node.getKeys().get(i), ctx);
            ctx.append(": ");
            formatExpression(node.getValues().get(i), ctx);
        }
        ctx.append("}");
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node, FormatterContext ctx) {
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitNumberLiteral(NumberLiteral node, FormatterContext ctx) {
        ctx.append(node.getValue().toString());
        return null;
    }

    @Override
    public Void visitStringLiteral(StringLiteral node, FormatterContext ctx) {
        ctx.append("\"" + escapeString(node.getValue()) + "\"");
        return null;
    }

    // ============ 辅助方法 ============

    private void formatStatements(List<Statement> statements, FormatterContext ctx) {
        for (Statement stmt : statements) {
            stmt.accept(this, ctx);
        }
    }

    private void formatSuite(List<Statement> body, FormatterContext ctx) {
        ctx.newLine();
        ctx.indent();
        formatStatements(body, ctx);
        ctx.dedent();
    }

    private void formatEnd(FormatterContext ctx) {
        ctx.append("end");
        ctx.endStatement();
    }

    private void formatExpression(Expression expr, FormatterContext ctx) {
        expr.accept(this, ctx);
    }

    /**
     * 子表达式优先级低于 minPrecedence 时加括号
     */
    private void formatOperand(Expression expr, int minPrecedence, FormatterContext ctx) {
        if (precedenceOf(expr) < minPrecedence) {
            ctx.append("(");
            expr.accept(this, ctx);
            ctx.append(")");
        } else {
            expr.accept(this, ctx);
        }
    }

    private void formatArguments(List<Expression> args, FormatterContext ctx) {
        ctx.append("(");
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) ctx.append(", ");
            formatExpression(args.get(i), ctx);
        }
        ctx.append(")");
    }

    static int precedenceOf(Expression expr) {
        if (expr instanceof BinaryExpr) {
            return ((BinaryExpr) expr).getOperator().getPrecedence();
        }
        if (expr instanceof UnaryExpr) {
            return ((UnaryExpr) expr).getOperator().getPrecedence();
        }
        return ATOM_PRECEDENCE;
    }

    /** 转义字符串内容（双引号包裹） */
    static String escapeString(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\0': sb.append("\\0"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }
}
