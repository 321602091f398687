package com.ailang.compiler.ast.expr;

import com.ailang.compiler.ast.AstVisitor;
import com.ailang.compiler.ast.SourceLocation;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符。precedence 越大绑定越紧。
     */
    public enum BinaryOp {
        // 逻辑（不短路）
        OR("or", 1),
        AND("and", 2),

        // 比较
        EQ("==", 4),
        NE("!=", 4),
        LT("<", 4),
        GT(">", 4),
        LE("<=", 4),
        GE(">=", 4),

        // 算术
        ADD("+", 5),
        SUB("-", 5),
        MUL("*", 6),
        DIV("/", 6),
        FLOOR_DIV("//", 6),
        MOD("%", 6),
        POW("**", 8);

        private final String source;
        private final int precedence;

        BinaryOp(String source, int precedence) {
            this.source = source;
            this.precedence = precedence;
        }

        /** 返回源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        public int getPrecedence() {
            return precedence;
        }

        public boolean isRightAssociative() {
            return this == POW;
        }
    }
}
