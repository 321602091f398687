package com.ailang.ir.inst;

/**
 * TempAssign 的操作码。
 */
public enum IrOp {
    // 复制
    COPY(1),

    // 算术
    ADD(2),
    SUB(2),
    MUL(2),
    DIV(2),
    FLOOR_DIV(2),
    MOD(2),
    POW(2),

    // 比较
    EQ(2),
    NE(2),
    LT(2),
    GT(2),
    LE(2),
    GE(2),

    // 逻辑（不短路）
    AND(2),
    OR(2),

    // 一元
    NEG(1),
    NOT(1);

    private final int arity;

    IrOp(int arity) {
        this.arity = arity;
    }

    public int getArity() {
        return arity;
    }
}
