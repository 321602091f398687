package com.ailang.ir.inst;

import com.ailang.compiler.ast.SourceLocation;

/**
 * IR 指令基类。
 */
public abstract class IrInst {

    private final SourceLocation location;

    protected IrInst(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /**
     * 序列化时使用的指令类别标签
     */
    public abstract String getKind();

    public abstract <R> R accept(IrVisitor<R> visitor);
}
