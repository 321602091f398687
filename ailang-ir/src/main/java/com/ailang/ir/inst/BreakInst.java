package com.ailang.ir.inst;

import com.ailang.compiler.ast.SourceLocation;

public final class BreakInst extends IrInst {

    public BreakInst(SourceLocation location) {
        super(location);
    }

    @Override
    public String getKind() {
        return "Break";
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitBreak(this);
    }

    @Override
    public String toString() {
        return "break";
    }
}
