package com.ailang.ir.inst;

import com.ailang.compiler.ast.SourceLocation;

public final class NoOp extends IrInst {

    public NoOp(SourceLocation location) {
        super(location);
    }

    @Override
    public String getKind() {
        return "NoOp";
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitNoOp(this);
    }

    @Override
    public String toString() {
        return "nop";
    }
}
