package com.ailang.ir.inst;

import com.ailang.compiler.ast.SourceLocation;

public final class ContinueInst extends IrInst {

    public ContinueInst(SourceLocation location) {
        super(location);
    }

    @Override
    public String getKind() {
        return "Continue";
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitContinue(this);
    }

    @Override
    public String toString() {
        return "continue";
    }
}
