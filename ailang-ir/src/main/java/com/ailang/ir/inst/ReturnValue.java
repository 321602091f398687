package com.ailang.ir.inst;

import com.ailang.compiler.ast.SourceLocation;

public final class ReturnValue extends IrInst {

    private final Operand value;

    public ReturnValue(SourceLocation location, Operand value) {
        super(location);
        this.value = value;
    }

    public Operand getValue() { return value; }

    @Override
    public String getKind() {
        return "ReturnValue";
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitReturnValue(this);
    }

    @Override
    public String toString() {
        return "return " + value;
    }
}
