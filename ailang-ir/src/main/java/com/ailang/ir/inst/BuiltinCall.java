package com.ailang.ir.inst;

import com.ailang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 调用运行时契约中的固定入口。result 为 null 表示不接收返回值。
 */
public final class BuiltinCall extends IrInst {

    private final String entry;
    private final List<Operand> operands;
    private final String result;

    public BuiltinCall(SourceLocation location, String entry, List<Operand> operands, String result) {
        super(location);
        this.entry = entry;
        this.operands = Collections.unmodifiableList(operands);
        this.result = result;
    }

    public String getEntry() { return entry; }
    public List<Operand> getOperands() { return operands; }
    public String getResult() { return result; }
    public boolean hasResult() { return result != null; }

    @Override
    public String getKind() {
        return "BuiltinCall";
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitBuiltinCall(this);
    }

    @Override
    public String toString() {
        return (result != null ? result + " = " : "") + "call " + entry + CallFormat.arguments(operands);
    }
}
