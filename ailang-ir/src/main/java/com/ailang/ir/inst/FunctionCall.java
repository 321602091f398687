package com.ailang.ir.inst;

import com.ailang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 调用程序中定义的函数。result 为 null 表示不接收返回值。
 */
public final class FunctionCall extends IrInst {

    private final String function;
    private final List<Operand> operands;
    private final String result;

    public FunctionCall(SourceLocation location, String function, List<Operand> operands, String result) {
        super(location);
        this.function = function;
        this.operands = Collections.unmodifiableList(operands);
        this.result = result;
    }

    public String getFunction() { return function; }
    public List<Operand> getOperands() { return operands; }
    public String getResult() { return result; }
    public boolean hasResult() { return result != null; }

    @Override
    public String getKind() {
        return "FunctionCall";
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public String toString() {
        return (result != null ? result + " = " : "") + "invoke " + function + CallFormat.arguments(operands);
    }
}
