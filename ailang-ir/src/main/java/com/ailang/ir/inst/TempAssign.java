package com.ailang.ir.inst;

import com.ailang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * target = op operands。target 可以是临时变量，也可以是用户变量。
 */
public final class TempAssign extends IrInst {

    private final String target;
    private final IrOp op;
    private final List<Operand> operands;

    public TempAssign(SourceLocation location, String target, IrOp op, List<Operand> operands) {
        super(location);
        if (operands.size() != op.getArity()) {
            throw new IllegalArgumentException(op + " takes " + op.getArity()
                    + " operand(s), got " + operands.size());
        }
        this.target = target;
        this.op = op;
        this.operands = Collections.unmodifiableList(operands);
    }

    public String getTarget() { return target; }
    public IrOp getOp() { return op; }
    public List<Operand> getOperands() { return operands; }

    @Override
    public String getKind() {
        return "TempAssign";
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitTempAssign(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(target).append(" = ").append(op.name());
        for (int i = 0; i < operands.size(); i++) {
            sb.append(i == 0 ? " " : ", ").append(operands.get(i));
        }
        return sb.toString();
    }
}
