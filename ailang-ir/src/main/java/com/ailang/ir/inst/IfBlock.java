package com.ailang.ir.inst;

import com.ailang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 结构化条件块。elif 链表示为嵌套在 else 列表中的 IfBlock，
 * elif 条件的计算指令也位于该 else 列表中。
 */
public final class IfBlock extends IrInst {

    private final Operand condition;
    private final List<IrInst> thenBody;
    private final List<IrInst> elseBody;

    public IfBlock(SourceLocation location, Operand condition, List<IrInst> thenBody, List<IrInst> elseBody) {
        super(location);
        this.condition = condition;
        this.thenBody = Collections.unmodifiableList(thenBody);
        this.elseBody = Collections.unmodifiableList(elseBody);
    }

    public Operand getCondition() { return condition; }
    public List<IrInst> getThenBody() { return thenBody; }
    public List<IrInst> getElseBody() { return elseBody; }

    @Override
    public String getKind() {
        return "IfBlock";
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitIfBlock(this);
    }

    @Override
    public String toString() {
        return "if " + condition;
    }
}
