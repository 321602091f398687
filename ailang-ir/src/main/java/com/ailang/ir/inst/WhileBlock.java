package com.ailang.ir.inst;

import com.ailang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 结构化循环块。每次测试 condition 之前重新执行 conditionCode。
 */
public final class WhileBlock extends IrInst {

    private final List<IrInst> conditionCode;
    private final Operand condition;
    private final List<IrInst> body;

    public WhileBlock(SourceLocation location, List<IrInst> conditionCode, Operand condition, List<IrInst> body) {
        super(location);
        this.conditionCode = Collections.unmodifiableList(conditionCode);
        this.condition = condition;
        this.body = Collections.unmodifiableList(body);
    }

    public List<IrInst> getConditionCode() { return conditionCode; }
    public Operand getCondition() { return condition; }
    public List<IrInst> getBody() { return body; }

    @Override
    public String getKind() {
        return "WhileBlock";
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitWhileBlock(this);
    }

    @Override
    public String toString() {
        return "while " + condition;
    }
}
