package com.ailang.ir.inst;

/**
 * IR 指令访问者。所有方法默认返回 null。
 */
public interface IrVisitor<R> {

    default R visitTempAssign(TempAssign inst) { return null; }

    default R visitBuiltinCall(BuiltinCall inst) { return null; }

    default R visitFunctionCall(FunctionCall inst) { return null; }

    default R visitIfBlock(IfBlock inst) { return null; }

    default R visitWhileBlock(WhileBlock inst) { return null; }

    default R visitReturnValue(ReturnValue inst) { return null; }

    default R visitRawPassthrough(RawPassthrough inst) { return null; }

    default R visitBreak(BreakInst inst) { return null; }

    default R visitContinue(ContinueInst inst) { return null; }

    default R visitNoOp(NoOp inst) { return null; }
}
