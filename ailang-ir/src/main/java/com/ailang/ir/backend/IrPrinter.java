package com.ailang.ir.backend;

import com.ailang.ir.inst.*;

import java.util.List;

/**
 * IR 文本转储，输出确定，可用于日志和比较。
 *
 * <pre>
 * function f(x):
 *   t0 = ADD x, 1
 *   return t0
 * end
 * </pre>
 */
public final class IrPrinter implements IrVisitor<Void> {

    private static final String INDENT = "  ";

    private final StringBuilder out = new StringBuilder();
    private int depth;

    private IrPrinter() {
    }

    public static String print(IrProgram program) {
        IrPrinter printer = new IrPrinter();
        List<IrFunction> functions = program.getFunctions();
        for (int i = 0; i < functions.size(); i++) {
            if (i > 0) printer.out.append('\n');
            printer.printFunction(functions.get(i));
        }
        return printer.out.toString();
    }

    public static String print(IrFunction function) {
        IrPrinter printer = new IrPrinter();
        printer.printFunction(function);
        return printer.out.toString();
    }

    /**
     * 只打印指令序列（不含函数头），用于比较函数体
     */
    public static String printBody(List<IrInst> body) {
        IrPrinter printer = new IrPrinter();
        printer.printAll(body);
        return printer.out.toString();
    }

    private void printFunction(IrFunction function) {
        line("function " + function.getName() + "(" + join(function.getParams()) + "):");
        depth++;
        printAll(function.getBody());
        depth--;
        line("end");
    }

    private void printAll(List<IrInst> insts) {
        for (IrInst inst : insts) {
            inst.accept(this);
        }
    }

    private void printNested(List<IrInst> insts) {
        depth++;
        printAll(insts);
        depth--;
    }

    @Override
    public Void visitIfBlock(IfBlock inst) {
        line("if " + inst.getCondition() + ":");
        printNested(inst.getThenBody());
        if (!inst.getElseBody().isEmpty()) {
            line("else:");
            printNested(inst.getElseBody());
        }
        line("end");
        return null;
    }

    @Override
    public Void visitWhileBlock(WhileBlock inst) {
        line("while:");
        printNested(inst.getConditionCode());
        line("test " + inst.getCondition() + " do");
        printNested(inst.getBody());
        line("end");
        return null;
    }

    @Override
    public Void visitTempAssign(TempAssign inst) {
        return simple(inst);
    }

    @Override
    public Void visitBuiltinCall(BuiltinCall inst) {
        return simple(inst);
    }

    @Override
    public Void visitFunctionCall(FunctionCall inst) {
        return simple(inst);
    }

    @Override
    public Void visitReturnValue(ReturnValue inst) {
        return simple(inst);
    }

    @Override
    public Void visitRawPassthrough(RawPassthrough inst) {
        return simple(inst);
    }

    @Override
    public Void visitBreak(BreakInst inst) {
        return simple(inst);
    }

    @Override
    public Void visitContinue(ContinueInst inst) {
        return simple(inst);
    }

    @Override
    public Void visitNoOp(NoOp inst) {
        return simple(inst);
    }

    private Void simple(IrInst inst) {
        line(inst.toString());
        return null;
    }

    private void line(String text) {
        for (int i = 0; i < depth; i++) {
            out.append(INDENT);
        }
        out.append(text).append('\n');
    }

    private static String join(List<String> names) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(names.get(i));
        }
        return sb.toString();
    }
}
