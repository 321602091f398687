package com.ailang.ir.inst;

import java.util.Collections;
import java.util.List;

/**
 * 一个源文件编译出的全部函数，按源码顺序排列（合成入口函数在最后）。
 */
public final class IrProgram {

    private final String fileName;
    private final List<IrFunction> functions;

    public IrProgram(String fileName, List<IrFunction> functions) {
        this.fileName = fileName;
        this.functions = Collections.unmodifiableList(functions);
    }

    public String getFileName() { return fileName; }
    public List<IrFunction> getFunctions() { return functions; }

    public IrFunction getFunction(String name) {
        for (IrFunction function : functions) {
            if (function.getName().equals(name)) {
                return function;
            }
        }
        return null;
    }
}
