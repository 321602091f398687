package com.ailang.ir.inst;

import com.ailang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * IR 函数声明：名称、有序参数、指令序列。
 */
public final class IrFunction {

    private final SourceLocation location;
    private final String name;
    private final List<String> params;
    private final List<IrInst> body;
    private final boolean synthetic;

    public IrFunction(SourceLocation location, String name, List<String> params,
                      List<IrInst> body, boolean synthetic) {
        this.location = location;
        this.name = name;
        this.params = Collections.unmodifiableList(params);
        this.body = Collections.unmodifiableList(body);
        this.synthetic = synthetic;
    }

    public SourceLocation getLocation() { return location; }
    public String getName() { return name; }
    public List<String> getParams() { return params; }
    public List<IrInst> getBody() { return body; }

    /** 是否由顶层语句合成 */
    public boolean isSynthetic() { return synthetic; }

    @Override
    public String toString() {
        return "function " + name + params;
    }
}
