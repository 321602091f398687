package com.ailang.ir.builtin;

import com.ailang.compiler.analysis.ValueKind;

/**
 * 内置函数或方法到运行时入口的映射。
 */
public final class BuiltinSpec {

    /** 任意个数参数 */
    public static final int VARIADIC = -1;

    private final String name;
    private final String entry;
    private final int arity;
    private final ValueKind resultKind;  // null = 无返回值
    private final RuntimeContract contract;

    BuiltinSpec(String name, String entry, int arity, ValueKind resultKind, RuntimeContract contract) {
        this.name = name;
        this.entry = entry;
        this.arity = arity;
        this.resultKind = resultKind;
        this.contract = contract;
    }

    public String getName() { return name; }
    public String getEntry() { return entry; }
    public int getArity() { return arity; }
    public ValueKind getResultKind() { return resultKind; }
    public RuntimeContract getContract() { return contract; }

    public boolean isVariadic() { return arity == VARIADIC; }
    public boolean hasResult() { return resultKind != null; }

    public boolean accepts(int argCount) {
        return arity == VARIADIC || arity == argCount;
    }

    @Override
    public String toString() {
        return name + " -> " + entry + "/" + (arity == VARIADIC ? "*" : String.valueOf(arity));
    }
}
