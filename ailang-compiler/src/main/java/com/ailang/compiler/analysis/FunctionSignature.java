package com.ailang.compiler.analysis;

import com.ailang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 函数签名：名称与有序参数表
 */
public final class FunctionSignature {
    private final String name;
    private final List<String> params;
    private final SourceLocation location;
    private final boolean synthetic;

    public FunctionSignature(String name, List<String> params, SourceLocation location, boolean synthetic) {
        this.name = name;
        this.params = Collections.unmodifiableList(params);
        this.location = location;
        this.synthetic = synthetic;
    }

    public String getName() { return name; }
    public List<String> getParams() { return params; }
    public int getArity() { return params.size(); }
    public SourceLocation getLocation() { return location; }
    public boolean isSynthetic() { return synthetic; }

    @Override
    public String toString() {
        return name + "/" + params.size();
    }
}
