package com.ailang.compiler.analysis;

import com.ailang.compiler.ast.SourceLocation;

/**
 * 函数作用域中的符号
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final String functionName;      // 所属函数
    private final SourceLocation location;  // 首次出现位置
    private ValueKind valueKind;

    public Symbol(String name, SymbolKind kind, String functionName,
                  SourceLocation location, ValueKind valueKind) {
        this.name = name;
        this.kind = kind;
        this.functionName = functionName;
        this.location = location;
        this.valueKind = valueKind != null ? valueKind : ValueKind.UNKNOWN;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public String getFunctionName() { return functionName; }
    public SourceLocation getLocation() { return location; }
    public ValueKind getValueKind() { return valueKind; }
    public void setValueKind(ValueKind valueKind) { this.valueKind = valueKind; }

    @Override
    public String toString() {
        return kind + " " + functionName + "." + name + ": " + valueKind.getDisplayName();
    }
}
