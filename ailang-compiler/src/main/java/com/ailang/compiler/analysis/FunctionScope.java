package com.ailang.compiler.analysis;

import com.ailang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 函数作用域。每个函数一张平坦的表，块语句不引入新作用域。
 */
public final class FunctionScope {

    private final String functionName;
    private final Map<String, Symbol> symbols = new LinkedHashMap<String, Symbol>();

    public FunctionScope(String functionName) {
        this.functionName = functionName;
    }

    public String getFunctionName() { return functionName; }

    /** 参数在函数体生成前预先注册 */
    public Symbol defineParameter(String name, SourceLocation location) {
        if (symbols.containsKey(name)) {
            throw new NameResolutionException("Duplicate parameter '" + name
                    + "' in function '" + functionName + "'", location);
        }
        Symbol symbol = new Symbol(name, SymbolKind.PARAMETER, functionName, location, ValueKind.UNKNOWN);
        symbols.put(name, symbol);
        return symbol;
    }

    /**
     * 赋值时声明。已存在则返回原符号，否则以首次赋值处为声明位置。
     */
    public Symbol declare(String name, SymbolKind kind, SourceLocation location, ValueKind valueKind) {
        Symbol existing = symbols.get(name);
        if (existing != null) {
            return existing;
        }
        Symbol symbol = new Symbol(name, kind, functionName, location, valueKind);
        symbols.put(name, symbol);
        return symbol;
    }

    /**
     * 读取变量。未声明时抛出名称错误，位置为读取处。
     */
    public Symbol resolve(String name, SourceLocation location) {
        Symbol symbol = symbols.get(name);
        if (symbol == null) {
            throw new NameResolutionException("Name '" + name + "' is not defined in function '"
                    + functionName + "'", location);
        }
        return symbol;
    }

    /** 仅查找，不报错 */
    public Symbol lookup(String name) {
        return symbols.get(name);
    }

    public boolean isDeclared(String name) {
        return symbols.containsKey(name);
    }

    /** 按声明顺序返回所有符号 */
    public List<Symbol> getSymbols() {
        return Collections.unmodifiableList(new ArrayList<Symbol>(symbols.values()));
    }
}
