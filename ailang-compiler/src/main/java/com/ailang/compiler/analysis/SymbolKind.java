package com.ailang.compiler.analysis;

/**
 * 符号种类
 */
public enum SymbolKind {
    PARAMETER,      // 函数参数
    VARIABLE,       // 首次赋值声明的局部变量
    LOOP_VARIABLE   // for 循环变量
}
