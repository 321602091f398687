package com.ailang.compiler.analysis;

/**
 * 静态推断的值种类，用于方法调用和下标访问的运行时契约分派。
 *
 * <p>推断是尽力而为的：参数和函数返回值为 {@link #UNKNOWN}，
 * 同一变量先后被赋予不同种类的值时为 {@link #AMBIGUOUS}。</p>
 */
public enum ValueKind {
    NUMBER,
    STRING,
    LIST,
    DICT,
    UNKNOWN,
    AMBIGUOUS;

    /**
     * 合并两次赋值的种类。相同则保留；AMBIGUOUS 吸收一切；
     * UNKNOWN 与具体种类合并仍为 UNKNOWN；两个不同的具体种类为 AMBIGUOUS。
     */
    public ValueKind merge(ValueKind other) {
        if (other == null || other == this) return this;
        if (this == AMBIGUOUS || other == AMBIGUOUS) return AMBIGUOUS;
        if (this == UNKNOWN || other == UNKNOWN) return UNKNOWN;
        return AMBIGUOUS;
    }

    public boolean isConcrete() {
        return this != UNKNOWN && this != AMBIGUOUS;
    }

    public String getDisplayName() {
        return name().toLowerCase();
    }
}
