package com.ailang.ir.inst;

/**
 * 指令操作数：变量（含临时变量）、数字常量或字符串常量。
 */
public final class Operand {

    public enum Kind {
        VARIABLE,
        NUMBER,
        STRING
    }

    private final Kind kind;
    private final Object value;

    private Operand(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static Operand variable(String name) {
        return new Operand(Kind.VARIABLE, name);
    }

    public static Operand number(Number value) {
        return new Operand(Kind.NUMBER, value);
    }

    public static Operand string(String value) {
        return new Operand(Kind.STRING, value);
    }

    public Kind getKind() { return kind; }
    public Object getValue() { return value; }

    public boolean isVariable() { return kind == Kind.VARIABLE; }

    /** 变量名，非变量操作数返回 null */
    public String getName() {
        return kind == Kind.VARIABLE ? (String) value : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Operand)) return false;
        Operand other = (Operand) o;
        return kind == other.kind && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + value.hashCode();
    }

    @Override
    public String toString() {
        switch (kind) {
            case STRING:
                return "\"" + escape((String) value) + "\"";
            default:
                return String.valueOf(value);
        }
    }

    private static String escape(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\0': sb.append("\\0"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }
}
