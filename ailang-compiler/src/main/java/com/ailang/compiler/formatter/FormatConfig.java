package com.ailang.compiler.formatter;

/**
 * 代码格式化配置
 */
public class FormatConfig {
    private int indentSize = 4;
    private boolean useSpaces = true;
    private boolean semicolons = true;

    public FormatConfig() {
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        this.indentSize = indentSize;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    /**
     * 是否在简单语句和 end 之后输出 ';'
     */
    public boolean isSemicolons() {
        return semicolons;
    }

    public void setSemicolons(boolean semicolons) {
        this.semicolons = semicolons;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (useSpaces) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < indentSize; i++) {
                sb.append(' ');
            }
            return sb.toString();
        } else {
            return "\t";
        }
    }
}
