package com.ailang.compiler.formatter;

/**
 * 格式化上下文，跟踪输出缓冲区和缩进层级
 */
public class FormatterContext {
    private final StringBuilder output = new StringBuilder();
    private final FormatConfig config;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public FormatterContext(FormatConfig config) {
        this.config = config;
    }

    public FormatConfig getConfig() {
        return config;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加文本（自动处理行首缩进）
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            output.append(indentString());
            atLineStart = false;
        }
        output.append(text);
    }

    /**
     * 原样追加，不处理缩进（用于透传块内容）
     */
    public void appendRaw(String text) {
        output.append(text);
        atLineStart = text.endsWith("\n");
    }

    /**
     * 结束一条简单语句
     */
    public void endStatement() {
        if (config.isSemicolons()) {
            output.append(';');
        }
        newLine();
    }

    /**
     * 换行
     */
    public void newLine() {
        output.append("\n");
        atLineStart = true;
    }

    /**
     * 追加空行，避免连续多个空行
     */
    public void blankLine() {
        if (output.length() == 0 || output.toString().endsWith("\n\n")) {
            return;
        }
        if (!atLineStart) {
            output.append("\n");
        }
        output.append("\n");
        atLineStart = true;
    }

    /**
     * 获取当前输出
     */
    public String getOutput() {
        return output.toString();
    }

    private String indentString() {
        String unit = config.getIndentString();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentLevel; i++) {
            sb.append(unit);
        }
        return sb.toString();
    }
}
