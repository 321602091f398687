package com.ailang.ir;

/**
 * 编译选项
 */
public class CompilerOptions {

    /** 设置为 1 时打印 IR 文本 */
    public static final String DUMP_IR_ENV = "AILANG_DUMP_IR";

    private String tempPrefix = "t";
    private String mainFunctionName = "main";
    private boolean implicitReturn = true;
    private boolean dumpIr = "1".equals(System.getenv(DUMP_IR_ENV));
    private boolean prettyJson = true;

    public CompilerOptions() {
    }

    /**
     * 临时变量名前缀，编号从 0 开始
     */
    public String getTempPrefix() {
        return tempPrefix;
    }

    public void setTempPrefix(String tempPrefix) {
        if (tempPrefix == null || tempPrefix.isEmpty()) {
            throw new IllegalArgumentException("Temporary prefix must not be empty");
        }
        this.tempPrefix = tempPrefix;
    }

    /**
     * 顶层语句合成入口函数的名称
     */
    public String getMainFunctionName() {
        return mainFunctionName;
    }

    public void setMainFunctionName(String mainFunctionName) {
        this.mainFunctionName = mainFunctionName;
    }

    /**
     * 函数体末尾不是 return 时是否补上 return 0
     */
    public boolean isImplicitReturn() {
        return implicitReturn;
    }

    public void setImplicitReturn(boolean implicitReturn) {
        this.implicitReturn = implicitReturn;
    }

    public boolean isDumpIr() {
        return dumpIr;
    }

    public void setDumpIr(boolean dumpIr) {
        this.dumpIr = dumpIr;
    }

    public boolean isPrettyJson() {
        return prettyJson;
    }

    public void setPrettyJson(boolean prettyJson) {
        this.prettyJson = prettyJson;
    }
}
