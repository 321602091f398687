package com.ailang.compiler;

import com.ailang.compiler.ast.SourceLocation;

/**
 * 编译异常基类。任意阶段抛出后整个文件的编译立即终止。
 */
public abstract class CompileException extends RuntimeException {
    private final Diagnostic.Phase phase;
    private final SourceLocation location;

    protected CompileException(Diagnostic.Phase phase, String message, SourceLocation location) {
        super(message);
        this.phase = phase;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public Diagnostic.Phase getPhase() {
        return phase;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public int getLine() {
        return location.getLine();
    }

    public int getColumn() {
        return location.getColumn();
    }

    /** 不带位置后缀的原始消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    /** 附加说明（如实际遇到的 token），默认为空 */
    protected String getDetail() {
        return "";
    }

    public Diagnostic toDiagnostic() {
        return new Diagnostic(phase, getRawMessage() + getDetail(), location.getFile(),
                location.getLine(), location.getColumn());
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " at line " + location.getLine()
                + ", column " + location.getColumn() + getDetail();
    }
}
