package com.ailang.compiler;

import com.ailang.compiler.ast.SourceLocation;

/**
 * 编译诊断：交给调用方的唯一失败结果
 */
public final class Diagnostic {

    /**
     * 出错的编译阶段
     */
    public enum Phase {
        LEX("lex"),
        PARSE("parse"),
        RESOLVE("resolve"),
        GENERATE("generate");

        private final String label;

        Phase(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final Phase phase;
    private final String message;
    private final String file;
    private final int line;
    private final int column;

    public Diagnostic(Phase phase, String message, String file, int line, int column) {
        this.phase = phase;
        this.message = message;
        this.file = file;
        this.line = line;
        this.column = column;
    }

    public Phase getPhase() { return phase; }
    public String getMessage() { return message; }
    public String getFile() { return file; }
    public int getLine() { return line; }
    public int getColumn() { return column; }

    @Override
    public String toString() {
        return String.format("[%s:%d:%d] %s error: %s", file, line, column, phase.getLabel(), message);
    }
}
