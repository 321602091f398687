package com.ailang.compiler.lexer;

/**
 * AILang 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    RAW_BLOCK,              // ailang { ... } / asm { ... } 的原样内容

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 - 声明 ===
    KW_DEF, KW_FUNC,

    // === 关键词 - 控制流 ===
    KW_IF, KW_ELIF, KW_ELSE, KW_WHILE, KW_FOR, KW_IN,
    KW_RETURN, KW_BREAK, KW_CONTINUE, KW_PASS, KW_END,

    // === 关键词 - 逻辑 ===
    KW_AND, KW_OR, KW_NOT,

    // === 关键词 - 常量 ===
    KW_TRUE, KW_FALSE, KW_NONE,

    // === 关键词 - 原样块 ===
    KW_AILANG, KW_ASM,

    // === 操作符 - 算术 ===
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    FLOOR_DIV,      // //
    MOD,            // %
    POW,            // **

    // === 操作符 - 比较 ===
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=

    // === 操作符 - 赋值 ===
    ASSIGN,         // =
    PLUS_ASSIGN,    // +=
    MINUS_ASSIGN,   // -=
    MUL_ASSIGN,     // *=
    DIV_ASSIGN,     // /=

    // === 分隔符 ===
    ARROW,          // ->
    LPAREN,         // (
    RPAREN,         // )
    LBRACE,         // {
    RBRACE,         // }
    LBRACKET,       // [
    RBRACKET,       // ]
    COMMA,          // ,
    DOT,            // .
    COLON,          // :
    SEMICOLON,      // ;

    // === 特殊 ===
    EOF;

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否为函数引导关键词（def / func）
     */
    public boolean isFunctionIntroducer() {
        return this == KW_DEF || this == KW_FUNC;
    }

    /**
     * 是否为块结束符（end / pass）
     */
    public boolean isBlockTerminator() {
        return this == KW_END || this == KW_PASS;
    }

    /**
     * 是否为原样块引导关键词（ailang / asm）
     */
    public boolean isRawBlockOpener() {
        return this == KW_AILANG || this == KW_ASM;
    }

    /**
     * 是否为复合赋值操作符
     */
    public boolean isAugmentedAssignmentOp() {
        switch (this) {
            case PLUS_ASSIGN:
            case MINUS_ASSIGN:
            case MUL_ASSIGN:
            case DIV_ASSIGN:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为比较操作符
     */
    public boolean isComparisonOp() {
        switch (this) {
            case EQ:
            case NE:
            case LT:
            case GT:
            case LE:
            case GE:
                return true;
            default:
                return false;
        }
    }
}
