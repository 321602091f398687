package com.ailang.compiler.lexer;

import com.ailang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * AILang 词法分析器
 *
 * <p>空格、制表符与换行都是无意义空白，不产生缩进或换行 token。
 * 遇到 {@code ailang} / {@code asm} 后进入原样模式，按花括号深度整体截取外部语法。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 当前 token 的起始位置
    private int startLine = 1;
    private int startColumn = 1;
    private boolean sawNewline = false;

    // 上一个 token 为原样块引导词时非空，下一个 token 必须是 {...}
    private Token pendingRawOpener;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 声明
        map.put("def", TokenType.KW_DEF);
        map.put("func", TokenType.KW_FUNC);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("elif", TokenType.KW_ELIF);
        map.put("else", TokenType.KW_ELSE);
        map.put("while", TokenType.KW_WHILE);
        map.put("for", TokenType.KW_FOR);
        map.put("in", TokenType.KW_IN);
        map.put("return", TokenType.KW_RETURN);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);
        map.put("pass", TokenType.KW_PASS);
        map.put("end", TokenType.KW_END);

        // 逻辑
        map.put("and", TokenType.KW_AND);
        map.put("or", TokenType.KW_OR);
        map.put("not", TokenType.KW_NOT);

        // 常量
        map.put("True", TokenType.KW_TRUE);
        map.put("False", TokenType.KW_FALSE);
        map.put("None", TokenType.KW_NONE);

        // 原样块
        map.put("ailang", TokenType.KW_AILANG);
        map.put("asm", TokenType.KW_ASM);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 执行词法分析，返回以 EOF 结尾的 Token 列表
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.getType() != TokenType.EOF);
        return tokens;
    }

    /**
     * 获取下一个 Token（流式接口）。到达末尾后始终返回 EOF。
     */
    public Token nextToken() {
        if (pendingRawOpener != null) {
            Token opener = pendingRawOpener;
            pendingRawOpener = null;
            return rawBlock(opener);
        }

        skipWhitespaceAndComments();
        markStart();

        if (isAtEnd()) {
            return makeToken(TokenType.EOF, null);
        }
        return scanToken();
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t') {
                advance();
            } else if (c == '\n') {
                advance();
                newLine();
            } else if (c == '#') {
                // 单行注释
                while (peek() != '\n' && !isAtEnd()) advance();
            } else {
                break;
            }
        }
    }

    private Token scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': return makeToken(TokenType.LPAREN, null);
            case ')': return makeToken(TokenType.RPAREN, null);
            case '{': return makeToken(TokenType.LBRACE, null);
            case '}': return makeToken(TokenType.RBRACE, null);
            case '[': return makeToken(TokenType.LBRACKET, null);
            case ']': return makeToken(TokenType.RBRACKET, null);
            case ',': return makeToken(TokenType.COMMA, null);
            case '.': return makeToken(TokenType.DOT, null);
            case ':': return makeToken(TokenType.COLON, null);
            case ';': return makeToken(TokenType.SEMICOLON, null);
            case '%': return makeToken(TokenType.MOD, null);

            // 可能是多字符的 Token
            case '+':
                return makeToken(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS, null);

            case '-':
                if (match('=')) return makeToken(TokenType.MINUS_ASSIGN, null);
                if (match('>')) return makeToken(TokenType.ARROW, null);
                return makeToken(TokenType.MINUS, null);

            case '*':
                if (match('*')) return makeToken(TokenType.POW, null);
                if (match('=')) return makeToken(TokenType.MUL_ASSIGN, null);
                return makeToken(TokenType.MUL, null);

            case '/':
                if (match('/')) return makeToken(TokenType.FLOOR_DIV, null);
                if (match('=')) return makeToken(TokenType.DIV_ASSIGN, null);
                return makeToken(TokenType.DIV, null);

            case '=':
                return makeToken(match('=') ? TokenType.EQ : TokenType.ASSIGN, null);

            case '!':
                if (match('=')) return makeToken(TokenType.NE, null);
                throw error("Unexpected character '!'. Did you mean 'not' or '!='?");

            case '<':
                return makeToken(match('=') ? TokenType.LE : TokenType.LT, null);

            case '>':
                return makeToken(match('=') ? TokenType.GE : TokenType.GT, null);

            // 字符串
            case '"':
            case '\'':
                return string(c);

            default:
                if (isDigit(c)) {
                    return number();
                }
                if (isAlpha(c)) {
                    return identifier();
                }
                throw error("Unexpected character: " + c);
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
        sawNewline = true;
    }

    private void markStart() {
        start = current;
        startLine = line;
        startColumn = column;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) ||
               (c >= 'a' && c <= 'f') ||
               (c >= 'A' && c <= 'F');
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private Token makeToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        Token token = new Token(type, lexeme, literal, startLine, startColumn, start, sawNewline);
        sawNewline = false;
        return token;
    }

    private SourceLocation startLocation() {
        return new SourceLocation(fileName, startLine, startColumn, start, current - start);
    }

    private LexException error(String message) {
        return new LexException(message, startLocation());
    }

    private LexException errorHere(String message) {
        return new LexException(message, new SourceLocation(fileName, line, column, current, 0));
    }

    // === 复杂 Token 扫描 ===

    private Token string(char quote) {
        StringBuilder value = new StringBuilder();

        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\n') {
                throw error("Unterminated string");
            }
            if (peek() == '\\') {
                advance();
                value.append(escapeChar());
            } else {
                value.append(advance());
            }
        }

        if (isAtEnd()) {
            throw error("Unterminated string");
        }

        advance(); // 闭合引号
        return makeToken(TokenType.STRING_LITERAL, value.toString());
    }

    private char escapeChar() {
        if (isAtEnd()) {
            throw error("Unterminated string");
        }
        char c = advance();
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case '0': return '\0';
            case '\\': return '\\';
            case '\'': return '\'';
            case '"': return '"';
            default:
                throw errorHere("Invalid escape character: \\" + c);
        }
    }

    /** 移除数字中的下划线分隔符 */
    private static String stripUnderscores(String text) {
        return text.indexOf('_') >= 0 ? text.replace("_", "") : text;
    }

    /** 消耗数字字符和下划线分隔符 */
    private void advanceDigits() {
        while (isDigit(peek()) || peek() == '_') advance();
    }

    private Token number() {
        if (source.charAt(start) == '0' && (peek() == 'x' || peek() == 'X')) {
            return hexNumber();
        }

        advanceDigits();
        boolean isFloat = false;

        // 小数部分
        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance(); // 消费 .
            advanceDigits();
        }

        // 指数部分
        if (peek() == 'e' || peek() == 'E') {
            char next = peekNext();
            boolean signed = next == '+' || next == '-';
            char firstDigit = signed && current + 2 < source.length() ? source.charAt(current + 2) : next;
            if (!isDigit(firstDigit)) {
                throw errorHere("Malformed number literal: " + source.substring(start, current + 1));
            }
            isFloat = true;
            advance();
            if (signed) advance();
            advanceDigits();
        }

        if (isAlpha(peek())) {
            throw errorHere("Malformed number literal: " + source.substring(start, current + 1));
        }

        String text = stripUnderscores(source.substring(start, current));
        if (isFloat) {
            double value;
            try {
                value = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw error("Invalid float literal: " + source.substring(start, current));
            }
            // 溢出时 parseDouble 返回 Infinity 而不抛异常
            if (Double.isInfinite(value)) {
                throw error("Invalid float literal: " + source.substring(start, current));
            }
            return makeToken(TokenType.FLOAT_LITERAL, value);
        }
        return parseLong(text, 10);
    }

    private Token hexNumber() {
        advance(); // 消费 'x'
        while (isHexDigit(peek()) || peek() == '_') advance();

        String text = stripUnderscores(source.substring(start + 2, current));
        if (text.isEmpty() || isAlpha(peek())) {
            throw errorHere("Malformed number literal: " + source.substring(start, current));
        }
        return parseLong(text, 16);
    }

    private Token parseLong(String text, int radix) {
        try {
            return makeToken(TokenType.INT_LITERAL, Long.parseLong(text, radix));
        } catch (NumberFormatException e) {
            throw error("Invalid integer literal: " + source.substring(start, current));
        }
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        Token token = makeToken(type, null);
        if (type.isRawBlockOpener()) {
            pendingRawOpener = token;
        }
        return token;
    }

    /**
     * 原样模式：跳过空白后必须是 '{'，然后按花括号深度截取到匹配的 '}'。
     * 内容中的字符不做任何解释。
     */
    private Token rawBlock(Token opener) {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            if (advance() == '\n') newLine();
        }
        markStart();

        if (isAtEnd() || peek() != '{') {
            throw errorHere("Expected '{' after '" + opener.getLexeme() + "'");
        }
        advance(); // 消费 {
        int payloadStart = current;
        int depth = 1;

        while (depth > 0) {
            if (isAtEnd()) {
                SourceLocation at = new SourceLocation(fileName, opener.getLine(), opener.getColumn(),
                        opener.getOffset(), opener.getLexeme().length());
                throw new LexException("Unterminated raw block", at);
            }
            char c = advance();
            if (c == '\n') {
                newLine();
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
        }

        String payload = source.substring(payloadStart, current - 1);
        return makeToken(TokenType.RAW_BLOCK, payload);
    }
}
