package com.ailang.compiler.parser;

import com.ailang.compiler.ast.SourceLocation;
import com.ailang.compiler.ast.decl.FunctionDef;
import com.ailang.compiler.ast.decl.Program;
import com.ailang.compiler.ast.expr.Expression;
import com.ailang.compiler.ast.stmt.Statement;
import com.ailang.compiler.lexer.Lexer;
import com.ailang.compiler.lexer.Token;
import com.ailang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.ailang.compiler.lexer.TokenType.*;

/**
 * AILang 语法分析器（递归下降，单 token 前瞻）
 */
public class Parser {

    /** 顶层语句合成入口函数的默认名称 */
    public static final String DEFAULT_MAIN_NAME = "main";

    final Lexer lexer;
    final String fileName;
    Token current;
    Token previous;
    private Token nextToken;  // 用于 lookahead 的缓冲
    private String mainFunctionName = DEFAULT_MAIN_NAME;

    // === Helper 实例 ===
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer, String fileName) {
        this.lexer = lexer;
        this.fileName = fileName;
        advance();  // 读取第一个 token
    }

    public Parser(Lexer lexer) {
        this(lexer, lexer.getFileName());
    }

    public void setMainFunctionName(String mainFunctionName) {
        this.mainFunctionName = mainFunctionName;
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        if (nextToken != null) {
            current = nextToken;
            nextToken = null;
        } else {
            current = lexer.nextToken();
        }
        return previous;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        if (nextToken == null) {
            nextToken = lexer.nextToken();
        }
        return nextToken;
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 向前看一个 token（不消费当前）
     */
    boolean checkAhead(TokenType type) {
        return peek().getType() == type;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, describe(type), fileName);
    }

    ParseException error(String message) {
        return new ParseException(message, current, fileName);
    }

    ParseException error(String message, String expected) {
        return new ParseException(message, current, expected, fileName);
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return locationOf(current);
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        return locationOf(previous);
    }

    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn(),
                token.getOffset(), token.getLexeme().length());
    }

    /**
     * 是否到达文件末尾
     */
    boolean isAtEnd() {
        return check(EOF);
    }

    // ============ 程序解析 ============

    /**
     * 解析程序。顶层非函数语句按源码顺序收集到合成的入口函数中，放在所有函数之后。
     */
    public Program parse() {
        SourceLocation loc = location();
        List<FunctionDef> functions = new ArrayList<FunctionDef>();
        List<Statement> topLevelStatements = new ArrayList<Statement>();
        SourceLocation firstStatementLoc = null;

        while (!isAtEnd()) {
            if (current.getType().isFunctionIntroducer()) {
                functions.add(parseFunction());
            } else {
                if (firstStatementLoc == null) {
                    firstStatementLoc = location();
                }
                topLevelStatements.add(stmtParser.parseTopLevelStatement());
            }
        }

        if (!topLevelStatements.isEmpty()) {
            functions.add(new FunctionDef(firstStatementLoc, mainFunctionName,
                    Collections.<String>emptyList(), topLevelStatements, true));
        }
        return new Program(loc, functions);
    }

    /**
     * 解析函数定义：("def"|"func") IDENT "(" params ")" ["->" type] ":" suite
     */
    FunctionDef parseFunction() {
        SourceLocation loc = location();
        Token introducer = advance();  // def / func
        String name = expect(IDENTIFIER, "Expected function name after '" + introducer.getLexeme() + "'")
                .getLexeme();

        expect(LPAREN, "Expected '(' after function name");
        List<String> params = new ArrayList<String>();
        if (!check(RPAREN)) {
            do {
                if (check(RPAREN)) break;  // 允许尾随逗号
                params.add(expect(IDENTIFIER, "Expected parameter name").getLexeme());
                if (match(COLON)) {
                    parseType();
                }
            } while (match(COMMA));
        }
        expect(RPAREN, "Expected ')' after parameters");

        if (match(ARROW)) {
            parseType();
        }
        expect(COLON, "Expected ':' before function body");

        List<Statement> body = stmtParser.parseSuite("def " + name, introducer);
        return new FunctionDef(loc, name, params, body, false);
    }

    /**
     * 解析并丢弃类型注解：IDENT ["[" type ("," type)* "]"]
     */
    void parseType() {
        if (!match(IDENTIFIER) && !match(KW_NONE)) {
            throw error("Expected type name", "type");
        }
        if (match(LBRACKET)) {
            do {
                parseType();
            } while (match(COMMA));
            expect(RBRACKET, "Expected ']' after type arguments");
        }
    }

    // ============ 委托 ============

    Statement parseStatement() { return stmtParser.parseStatement(); }

    Expression parseExpression() { return exprParser.parseExpression(); }

    /**
     * token 类型在错误信息中的可读形式
     */
    static String describe(TokenType type) {
        switch (type) {
            case IDENTIFIER: return "identifier";
            case LPAREN: return "'('";
            case RPAREN: return "')'";
            case LBRACKET: return "'['";
            case RBRACKET: return "']'";
            case LBRACE: return "'{'";
            case RBRACE: return "'}'";
            case COLON: return "':'";
            case COMMA: return "','";
            case ASSIGN: return "'='";
            case RAW_BLOCK: return "raw block";
            case KW_IN: return "'in'";
            default: return type.name();
        }
    }
}
