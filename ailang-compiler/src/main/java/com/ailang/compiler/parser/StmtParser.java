package com.ailang.compiler.parser;

import com.ailang.compiler.ast.SourceLocation;
import com.ailang.compiler.ast.expr.BinaryExpr;
import com.ailang.compiler.ast.expr.CallExpr;
import com.ailang.compiler.ast.expr.Expression;
import com.ailang.compiler.ast.expr.Identifier;
import com.ailang.compiler.ast.expr.IndexExpr;
import com.ailang.compiler.ast.stmt.*;
import com.ailang.compiler.lexer.Token;
import com.ailang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.ailang.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 *
 * <p>语句块在 ':' 之后开始，到 {@code end} 结束；{@code pass} 也可以结束语句块，
 * 但紧跟 {@code end}（或 if 分支中紧跟 elif/else）时只是一条空语句。</p>
 */
class StmtParser {

    /**
     * 语句块的结束方式
     */
    enum SuiteEnd {
        TERMINATOR,     // end 或结束性的 pass
        ELIF,           // if 分支遇到 elif 隐式结束
        ELSE            // if 分支遇到 else 隐式结束
    }

    final Parser parser;
    private SuiteEnd lastSuiteEnd;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    // ============ 语句块 ============

    /**
     * 解析普通语句块，必须以结束符收尾
     */
    List<Statement> parseSuite(String construct, Token opener) {
        return parseSuite(construct, opener, false);
    }

    private List<Statement> parseSuite(String construct, Token opener, boolean ifBranch) {
        List<Statement> body = new ArrayList<Statement>();

        while (true) {
            if (parser.isAtEnd()) {
                throw parser.error("Unterminated block: '" + construct + "' opened at line "
                        + opener.getLine() + " is never closed", "'end'");
            }
            if (parser.match(KW_END)) {
                parser.match(SEMICOLON);
                lastSuiteEnd = SuiteEnd.TERMINATOR;
                return body;
            }
            if (parser.check(KW_PASS)) {
                body.add(new PassStmt(parser.location()));
                parser.advance();
                parser.match(SEMICOLON);
                if (parser.check(KW_END)) continue;
                if (ifBranch && parser.checkAny(KW_ELIF, KW_ELSE)) continue;
                lastSuiteEnd = SuiteEnd.TERMINATOR;
                return body;
            }
            if (ifBranch && parser.check(KW_ELIF)) {
                lastSuiteEnd = SuiteEnd.ELIF;
                return body;
            }
            if (ifBranch && parser.check(KW_ELSE)) {
                lastSuiteEnd = SuiteEnd.ELSE;
                return body;
            }
            if (parser.current.getType().isFunctionIntroducer()) {
                throw parser.error("Nested function definitions are not supported");
            }
            body.add(parseStatement());
        }
    }

    // ============ 语句 ============

    /**
     * 顶层语句：不在任何语句块内，所以 end 一定不匹配，pass 只是空语句
     */
    Statement parseTopLevelStatement() {
        if (parser.check(KW_END)) {
            throw parser.error("Unmatched 'end': no open block to close");
        }
        if (parser.check(KW_PASS)) {
            SourceLocation loc = parser.location();
            parser.advance();
            endStatement();
            return new PassStmt(loc);
        }
        return parseStatement();
    }

    Statement parseStatement() {
        switch (parser.current.getType()) {
            case KW_IF:
                return parseIfStmt();
            case KW_WHILE:
                return parseWhileStmt();
            case KW_FOR:
                return parseForStmt();
            case KW_RETURN:
                return parseReturnStmt();
            case KW_BREAK: {
                SourceLocation loc = parser.location();
                parser.advance();
                endStatement();
                return new BreakStmt(loc);
            }
            case KW_CONTINUE: {
                SourceLocation loc = parser.location();
                parser.advance();
                endStatement();
                return new ContinueStmt(loc);
            }
            case KW_AILANG:
            case KW_ASM:
                return parseRawBlock();
            case KW_END:
                throw parser.error("Unmatched 'end': no open block to close");
            case KW_ELIF:
            case KW_ELSE:
                throw parser.error("Unexpected '" + parser.current.getLexeme() + "': no open 'if' branch");
            default:
                break;
        }

        // 带类型注解的赋值: name: type = value
        if (parser.check(IDENTIFIER) && parser.checkAhead(COLON)) {
            return parseAnnotatedAssignment();
        }
        return parseSimpleStatement();
    }

    private IfStmt parseIfStmt() {
        SourceLocation loc = parser.location();
        Token opener = parser.expect(KW_IF, "Expected 'if'");
        List<IfBranch> branches = new ArrayList<IfBranch>();
        List<Statement> elseBody = null;

        Expression condition = parser.parseExpression();
        parser.expect(COLON, "Expected ':' after if condition");
        branches.add(new IfBranch(loc, condition, parseSuite("if", opener, true)));

        while (lastSuiteEnd == SuiteEnd.ELIF) {
            SourceLocation branchLoc = parser.location();
            parser.advance();  // elif
            Expression branchCondition = parser.parseExpression();
            parser.expect(COLON, "Expected ':' after elif condition");
            branches.add(new IfBranch(branchLoc, branchCondition, parseSuite("elif", opener, true)));
        }

        if (lastSuiteEnd == SuiteEnd.ELSE) {
            parser.advance();  // else
            parser.expect(COLON, "Expected ':' after 'else'");
            elseBody = parseSuite("else", opener, false);
        }

        return new IfStmt(loc, branches, elseBody);
    }

    private WhileStmt parseWhileStmt() {
        SourceLocation loc = parser.location();
        Token opener = parser.expect(KW_WHILE, "Expected 'while'");
        Expression condition = parser.parseExpression();
        parser.expect(COLON, "Expected ':' after while condition");
        return new WhileStmt(loc, condition, parseSuite("while", opener));
    }

    /**
     * for x in range(...) 解析为 ForRangeStmt，其余迭代对象解析为 ForEachStmt
     */
    private Statement parseForStmt() {
        SourceLocation loc = parser.location();
        Token opener = parser.expect(KW_FOR, "Expected 'for'");
        String variable = parser.expect(IDENTIFIER, "Expected loop variable after 'for'").getLexeme();
        if (parser.check(COMMA)) {
            throw parser.error("Multiple loop variables are not supported");
        }
        parser.expect(KW_IN, "Expected 'in' after loop variable");

        Token iterableStart = parser.current;
        Expression iterable = parser.parseExpression();
        parser.expect(COLON, "Expected ':' after for iterable");

        if (iterable instanceof CallExpr && "range".equals(((CallExpr) iterable).getCallee())) {
            List<Expression> args = ((CallExpr) iterable).getArgs();
            if (args.isEmpty() || args.size() > 3) {
                throw new ParseException("range() takes 1 to 3 arguments, got " + args.size(),
                        iterableStart, parser.fileName);
            }
            Expression start = args.size() >= 2 ? args.get(0) : null;
            Expression stop = args.size() >= 2 ? args.get(1) : args.get(0);
            Expression step = args.size() == 3 ? args.get(2) : null;
            List<Statement> body = parseSuite("for", opener);
            return new ForRangeStmt(loc, variable, start, stop, step, body);
        }

        List<Statement> body = parseSuite("for", opener);
        return new ForEachStmt(loc, variable, iterable, body);
    }

    /**
     * return 只在值与关键字位于同一行时才带返回值
     */
    private ReturnStmt parseReturnStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_RETURN, "Expected 'return'");

        Expression value = null;
        if (canStartExpression(parser.current) && !parser.current.isNewlineBefore()) {
            value = parser.parseExpression();
        }
        endStatement();
        return new ReturnStmt(loc, value);
    }

    private RawBlockStmt parseRawBlock() {
        SourceLocation loc = parser.location();
        Token opener = parser.advance();
        Token raw = parser.expect(RAW_BLOCK, "Expected raw block after '" + opener.getLexeme() + "'");
        parser.match(SEMICOLON);
        return new RawBlockStmt(loc, opener.getLexeme(), (String) raw.getLiteral());
    }

    private Statement parseAnnotatedAssignment() {
        SourceLocation loc = parser.location();
        String name = parser.advance().getLexeme();
        parser.advance();  // ':'
        parser.parseType();
        parser.expect(ASSIGN, "Expected '=' after type annotation");
        Expression value = parser.parseExpression();
        endStatement();
        return new AssignStmt(loc, name, value);
    }

    /**
     * 赋值、复合赋值、下标赋值或表达式语句
     */
    private Statement parseSimpleStatement() {
        SourceLocation loc = parser.location();
        Token targetToken = parser.current;
        Expression expr = parser.parseExpression();

        if (parser.check(COMMA)) {
            throw parser.error("Multiple assignment targets are not supported");
        }

        if (parser.check(ASSIGN)) {
            parser.advance();
            Expression value = parser.parseExpression();
            if (parser.check(ASSIGN)) {
                throw parser.error("Chained assignment is not supported");
            }
            endStatement();
            if (expr instanceof Identifier) {
                return new AssignStmt(loc, ((Identifier) expr).getName(), value);
            }
            if (expr instanceof IndexExpr) {
                IndexExpr target = (IndexExpr) expr;
                return new IndexAssignStmt(loc, target.getTarget(), target.getIndex(), value);
            }
            throw new ParseException("Invalid assignment target", targetToken, parser.fileName);
        }

        if (parser.current.getType().isAugmentedAssignmentOp()) {
            Token op = parser.advance();
            if (!(expr instanceof Identifier) && !(expr instanceof IndexExpr)) {
                throw new ParseException("Invalid assignment target", targetToken, parser.fileName);
            }
            Expression value = parser.parseExpression();
            endStatement();
            return new AugAssignStmt(loc, expr, augmentedOperator(op.getType()), value);
        }

        endStatement();
        return new ExpressionStmt(loc, expr);
    }

    private static BinaryExpr.BinaryOp augmentedOperator(TokenType type) {
        switch (type) {
            case PLUS_ASSIGN: return BinaryExpr.BinaryOp.ADD;
            case MINUS_ASSIGN: return BinaryExpr.BinaryOp.SUB;
            case MUL_ASSIGN: return BinaryExpr.BinaryOp.MUL;
            case DIV_ASSIGN: return BinaryExpr.BinaryOp.DIV;
            default: throw new IllegalArgumentException("Not an augmented assignment: " + type);
        }
    }

    // ============ 语句分隔 ============

    /**
     * 简单语句之后：有 ';' 则消费；没有时下一个 token 必须能开始新语句或结束语句块
     */
    void endStatement() {
        if (parser.match(SEMICOLON)) {
            return;
        }
        Token next = parser.current;
        if (next.getType() == EOF || next.getType().isBlockTerminator()
                || next.isOneOf(KW_ELIF, KW_ELSE) || canStartStatement(next)) {
            return;
        }
        throw parser.error("Unexpected token after statement", "';' or a new statement");
    }

    static boolean canStartStatement(Token token) {
        TokenType type = token.getType();
        if (type.isFunctionIntroducer() || type.isRawBlockOpener()) return true;
        switch (type) {
            case KW_IF:
            case KW_WHILE:
            case KW_FOR:
            case KW_RETURN:
            case KW_BREAK:
            case KW_CONTINUE:
            case KW_PASS:
                return true;
            default:
                return canStartExpression(token);
        }
    }

    static boolean canStartExpression(Token token) {
        switch (token.getType()) {
            case IDENTIFIER:
            case INT_LITERAL:
            case FLOAT_LITERAL:
            case STRING_LITERAL:
            case KW_TRUE:
            case KW_FALSE:
            case KW_NONE:
            case KW_NOT:
            case MINUS:
            case LPAREN:
            case LBRACKET:
            case LBRACE:
                return true;
            default:
                return false;
        }
    }
}
