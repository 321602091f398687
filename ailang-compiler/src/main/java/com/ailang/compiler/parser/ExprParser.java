package com.ailang.compiler.parser;

import com.ailang.compiler.ast.SourceLocation;
import com.ailang.compiler.ast.expr.*;
import com.ailang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.ailang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseDisjunctionExpr();
    }

    // 逻辑或 or
    private Expression parseDisjunctionExpr() {
        Expression left = parseConjunctionExpr();

        while (parser.match(KW_OR)) {
            SourceLocation loc = parser.previousLocation();
            Expression right = parseConjunctionExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.OR, right);
        }

        return left;
    }

    // 逻辑与 and
    private Expression parseConjunctionExpr() {
        Expression left = parseNotExpr();

        while (parser.match(KW_AND)) {
            SourceLocation loc = parser.previousLocation();
            Expression right = parseNotExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.AND, right);
        }

        return left;
    }

    // 前缀 not，优先级低于比较：not a == b 即 not (a == b)
    private Expression parseNotExpr() {
        if (parser.match(KW_NOT)) {
            SourceLocation loc = parser.previousLocation();
            Expression operand = parseNotExpr();
            return new UnaryExpr(loc, UnaryExpr.UnaryOp.NOT, operand);
        }
        return parseComparisonExpr();
    }

    // 比较 == != < > <= >=（左结合）
    private Expression parseComparisonExpr() {
        Expression left = parseAdditiveExpr();

        while (parser.current.getType().isComparisonOp()) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseAdditiveExpr();
            BinaryExpr.BinaryOp binOp;
            switch (op.getType()) {
                case EQ: binOp = BinaryExpr.BinaryOp.EQ; break;
                case NE: binOp = BinaryExpr.BinaryOp.NE; break;
                case LT: binOp = BinaryExpr.BinaryOp.LT; break;
                case GT: binOp = BinaryExpr.BinaryOp.GT; break;
                case LE: binOp = BinaryExpr.BinaryOp.LE; break;
                case GE: binOp = BinaryExpr.BinaryOp.GE; break;
                default: throw new ParseException("Unexpected comparison operator", op, parser.fileName);
            }
            left = new BinaryExpr(loc, left, binOp, right);
        }

        return left;
    }

    // 加减 + -
    private Expression parseAdditiveExpr() {
        Expression left = parseMultiplicativeExpr();

        while (parser.checkAny(PLUS, MINUS)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseMultiplicativeExpr();
            BinaryExpr.BinaryOp binOp = op.getType() == PLUS ? BinaryExpr.BinaryOp.ADD : BinaryExpr.BinaryOp.SUB;
            left = new BinaryExpr(loc, left, binOp, right);
        }

        return left;
    }

    // 乘除 * / // %
    private Expression parseMultiplicativeExpr() {
        Expression left = parseUnaryExpr();

        while (parser.checkAny(MUL, DIV, FLOOR_DIV, MOD)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseUnaryExpr();
            BinaryExpr.BinaryOp binOp;
            switch (op.getType()) {
                case MUL: binOp = BinaryExpr.BinaryOp.MUL; break;
                case DIV: binOp = BinaryExpr.BinaryOp.DIV; break;
                case FLOOR_DIV: binOp = BinaryExpr.BinaryOp.FLOOR_DIV; break;
                default: binOp = BinaryExpr.BinaryOp.MOD; break;
            }
            left = new BinaryExpr(loc, left, binOp, right);
        }

        return left;
    }

    // 一元负号
    private Expression parseUnaryExpr() {
        if (parser.match(MINUS)) {
            SourceLocation loc = parser.previousLocation();
            Expression operand = parseUnaryExpr();
            return new UnaryExpr(loc, UnaryExpr.UnaryOp.NEG, operand);
        }
        return parsePowerExpr();
    }

    // 幂 **（右结合，右操作数可以带负号：2 ** -1）
    private Expression parsePowerExpr() {
        Expression base = parsePostfixExpr();

        if (parser.match(POW)) {
            SourceLocation loc = parser.previousLocation();
            Expression exponent = parseUnaryExpr();
            return new BinaryExpr(loc, base, BinaryExpr.BinaryOp.POW, exponent);
        }

        return base;
    }

    /**
     * 后缀：调用、下标、方法调用。换行后的 '(' 或 '[' 视为新语句的开始。
     */
    private Expression parsePostfixExpr() {
        Expression expr = parsePrimaryExpr();

        while (true) {
            if (parser.check(LPAREN) && !parser.current.isNewlineBefore()) {
                if (!(expr instanceof Identifier)) {
                    throw parser.error("Only named functions can be called");
                }
                parser.advance();
                List<Expression> args = parseArguments();
                expr = new CallExpr(expr.getLocation(), ((Identifier) expr).getName(), args);
            } else if (parser.check(LBRACKET) && !parser.current.isNewlineBefore()) {
                SourceLocation loc = parser.location();
                parser.advance();
                Expression index = parseExpression();
                parser.expect(RBRACKET, "Expected ']' after index");
                expr = new IndexExpr(loc, expr, index);
            } else if (parser.check(DOT)) {
                parser.advance();
                Token name = parser.expect(IDENTIFIER, "Expected method name after '.'");
                if (!parser.check(LPAREN)) {
                    throw parser.error("Attribute access without a call is not supported", "'('");
                }
                parser.advance();
                List<Expression> args = parseArguments();
                expr = new MethodCallExpr(parser.locationOf(name), expr, name.getLexeme(), args);
            } else {
                break;
            }
        }

        return expr;
    }

    /**
     * 解析调用参数，'(' 已被消费。允许尾随逗号。
     */
    List<Expression> parseArguments() {
        List<Expression> args = new ArrayList<Expression>();
        if (!parser.check(RPAREN)) {
            do {
                if (parser.check(RPAREN)) break;
                args.add(parseExpression());
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, "Expected ')' after arguments");
        return args;
    }

    private Expression parsePrimaryExpr() {
        SourceLocation loc = parser.location();
        Token token = parser.current;

        switch (token.getType()) {
            case INT_LITERAL:
            case FLOAT_LITERAL:
                parser.advance();
                return new NumberLiteral(loc, (Number) token.getLiteral());
            case STRING_LITERAL:
                parser.advance();
                return new StringLiteral(loc, (String) token.getLiteral());
            case KW_TRUE:
                parser.advance();
                return new NumberLiteral(loc, Long.valueOf(1L));
            case KW_FALSE:
            case KW_NONE:
                parser.advance();
                return new NumberLiteral(loc, Long.valueOf(0L));
            case IDENTIFIER:
                parser.advance();
                return new Identifier(loc, token.getLexeme());
            case LPAREN: {
                parser.advance();
                Expression inner = parseExpression();
                if (parser.check(COMMA)) {
                    throw parser.error("Tuples are not supported");
                }
                parser.expect(RPAREN, "Expected ')' after expression");
                return inner;
            }
            case LBRACKET:
                return parseListLiteral();
            case LBRACE:
                return parseDictLiteral();
            default:
                throw parser.error("Expected expression", "expression");
        }
    }

    // [e1, e2, ...]
    private Expression parseListLiteral() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACKET, "Expected '['");
        List<Expression> elements = new ArrayList<Expression>();
        if (!parser.check(RBRACKET)) {
            do {
                if (parser.check(RBRACKET)) break;
                elements.add(parseExpression());
            } while (parser.match(COMMA));
        }
        parser.expect(RBRACKET, "Expected ']' after list elements");
        return new ListLiteral(loc, elements);
    }

    // {k1: v1, k2: v2, ...}
    private Expression parseDictLiteral() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expected '{'");
        List<Expression> keys = new ArrayList<Expression>();
        List<Expression> values = new ArrayList<Expression>();
        if (!parser.check(RBRACE)) {
            do {
                if (parser.check(RBRACE)) break;
                keys.add(parseExpression());
                parser.expect(COLON, "Expected ':' after dictionary key");
                values.add(parseExpression());
            } while (parser.match(COMMA));
        }
        parser.expect(RBRACE, "Expected '}' after dictionary entries");
        return new DictLiteral(loc, keys, values);
    }
}
