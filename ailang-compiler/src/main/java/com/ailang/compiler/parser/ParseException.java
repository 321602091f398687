package com.ailang.compiler.parser;

import com.ailang.compiler.CompileException;
import com.ailang.compiler.Diagnostic;
import com.ailang.compiler.ast.SourceLocation;
import com.ailang.compiler.lexer.Token;
import com.ailang.compiler.lexer.TokenType;

/**
 * 解析异常
 */
public class ParseException extends CompileException {
    private final Token token;
    private final String expected;

    public ParseException(String message, Token token, String fileName) {
        this(message, token, null, fileName);
    }

    public ParseException(String message, Token token, String expected, String fileName) {
        super(Diagnostic.Phase.PARSE, message, new SourceLocation(fileName, token.getLine(),
                token.getColumn(), token.getOffset(), token.getLexeme().length()));
        this.token = token;
        this.expected = expected;
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    @Override
    protected String getDetail() {
        StringBuilder sb = new StringBuilder();
        if (token.getType() == TokenType.EOF) {
            sb.append(" (found end of input)");
        } else {
            sb.append(" (found '").append(token.getLexeme()).append("')");
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
