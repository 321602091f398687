package com.ailang.compiler.ast.stmt;

import com.ailang.compiler.ast.AstVisitor;
import com.ailang.compiler.ast.SourceLocation;

/**
 * 原样透传块 {@code ailang { ... }} / {@code asm { ... }}，内容不做任何校验
 */
public class RawBlockStmt extends Statement {
    private final String opener;
    private final String payload;

    public RawBlockStmt(SourceLocation location, String opener, String payload) {
        super(location);
        this.opener = opener;
        this.payload = payload;
    }

    /** 引导关键字：ailang 或 asm */
    public String getOpener() {
        return opener;
    }

    /** 外层花括号之间的原始文本 */
    public String getPayload() {
        return payload;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRawBlockStmt(this, context);
    }
}
