package com.ailang.compiler.ast.expr;

import com.ailang.compiler.ast.AstVisitor;
import com.ailang.compiler.ast.SourceLocation;

/**
 * 标识符表达式
 */
public class Identifier extends Expression {
    private final String name;

    public Identifier(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
