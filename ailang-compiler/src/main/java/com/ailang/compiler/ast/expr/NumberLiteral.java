package com.ailang.compiler.ast.expr;

import com.ailang.compiler.ast.AstVisitor;
import com.ailang.compiler.ast.SourceLocation;

/**
 * 数字字面量。整数为 Long，浮点为 Double；True/False/None 折叠为 1/0/0。
 */
public class NumberLiteral extends Expression {
    private final Number value;

    public NumberLiteral(SourceLocation location, Number value) {
        super(location);
        this.value = value;
    }

    public Number getValue() {
        return value;
    }

    public boolean isInteger() {
        return value instanceof Long;
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNumberLiteral(this, context);
    }
}
