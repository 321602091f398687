package com.ailang.compiler.ast.expr;

import com.ailang.compiler.ast.AstVisitor;
import com.ailang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 字典字面量 {k: v, ...}，键值按源码顺序成对保存
 */
public class DictLiteral extends Expression {
    private final List<Expression> keys;
    private final List<Expression> values;

    public DictLiteral(SourceLocation location, List<Expression> keys, List<Expression> values) {
        super(location);
        this.keys = keys;
        this.values = values;
    }

    public List<Expression> getKeys() {
        return keys;
    }

    public List<Expression> getValues() {
        return values;
    }

    public int size() {
        return keys.size();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitDictLiteral(this, context);
    }
}
