package com.ailang.compiler.ast.expr;

import com.ailang.compiler.ast.AstVisitor;
import com.ailang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 列表字面量 [a, b, c]
 */
public class ListLiteral extends Expression {
    private final List<Expression> elements;

    public ListLiteral(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = elements;
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitListLiteral(this, context);
    }
}
