package com.asthralang.compiler.ast.expr;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 元组字面量：(a, b)
 */
public class TupleLiteral extends Expression {
    private final List<Expression> elements;

    public TupleLiteral(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = elements != null ? elements : Collections.<Expression>emptyList();
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTupleLiteral(this, context);
    }
}
