package com.asthralang.compiler.ast.expr;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 数组字面量：[a, b, c]
 */
public class ArrayLiteral extends Expression {
    private final List<Expression> elements;

    public ArrayLiteral(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = elements != null ? elements : Collections.<Expression>emptyList();
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayLiteral(this, context);
    }
}
