package com.asthralang.compiler.ast.pattern;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 元组模式：(a, _, 3)
 */
public class TuplePattern extends Pattern {
    private final List<Pattern> elements;

    public TuplePattern(SourceLocation location, List<Pattern> elements) {
        super(location);
        this.elements = elements != null ? elements : Collections.<Pattern>emptyList();
    }

    public List<Pattern> getElements() {
        return elements;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTuplePattern(this, context);
    }
}
