package com.asthralang.compiler.ast.pattern;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;

/**
 * _
 */
public class WildcardPattern extends Pattern {

    public WildcardPattern(SourceLocation location) {
        super(location);
    }

    @Override
    public boolean isIrrefutable() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitWildcardPattern(this, context);
    }
}
