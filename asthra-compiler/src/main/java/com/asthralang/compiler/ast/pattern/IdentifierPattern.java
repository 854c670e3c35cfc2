package com.asthralang.compiler.ast.pattern;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;

/**
 * 绑定模式：x / mut x
 */
public class IdentifierPattern extends Pattern {
    private final String name;
    private final boolean mutable;

    public IdentifierPattern(SourceLocation location, String name, boolean mutable) {
        super(location);
        this.name = name;
        this.mutable = mutable;
    }

    public String getName() {
        return name;
    }

    public boolean isMutable() {
        return mutable;
    }

    @Override
    public boolean isIrrefutable() {
        return true;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifierPattern(this, context);
    }
}
