package com.asthralang.compiler.ast.type;

import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;

/**
 * 泛型参数声明：struct Box&lt;T&gt; 中的 T
 */
public class TypeParameter extends AstNode {
    private final String name;

    public TypeParameter(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return null;
    }
}
