package com.asthralang.compiler.ast.decl;

import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;

/**
 * 包声明
 */
public class PackageDecl extends AstNode {
    private final String name;

    public PackageDecl(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPackageDecl(this, context);
    }
}
