package com.asthralang.compiler.analysis.types;

import com.asthralang.compiler.ast.AstNode;

/**
 * 结构体字段
 */
public final class StructField {
    private final String name;
    private final TypeDescriptor type;
    private final AstNode declaration;  // 借用，AST 持有
    private final boolean isPublic;
    private final int index;

    StructField(String name, TypeDescriptor type, AstNode declaration, boolean isPublic, int index) {
        this.name = name;
        this.type = type;
        this.declaration = declaration;
        this.isPublic = isPublic;
        this.index = index;
    }

    public String getName() {
        return name;
    }

    public TypeDescriptor getType() {
        return type;
    }

    public AstNode getDeclaration() {
        return declaration;
    }

    public boolean isPublic() {
        return isPublic;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public String toString() {
        return name + ": " + type.toDisplayString();
    }
}
