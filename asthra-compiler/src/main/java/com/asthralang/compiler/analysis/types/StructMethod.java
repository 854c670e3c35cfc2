package com.asthralang.compiler.analysis.types;

import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.decl.MethodDecl;

/**
 * impl 块中注册到结构体方法表的方法
 */
public final class StructMethod {
    private final String name;
    private final FunctionType signature;   // 不含 self
    private final MethodDecl.SelfKind selfKind;
    private final boolean isPublic;
    private final AstNode declaration;

    public StructMethod(String name, FunctionType signature, MethodDecl.SelfKind selfKind,
                        boolean isPublic, AstNode declaration) {
        this.name = name;
        this.signature = signature;
        this.selfKind = selfKind;
        this.isPublic = isPublic;
        this.declaration = declaration;
    }

    public String getName() {
        return name;
    }

    public FunctionType getSignature() {
        return signature;
    }

    public MethodDecl.SelfKind getSelfKind() {
        return selfKind;
    }

    public boolean isInstanceMethod() {
        return selfKind != MethodDecl.SelfKind.NONE;
    }

    public boolean isPublic() {
        return isPublic;
    }

    public AstNode getDeclaration() {
        return declaration;
    }
}
