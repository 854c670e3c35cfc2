package com.asthralang.compiler.ast.decl;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.Visibility;
import com.asthralang.compiler.ast.stmt.Block;
import com.asthralang.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * impl 块中的方法声明
 */
public class MethodDecl extends FunctionDecl {

    /** 接收者形态 */
    public enum SelfKind {
        NONE,       // 关联函数 Type::f()
        VALUE,      // self
        REFERENCE   // &self
    }

    private final SelfKind selfKind;

    public MethodDecl(SourceLocation location, List<Annotation> annotations, Visibility visibility,
                      String name, SelfKind selfKind, List<Parameter> params,
                      TypeRef returnType, Block body) {
        super(location, annotations, visibility, name, null, params, returnType, body);
        this.selfKind = selfKind != null ? selfKind : SelfKind.NONE;
    }

    public SelfKind getSelfKind() {
        return selfKind;
    }

    public boolean isInstanceMethod() {
        return selfKind != SelfKind.NONE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMethodDecl(this, context);
    }
}
