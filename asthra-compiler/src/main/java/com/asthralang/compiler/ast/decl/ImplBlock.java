package com.asthralang.compiler.ast.decl;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.Visibility;

import java.util.Collections;
import java.util.List;

/**
 * impl 块，名称即目标结构体名
 */
public class ImplBlock extends Declaration {
    private final List<MethodDecl> methods;

    public ImplBlock(SourceLocation location, List<Annotation> annotations, String structName,
                     List<MethodDecl> methods) {
        super(location, annotations, Visibility.PUBLIC, structName);
        this.methods = methods != null ? methods : Collections.<MethodDecl>emptyList();
    }

    public String getStructName() {
        return name;
    }

    public List<MethodDecl> getMethods() {
        return methods;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImplBlock(this, context);
    }
}
