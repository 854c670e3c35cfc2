package com.asthralang.compiler.ast.decl;

import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.Visibility;
import com.asthralang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 结构体字段声明
 */
public class StructFieldDecl extends AstNode {
    private final String name;
    private final TypeRef type;
    private final Visibility visibility;
    private final List<Annotation> annotations;

    public StructFieldDecl(SourceLocation location, String name, TypeRef type,
                           Visibility visibility, List<Annotation> annotations) {
        super(location);
        this.name = name;
        this.type = type;
        this.visibility = visibility != null ? visibility : Visibility.PUBLIC;
        this.annotations = annotations != null ? annotations : Collections.<Annotation>emptyList();
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    @Override
    public List<Annotation> getAnnotations() {
        return annotations;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructFieldDecl(this, context);
    }
}
