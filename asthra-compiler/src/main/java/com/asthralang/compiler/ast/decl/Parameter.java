package com.asthralang.compiler.ast.decl;

import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 函数参数
 */
public class Parameter extends AstNode {
    private final String name;
    private final TypeRef type;
    private final boolean mutable;
    private final List<Annotation> annotations;

    public Parameter(SourceLocation location, String name, TypeRef type, boolean mutable,
                     List<Annotation> annotations) {
        super(location);
        this.name = name;
        this.type = type;
        this.mutable = mutable;
        this.annotations = annotations != null ? annotations : Collections.<Annotation>emptyList();
    }

    public Parameter(SourceLocation location, String name, TypeRef type) {
        this(location, name, type, false, null);
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    public boolean isMutable() {
        return mutable;
    }

    @Override
    public List<Annotation> getAnnotations() {
        return annotations;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
