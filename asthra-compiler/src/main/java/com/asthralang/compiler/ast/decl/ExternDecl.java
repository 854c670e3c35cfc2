package com.asthralang.compiler.ast.decl;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.Visibility;
import com.asthralang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 外部函数声明：{@code extern "libc" fn malloc(size: usize) -> *mut void;}
 */
public class ExternDecl extends Declaration {
    private final String libraryName;   // 可选
    private final List<Parameter> params;
    private final TypeRef returnType;
    private final List<Annotation> returnAnnotations;

    public ExternDecl(SourceLocation location, List<Annotation> annotations, Visibility visibility,
                      String name, String libraryName, List<Parameter> params, TypeRef returnType,
                      List<Annotation> returnAnnotations) {
        super(location, annotations, visibility, name);
        this.libraryName = libraryName;
        this.params = params != null ? params : Collections.<Parameter>emptyList();
        this.returnType = returnType;
        this.returnAnnotations = returnAnnotations != null
                ? returnAnnotations : Collections.<Annotation>emptyList();
    }

    public String getLibraryName() {
        return libraryName;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public List<Annotation> getReturnAnnotations() {
        return returnAnnotations;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExternDecl(this, context);
    }
}
