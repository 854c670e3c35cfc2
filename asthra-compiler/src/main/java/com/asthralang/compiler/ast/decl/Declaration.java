package com.asthralang.compiler.ast.decl;

import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.Visibility;

import java.util.Collections;
import java.util.List;

/**
 * 声明基类
 */
public abstract class Declaration extends AstNode {
    protected final List<Annotation> annotations;
    protected final Visibility visibility;
    protected final String name;

    protected Declaration(SourceLocation location, List<Annotation> annotations,
                          Visibility visibility, String name) {
        super(location);
        this.annotations = annotations != null ? annotations : Collections.<Annotation>emptyList();
        this.visibility = visibility != null ? visibility : Visibility.PRIVATE;
        this.name = name;
    }

    @Override
    public List<Annotation> getAnnotations() {
        return annotations;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public String getName() {
        return name;
    }

    public boolean hasAnnotation(String annotationName) {
        for (Annotation a : annotations) {
            if (a.getName().equals(annotationName)) return true;
        }
        return false;
    }
}
