package com.asthralang.compiler.ast.stmt;

import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.decl.Annotation;

import java.util.Collections;
import java.util.List;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {
    protected List<Annotation> annotations = Collections.emptyList();

    protected Statement(SourceLocation location) {
        super(location);
    }

    @Override
    public List<Annotation> getAnnotations() {
        return annotations;
    }

    public void setAnnotations(List<Annotation> annotations) {
        this.annotations = annotations != null ? annotations : Collections.<Annotation>emptyList();
    }
}
