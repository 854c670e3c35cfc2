package com.asthralang.compiler.analysis;

import com.asthralang.compiler.analysis.types.TypeDescriptor;
import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.Visibility;
import com.asthralang.compiler.ast.decl.Annotation;
import com.asthralang.compiler.ast.decl.MethodDecl;

import java.util.Collections;
import java.util.List;

/**
 * 符号表中的符号
 *
 * <p>符号持有其类型描述符的一个引用；声明节点为借用，AST 持有。</p>
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final AstNode declaration;     // 声明的 AST 节点
    private final Visibility visibility;
    private TypeDescriptor type;
    private int scopeId;

    // 状态标记
    private volatile boolean used;
    private boolean exported;
    private boolean mutable;
    private boolean initialized;
    private boolean predeclared;

    // 额外信息
    private ConstValue constValue;                 // const 符号
    private List<Annotation> annotations = Collections.emptyList();  // 函数的注解
    private MethodDecl.SelfKind selfKind;          // 方法的接收者形态

    public Symbol(String name, SymbolKind kind, TypeDescriptor type, AstNode declaration, Visibility visibility) {
        this.name = name;
        this.kind = kind;
        this.declaration = declaration;
        this.visibility = visibility != null ? visibility : Visibility.PRIVATE;
        this.type = type != null ? type.retain() : null;
        this.exported = this.visibility == Visibility.PUBLIC;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public AstNode getDeclaration() { return declaration; }
    public Visibility getVisibility() { return visibility; }
    public TypeDescriptor getType() { return type; }

    public SourceLocation getLocation() {
        return declaration != null ? declaration.getLocation() : SourceLocation.UNKNOWN;
    }

    /** 替换类型：持有新类型，归还旧类型 */
    public void setType(TypeDescriptor newType) {
        if (newType == type) return;
        if (newType != null) newType.retain();
        TypeDescriptor old = type;
        type = newType;
        if (old != null) old.release();
    }

    /** 作用域销毁时调用 */
    void releaseType() {
        TypeDescriptor old = type;
        type = null;
        if (old != null && !old.isReleased()) old.release();
    }

    public int getScopeId() { return scopeId; }
    void setScopeId(int scopeId) { this.scopeId = scopeId; }

    public boolean isUsed() { return used; }
    public void markUsed() { this.used = true; }

    public boolean isExported() { return exported; }
    public void setExported(boolean exported) { this.exported = exported; }

    public boolean isMutable() { return mutable; }
    public void setMutable(boolean mutable) { this.mutable = mutable; }

    public boolean isInitialized() { return initialized; }
    public void setInitialized(boolean initialized) { this.initialized = initialized; }

    public boolean isPredeclared() { return predeclared; }
    public void setPredeclared(boolean predeclared) { this.predeclared = predeclared; }

    public ConstValue getConstValue() { return constValue; }
    public void setConstValue(ConstValue constValue) { this.constValue = constValue; }

    public List<Annotation> getAnnotations() { return annotations; }

    public void setAnnotations(List<Annotation> annotations) {
        this.annotations = annotations != null ? annotations : Collections.<Annotation>emptyList();
    }

    public boolean hasAnnotation(String annotationName) {
        for (Annotation a : annotations) {
            if (a.getName().equals(annotationName)) return true;
        }
        return false;
    }

    public MethodDecl.SelfKind getSelfKind() { return selfKind; }
    public void setSelfKind(MethodDecl.SelfKind selfKind) { this.selfKind = selfKind; }

    @Override
    public String toString() {
        return kind + " " + name + (type != null ? ": " + type.toDisplayString() : "");
    }
}
