package com.asthralang.compiler.ast.decl;

import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;

/**
 * 导入声明：{@code import "stdlib/concurrent/channels" as chan;}
 */
public class ImportDecl extends AstNode {
    private final String path;
    private final String alias;  // 可选

    public ImportDecl(SourceLocation location, String path, String alias) {
        super(location);
        this.path = path;
        this.alias = alias;
    }

    public String getPath() {
        return path;
    }

    public String getAlias() {
        return alias;
    }

    public boolean hasAlias() {
        return alias != null;
    }

    /** 未指定别名时取路径最后一段 */
    public String getEffectiveName() {
        if (alias != null) return alias;
        if (path == null) return null;
        int idx = path.lastIndexOf('/');
        return idx >= 0 ? path.substring(idx + 1) : path;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportDecl(this, context);
    }
}
