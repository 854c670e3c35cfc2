package com.asthralang.compiler.ast.decl;

import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 编译单元根节点
 */
public class Program extends AstNode {
    private final PackageDecl packageDecl;
    private final List<ImportDecl> imports;
    private final List<Declaration> declarations;

    public Program(SourceLocation location, PackageDecl packageDecl,
                   List<ImportDecl> imports, List<Declaration> declarations) {
        super(location);
        this.packageDecl = packageDecl;
        this.imports = imports != null ? imports : Collections.<ImportDecl>emptyList();
        this.declarations = declarations != null ? declarations : Collections.<Declaration>emptyList();
    }

    public PackageDecl getPackageDecl() {
        return packageDecl;
    }

    public List<ImportDecl> getImports() {
        return imports;
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
