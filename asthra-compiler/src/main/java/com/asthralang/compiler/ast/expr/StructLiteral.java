package com.asthralang.compiler.ast.expr;

import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 结构体字面量：Point { x: 1, y: 2 }
 */
public class StructLiteral extends Expression {
    private final String structName;
    private final List<TypeRef> typeArgs;
    private final List<FieldInit> fields;

    public StructLiteral(SourceLocation location, String structName, List<TypeRef> typeArgs,
                         List<FieldInit> fields) {
        super(location);
        this.structName = structName;
        this.typeArgs = typeArgs != null ? typeArgs : Collections.<TypeRef>emptyList();
        this.fields = fields != null ? fields : Collections.<FieldInit>emptyList();
    }

    public String getStructName() {
        return structName;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    public List<FieldInit> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructLiteral(this, context);
    }

    /**
     * 字段初始化项
     */
    public static final class FieldInit extends AstNode {
        private final String name;
        private final Expression value;

        public FieldInit(SourceLocation location, String name, Expression value) {
            super(location);
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public Expression getValue() {
            return value;
        }

        @Override
        public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
            return null;
        }
    }
}
