package com.asthralang.compiler.ast.pattern;

import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 结构体模式：Point { x, y: 0, .. }
 */
public class StructPattern extends Pattern {
    private final String structName;
    private final List<FieldPattern> fields;
    private final boolean hasRest;

    public StructPattern(SourceLocation location, String structName, List<FieldPattern> fields, boolean hasRest) {
        super(location);
        this.structName = structName;
        this.fields = fields != null ? fields : Collections.<FieldPattern>emptyList();
        this.hasRest = hasRest;
    }

    public String getStructName() {
        return structName;
    }

    public List<FieldPattern> getFields() {
        return fields;
    }

    public boolean hasRest() {
        return hasRest;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitStructPattern(this, context);
    }

    /**
     * 字段子模式，pattern 为 null 时等价于同名绑定
     */
    public static final class FieldPattern extends AstNode {
        private final String fieldName;
        private final Pattern pattern;

        public FieldPattern(SourceLocation location, String fieldName, Pattern pattern) {
            super(location);
            this.fieldName = fieldName;
            this.pattern = pattern;
        }

        public String getFieldName() {
            return fieldName;
        }

        public Pattern getPattern() {
            return pattern;
        }

        @Override
        public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
            return null;
        }
    }
}
