package com.asthralang.compiler.ast.pattern;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 枚举模式：Option.Some(x)、Color.Red
 */
public class EnumPattern extends Pattern {
    private final String enumName;
    private final String variantName;
    private final List<Pattern> payload;

    public EnumPattern(SourceLocation location, String enumName, String variantName, List<Pattern> payload) {
        super(location);
        this.enumName = enumName;
        this.variantName = variantName;
        this.payload = payload != null ? payload : Collections.<Pattern>emptyList();
    }

    public String getEnumName() {
        return enumName;
    }

    public String getVariantName() {
        return variantName;
    }

    public List<Pattern> getPayload() {
        return payload;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEnumPattern(this, context);
    }
}
