package com.asthralang.compiler.ast.expr;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 枚举变体构造：Color.Red、Option.Some(x)、Result.Err(e)
 */
public class EnumVariantExpr extends Expression {
    private final String enumName;
    private final String variantName;
    private final List<Expression> payload;

    public EnumVariantExpr(SourceLocation location, String enumName, String variantName,
                           List<Expression> payload) {
        super(location);
        this.enumName = enumName;
        this.variantName = variantName;
        this.payload = payload != null ? payload : Collections.<Expression>emptyList();
    }

    public String getEnumName() {
        return enumName;
    }

    public String getVariantName() {
        return variantName;
    }

    public List<Expression> getPayload() {
        return payload;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEnumVariantExpr(this, context);
    }
}
