package com.asthralang.compiler.ast.expr;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;

/**
 * 重复数组字面量：[value; count]，count 必须是编译期正整数常量
 */
public class RepeatedArrayLiteral extends Expression {
    private final Expression value;
    private final Expression count;

    public RepeatedArrayLiteral(SourceLocation location, Expression value, Expression count) {
        super(location);
        this.value = value;
        this.count = count;
    }

    public Expression getValue() {
        return value;
    }

    public Expression getCount() {
        return count;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitRepeatedArrayLiteral(this, context);
    }
}
