package com.asthralang.compiler.ast.stmt;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.expr.Expression;

/**
 * 以表达式构成的语句，位置取自表达式本身。
 * 块中的值被丢弃；作为 match 分支体时，表达式的值即分支的值。
 */
public class ExpressionStmt extends Statement {
    private final Expression expression;

    public ExpressionStmt(Expression expression) {
        super(expression.getLocation());
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExpressionStmt(this, context);
    }
}
