package com.asthralang.compiler.ast.stmt;

import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.expr.Expression;
import com.asthralang.compiler.ast.pattern.Pattern;

/**
 * match 分支：Pattern [if guard] => body
 *
 * <p>body 为 Block 或 ExpressionStmt；用作表达式时取其结果表达式的类型。</p>
 */
public class MatchArm extends AstNode {
    private final Pattern pattern;
    private final Expression guard;  // 可选
    private final Statement body;

    public MatchArm(SourceLocation location, Pattern pattern, Expression guard, Statement body) {
        super(location);
        this.pattern = pattern;
        this.guard = guard;
        this.body = body;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public Expression getGuard() {
        return guard;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return null;
    }
}
