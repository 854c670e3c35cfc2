package com.asthralang.compiler.ast.expr;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.stmt.MatchArm;

import java.util.Collections;
import java.util.List;

/**
 * match 表达式，各分支结果类型需一致
 */
public class MatchExpr extends Expression {
    private final Expression scrutinee;
    private final List<MatchArm> arms;

    public MatchExpr(SourceLocation location, Expression scrutinee, List<MatchArm> arms) {
        super(location);
        this.scrutinee = scrutinee;
        this.arms = arms != null ? arms : Collections.<MatchArm>emptyList();
    }

    public Expression getScrutinee() {
        return scrutinee;
    }

    public List<MatchArm> getArms() {
        return arms;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMatchExpr(this, context);
    }
}
