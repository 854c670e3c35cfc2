package com.asthralang.compiler.ast.stmt;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * match 语句
 */
public class MatchStmt extends Statement {
    private final Expression scrutinee;
    private final List<MatchArm> arms;

    public MatchStmt(SourceLocation location, Expression scrutinee, List<MatchArm> arms) {
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
        return visitor.visitMatchStmt(this, context);
    }
}
