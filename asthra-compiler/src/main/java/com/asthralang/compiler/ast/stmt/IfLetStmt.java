package com.asthralang.compiler.ast.stmt;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.expr.Expression;
import com.asthralang.compiler.ast.pattern.Pattern;

/**
 * if let Pattern = expr { ... } else { ... }
 */
public class IfLetStmt extends Statement {
    private final Pattern pattern;
    private final Expression value;
    private final Block thenBlock;
    private final Block elseBlock;

    public IfLetStmt(SourceLocation location, Pattern pattern, Expression value,
                     Block thenBlock, Block elseBlock) {
        super(location);
        this.pattern = pattern;
        this.value = value;
        this.thenBlock = thenBlock;
        this.elseBlock = elseBlock;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public Expression getValue() {
        return value;
    }

    public Block getThenBlock() {
        return thenBlock;
    }

    public Block getElseBlock() {
        return elseBlock;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfLetStmt(this, context);
    }
}
