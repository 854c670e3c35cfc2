package com.asthralang.compiler.ast.stmt;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;

/**
 * unsafe { ... }
 */
public class UnsafeBlock extends Statement {
    private final Block block;

    public UnsafeBlock(SourceLocation location, Block block) {
        super(location);
        this.block = block;
    }

    public Block getBlock() {
        return block;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitUnsafeBlock(this, context);
    }
}
