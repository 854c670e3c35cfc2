package com.asthralang.compiler.ast.expr;

import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;

/**
 * 字面量表达式
 *
 * <p>值的 Java 类型：INT 为 Long，FLOAT 为 Double，STRING 为 String，
 * BOOL 为 Boolean，CHAR 为 Integer（码点），UNIT 为 null。</p>
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(SourceLocation location, Object value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        INT,
        FLOAT,
        STRING,
        BOOL,
        CHAR,
        UNIT;

        public boolean isNumeric() {
            return this == INT || this == FLOAT;
        }
    }
}
