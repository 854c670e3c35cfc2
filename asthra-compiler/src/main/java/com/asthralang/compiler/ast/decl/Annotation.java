package com.asthralang.compiler.ast.decl;

import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.AstVisitor;
import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * 注解，如 {@code #[non_deterministic]}、{@code #[ownership(gc)]}
 */
public class Annotation extends AstNode {
    private final String name;
    private final List<AnnotationArg> args;

    public Annotation(SourceLocation location, String name, List<AnnotationArg> args) {
        super(location);
        this.name = name;
        this.args = args != null ? args : Collections.<AnnotationArg>emptyList();
    }

    public Annotation(SourceLocation location, String name) {
        this(location, name, null);
    }

    public String getName() {
        return name;
    }

    public List<AnnotationArg> getArgs() {
        return args;
    }

    public boolean hasArgs() {
        return !args.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        // 注解由 AnnotationAnalyzer 在宿主节点分析前统一处理
        return null;
    }

    /**
     * 注解参数
     */
    public static final class AnnotationArg extends AstNode {
        private final String name;  // 可选
        private final Expression value;

        public AnnotationArg(SourceLocation location, String name, Expression value) {
            super(location);
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public Expression getValue() {
            return value;
        }

        @Override
        public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
            return null;
        }
    }
}
