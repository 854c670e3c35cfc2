package com.asthralang.compiler.analysis;

import com.asthralang.compiler.ast.AstNode;
import com.asthralang.compiler.ast.SourceLocation;

/**
 * 常量求值失败，由调用方决定是否报告
 */
public class ConstEvaluationException extends RuntimeException {

    private final ErrorKind kind;
    private final transient AstNode node;

    public ConstEvaluationException(ErrorKind kind, AstNode node, String message) {
        super(message);
        this.kind = kind;
        this.node = node;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public AstNode getNode() {
        return node;
    }

    public SourceLocation getLocation() {
        return node != null ? node.getLocation() : SourceLocation.UNKNOWN;
    }
}
