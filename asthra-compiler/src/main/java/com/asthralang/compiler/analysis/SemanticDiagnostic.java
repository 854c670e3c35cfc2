package com.asthralang.compiler.analysis;

import com.asthralang.compiler.ast.SourceLocation;

/**
 * 语义诊断条目
 */
public final class SemanticDiagnostic {

    public enum Severity {
        ERROR, WARNING
    }

    private final Severity severity;
    private final ErrorKind kind;
    private final String message;
    private final SourceLocation location;
    private final String suggestion;

    public SemanticDiagnostic(Severity severity, ErrorKind kind, String message,
                              SourceLocation location, String suggestion) {
        this.severity = severity;
        this.kind = kind;
        this.message = message;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.suggestion = suggestion;
    }

    public Severity getSeverity() { return severity; }
    public ErrorKind getKind() { return kind; }
    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }
    public String getSuggestion() { return suggestion; }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(location).append(": ")
                .append(severity == Severity.ERROR ? "error" : "warning")
                .append('[').append(kind.getCode()).append("]: ")
                .append(message);
        if (suggestion != null) {
            sb.append(" (").append(suggestion).append(')');
        }
        return sb.toString();
    }
}
