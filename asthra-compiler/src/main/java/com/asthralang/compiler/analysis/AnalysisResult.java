package com.asthralang.compiler.analysis;

import com.asthralang.compiler.analysis.types.TypeDescriptor;
import com.asthralang.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 语义分析结果
 *
 * <p>全局作用域与表达式类型视图在分析器 close/reset 之前有效。</p>
 */
public final class AnalysisResult {
    private final boolean success;
    private final SymbolTable globalScope;
    private final List<SemanticDiagnostic> diagnostics;
    private final int errorCount;
    private final AnalysisStatistics statistics;
    private final Map<Expression, TypeDescriptor> expressionTypes;

    public AnalysisResult(boolean success, SymbolTable globalScope, List<SemanticDiagnostic> diagnostics,
                          int errorCount, AnalysisStatistics statistics,
                          Map<Expression, TypeDescriptor> expressionTypes) {
        this.success = success;
        this.globalScope = globalScope;
        this.diagnostics = diagnostics;
        this.errorCount = errorCount;
        this.statistics = statistics;
        this.expressionTypes = Collections.unmodifiableMap(expressionTypes);
    }

    public boolean isSuccess() { return success; }
    public SymbolTable getGlobalScope() { return globalScope; }
    public List<SemanticDiagnostic> getDiagnostics() { return diagnostics; }
    public int getErrorCount() { return errorCount; }
    public AnalysisStatistics getStatistics() { return statistics; }
    public Map<Expression, TypeDescriptor> getExpressionTypes() { return expressionTypes; }

    public TypeDescriptor getExpressionType(Expression expr) {
        return expressionTypes.get(expr);
    }

    /** 获取单个表达式的类型字符串 */
    public String getExprTypeName(Expression expr) {
        TypeDescriptor type = expressionTypes.get(expr);
        return type != null ? type.toDisplayString() : null;
    }

    public List<SemanticDiagnostic> getErrors() {
        return filter(SemanticDiagnostic.Severity.ERROR);
    }

    public List<SemanticDiagnostic> getWarnings() {
        return filter(SemanticDiagnostic.Severity.WARNING);
    }

    private List<SemanticDiagnostic> filter(SemanticDiagnostic.Severity severity) {
        List<SemanticDiagnostic> result = new ArrayList<>();
        for (SemanticDiagnostic d : diagnostics) {
            if (d.getSeverity() == severity) result.add(d);
        }
        return result;
    }
}
