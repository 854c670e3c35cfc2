package com.asthralang.compiler.analysis;

import com.asthralang.compiler.ast.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 诊断收集器
 *
 * <p>错误上限只约束记录：前 maxErrors 个错误按发出顺序保留，之后的错误只计数不记录，
 * 错误总数与分析结果始终准确。达到上限时写一条 WARN 日志。
 * 警告单独计数，且只占用警告自己的额度，不会挤掉错误。</p>
 */
public final class DiagnosticCollector {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticCollector.class);

    private final int maxErrors;
    private final boolean warningsEnabled;
    private final AnalysisStatistics statistics;

    private final List<SemanticDiagnostic> recorded = new ArrayList<>();
    private int recordedErrors;
    private int recordedWarnings;
    private int errorCount;
    private int warningCount;
    private boolean capReported;

    public DiagnosticCollector(int maxErrors, boolean warningsEnabled, AnalysisStatistics statistics) {
        this.maxErrors = maxErrors;
        this.warningsEnabled = warningsEnabled;
        this.statistics = statistics;
    }

    /**
     * 报告错误。args 为空时 message 原样使用。
     *
     * @return 记录下来的诊断，超出上限时返回 null
     */
    public SemanticDiagnostic reportError(ErrorKind kind, SourceLocation location, String message, Object... args) {
        return addError(kind, location, null, message, args);
    }

    public SemanticDiagnostic reportErrorWithSuggestion(ErrorKind kind, SourceLocation location, String suggestion,
                                                        String message, Object... args) {
        return addError(kind, location, suggestion, message, args);
    }

    private SemanticDiagnostic addError(ErrorKind kind, SourceLocation location, String suggestion,
                                        String message, Object[] args) {
        errorCount++;
        if (statistics != null) statistics.incrementErrorsFound();
        if (recordedErrors >= maxErrors) {
            if (!capReported) {
                capReported = true;
                log.warn("错误数达到上限 {}，后续错误仅计数不记录", maxErrors);
            }
            return null;
        }
        SemanticDiagnostic d = new SemanticDiagnostic(SemanticDiagnostic.Severity.ERROR, kind,
                format(message, args), location, suggestion);
        recorded.add(d);
        recordedErrors++;
        return d;
    }

    /** 报告警告；警告关闭时只计数 */
    public SemanticDiagnostic reportWarning(ErrorKind kind, SourceLocation location, String message, Object... args) {
        warningCount++;
        if (statistics != null) statistics.incrementWarningsIssued();
        if (!warningsEnabled || recordedWarnings >= maxErrors) return null;
        SemanticDiagnostic d = new SemanticDiagnostic(SemanticDiagnostic.Severity.WARNING, kind,
                format(message, args), location, null);
        recorded.add(d);
        recordedWarnings++;
        return d;
    }

    private static String format(String message, Object[] args) {
        if (args == null || args.length == 0) return message;
        return String.format(message, args);
    }

    /** 所有记录的诊断，按发出顺序 */
    public List<SemanticDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(recorded);
    }

    public List<SemanticDiagnostic> getErrors() {
        List<SemanticDiagnostic> result = new ArrayList<>(recordedErrors);
        for (SemanticDiagnostic d : recorded) {
            if (d.isError()) result.add(d);
        }
        return result;
    }

    public List<SemanticDiagnostic> getWarnings() {
        List<SemanticDiagnostic> result = new ArrayList<>(recordedWarnings);
        for (SemanticDiagnostic d : recorded) {
            if (!d.isError()) result.add(d);
        }
        return result;
    }

    /** 准确的错误总数，含未记录的 */
    public int getErrorCount() {
        return errorCount;
    }

    public int getWarningCount() {
        return warningCount;
    }

    public boolean hasErrors() {
        return errorCount > 0;
    }

    public boolean isCapReached() {
        return recordedErrors >= maxErrors;
    }

    public int getMaxErrors() {
        return maxErrors;
    }
}
