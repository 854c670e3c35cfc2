package com.asthralang.compiler.analysis;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.List;

/**
 * 诊断与统计的 JSON 输出，供驱动程序和编辑器集成使用
 */
public final class DiagnosticJsonWriter {

    private final Gson gson;

    public DiagnosticJsonWriter() {
        this(false);
    }

    public DiagnosticJsonWriter(boolean prettyPrint) {
        GsonBuilder builder = new GsonBuilder().disableHtmlEscaping();
        if (prettyPrint) builder.setPrettyPrinting();
        this.gson = builder.create();
    }

    public JsonObject toJson(SemanticDiagnostic d) {
        JsonObject obj = new JsonObject();
        obj.addProperty("severity", d.getSeverity() == SemanticDiagnostic.Severity.ERROR ? "error" : "warning");
        obj.addProperty("kind", d.getKind().name());
        obj.addProperty("code", d.getKind().getCode());
        obj.addProperty("message", d.getMessage());
        obj.addProperty("file", d.getLocation().getFile());
        obj.addProperty("line", d.getLocation().getLine());
        obj.addProperty("column", d.getLocation().getColumn());
        if (d.getSuggestion() != null) {
            obj.addProperty("suggestion", d.getSuggestion());
        }
        return obj;
    }

    public JsonArray toJson(List<SemanticDiagnostic> diagnostics) {
        JsonArray array = new JsonArray();
        for (SemanticDiagnostic d : diagnostics) {
            array.add(toJson(d));
        }
        return array;
    }

    public JsonObject toJson(AnalysisStatistics stats) {
        JsonObject obj = new JsonObject();
        obj.addProperty("nodesAnalyzed", stats.getNodesAnalyzed());
        obj.addProperty("typesChecked", stats.getTypesChecked());
        obj.addProperty("symbolsResolved", stats.getSymbolsResolved());
        obj.addProperty("errorsFound", stats.getErrorsFound());
        obj.addProperty("warningsIssued", stats.getWarningsIssued());
        obj.addProperty("maxScopeDepth", stats.getMaxScopeDepth());
        return obj;
    }

    public JsonObject toJson(AnalysisResult result) {
        JsonObject obj = new JsonObject();
        obj.addProperty("success", result.isSuccess());
        obj.addProperty("errorCount", result.getErrorCount());
        obj.add("diagnostics", toJson(result.getDiagnostics()));
        obj.add("statistics", toJson(result.getStatistics()));
        return obj;
    }

    public String write(AnalysisResult result) {
        return gson.toJson(toJson(result));
    }

    public String write(List<SemanticDiagnostic> diagnostics) {
        return gson.toJson(toJson(diagnostics));
    }
}
