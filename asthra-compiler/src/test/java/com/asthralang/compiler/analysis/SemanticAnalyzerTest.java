package com.asthralang.compiler.analysis;

import com.asthralang.compiler.analysis.SemanticAnalyzer.ContextGuard;
import com.asthralang.compiler.analysis.types.StructType;
import com.asthralang.compiler.analysis.types.TypeDescriptor;
import com.asthralang.compiler.analysis.types.TypeDescriptors;
import com.asthralang.compiler.ast.Visibility;
import com.asthralang.compiler.ast.decl.MethodDecl.SelfKind;
import com.asthralang.compiler.ast.decl.Program;
import com.asthralang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.asthralang.compiler.ast.expr.Expression;
import com.asthralang.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.asthralang.compiler.ast.stmt.ForStmt;
import com.asthralang.compiler.ast.stmt.MatchStmt;
import com.asthralang.compiler.ast.stmt.SpawnStmt;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.asthralang.compiler.analysis.AstFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 分析器整体行为：端到端分析、生命周期、上下文守卫与统计
 */
class SemanticAnalyzerTest {

    /** 覆盖枚举、结构体、impl、match、for 与 spawn 的完整程序 */
    private static Program drawingProgram() {
        MatchStmt describeMatch = new MatchStmt(loc(), ident("s"), Arrays.asList(
                arm(enumPattern("Shape", "Circle", bindPattern("r")),
                        block(ret(binary(ident("r"), BinaryOp.MUL, ident("r"))))),
                arm(enumPattern("Shape", "Square", bindPattern("side")), block(ret(ident("side")))),
                arm(wildcard(), block(ret(floatLit(0.0))))));

        return program(
                enumDecl("Shape", variant("Circle", type("f64")), variant("Square", type("f64")), variant("Empty")),
                struct("Canvas", field("width", type("i32")), field("height", type("i32"))),
                impl("Canvas",
                        method("new", SelfKind.NONE,
                                Arrays.asList(param("w", type("i32")), param("h", type("i32"))), type("Self"),
                                ret(structLit("Canvas", init("width", ident("w")), init("height", ident("h"))))),
                        method("area", SelfKind.REFERENCE, Collections.emptyList(), type("i32"),
                                ret(binary(fieldAccess(ident("self"), "width"), BinaryOp.MUL,
                                        fieldAccess(ident("self"), "height"))))),
                fn("describe", Arrays.asList(param("s", type("Shape"))), type("f64"), describeMatch),
                fn("worker", null),
                mainFn(
                        let("c", null, memberCall(ident("Canvas"), "new", intLit(3), intLit(4))),
                        let("a", type("i32"), memberCall(ident("c"), "area")),
                        letMut("total", type("i64"), intLit(0)),
                        new ForStmt(loc(), "i", call("range", ident("a")), block(
                                exprStmt(assign(ident("total"), binary(ident("total"), BinaryOp.ADD, intLit(1)))))),
                        new SpawnStmt(loc(), call("worker")),
                        let("d", null, call("describe", memberCall(ident("Shape"), "Circle", floatLit(2.0))))));
    }

    /** 每个函数各含一个独立错误 */
    private static Program programWithErrors(int count) {
        List<com.asthralang.compiler.ast.decl.Declaration> decls =
                new ArrayList<com.asthralang.compiler.ast.decl.Declaration>();
        for (int i = 0; i < count; i++) {
            decls.add(fn("bad" + i, type("i32"), ret(boolLit(true))));
        }
        return program(decls.toArray(new com.asthralang.compiler.ast.decl.Declaration[0]));
    }

    private static List<String> summarize(AnalysisResult result) {
        List<String> lines = new ArrayList<String>();
        for (SemanticDiagnostic d : result.getDiagnostics()) {
            lines.add(d.getSeverity() + " " + d.getKind() + " " + d.getMessage());
        }
        return lines;
    }

    @Test
    @DisplayName("完整程序分析通过且没有警告")
    void endToEnd() {
        try (SemanticAnalyzer analyzer = new SemanticAnalyzer(AnalyzerConfig.forTesting())) {
            AnalysisResult result = analyzer.analyze(drawingProgram());

            assertThat(result.getDiagnostics()).isEmpty();
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getGlobalScope().lookup("main").getKind()).isEqualTo(SymbolKind.FUNCTION);
            assertThat(result.getGlobalScope().lookup("Shape").getType().toDisplayString()).isEqualTo("Shape");
            assertThat(result.getStatistics().getNodesAnalyzed()).isPositive();
            assertThat(result.getStatistics().getMaxScopeDepth()).isGreaterThanOrEqualTo(3);
            assertThat(result.getStatistics().getSymbolsResolved()).isPositive();
            assertThat(result.getStatistics().getCurrentScopeDepth()).isZero();
        }
    }

    @Test
    @DisplayName("同一输入的诊断结果确定")
    void deterministicDiagnostics() {
        List<String> first;
        List<String> second;
        try (SemanticAnalyzer analyzer = new SemanticAnalyzer(AnalyzerConfig.forTesting())) {
            first = summarize(analyzer.analyze(programWithErrors(4)));
        }
        try (SemanticAnalyzer analyzer = new SemanticAnalyzer(AnalyzerConfig.forTesting())) {
            second = summarize(analyzer.analyze(programWithErrors(4)));
        }
        assertThat(first).hasSize(4).containsExactlyElementsOf(second);
    }

    @Test
    @DisplayName("一个声明出错不影响后续声明")
    void errorsAreIsolatedPerDeclaration() {
        try (SemanticAnalyzer analyzer = new SemanticAnalyzer(AnalyzerConfig.forTesting())) {
            AnalysisResult result = analyzer.analyze(programWithErrors(3));
            assertThat(result.getErrorCount()).isEqualTo(3);
            assertThat(result.getErrors()).extracting(SemanticDiagnostic::getKind)
                    .containsOnly(ErrorKind.TYPE_MISMATCH);
            assertThat(result.getGlobalScope().lookup("bad2")).isNotNull();
        }
    }

    @Test
    @DisplayName("错误上限只约束记录数")
    void maxErrorsCapsRecording() {
        AnalyzerConfig config = AnalyzerConfig.forTesting();
        config.setMaxErrors(3);
        try (SemanticAnalyzer analyzer = new SemanticAnalyzer(config)) {
            AnalysisResult result = analyzer.analyze(programWithErrors(5));
            assertThat(result.getErrorCount()).isEqualTo(5);
            assertThat(result.getErrors()).hasSize(3);
            assertThat(result.isSuccess()).isFalse();
            assertThat(analyzer.getDiagnostics().isCapReached()).isTrue();
        }
    }

    @Test
    void resetClearsState() {
        try (SemanticAnalyzer analyzer = new SemanticAnalyzer(AnalyzerConfig.forTesting())) {
            analyzer.analyze(programWithErrors(2));
            assertThat(analyzer.getErrorCount()).isEqualTo(2);

            analyzer.reset();
            assertThat(analyzer.getErrorCount()).isZero();
            assertThat(analyzer.getDiagnostics().getDiagnostics()).isEmpty();
            assertThat(analyzer.getGlobalScope().lookup("bad0")).isNull();
            assertThat(analyzer.getStatistics().getNodesAnalyzed()).isZero();
            assertThat(analyzer.getCurrentScope()).isSameAs(analyzer.getGlobalScope());

            assertThat(analyzer.analyze(drawingProgram()).isSuccess()).isTrue();
        }
    }

    @Test
    @DisplayName("关闭后归还全部类型引用")
    void closeReleasesTypes() {
        SemanticAnalyzer analyzer = new SemanticAnalyzer(AnalyzerConfig.forTesting());
        Expression addressOf = unary(UnaryOp.ADDRESS_OF, ident("p"));
        Expression numbers = call("range", intLit(3));
        AnalysisResult result = analyzer.analyze(program(
                struct("Point", field("x", type("i32")), field("y", type("i32"))),
                mainFn(
                        let("p", type("Point"), structLit("Point", init("x", intLit(1)), init("y", intLit(2)))),
                        let("q", null, addressOf),
                        let("xs", null, numbers))));
        assertThat(result.isSuccess()).isTrue();

        StructType point = (StructType) result.getGlobalScope().lookup("Point").getType();
        TypeDescriptor pointer = result.getExpressionType(addressOf);
        TypeDescriptor slice = result.getExpressionType(numbers);
        assertThat(point.getRefCount()).isPositive();
        assertThat(pointer.toDisplayString()).isEqualTo("*const Point");

        analyzer.close();

        assertThat(point.isReleased()).isTrue();
        assertThat(point.getRefCount()).isZero();
        assertThat(pointer.isReleased()).isTrue();
        assertThat(slice.isReleased()).isTrue();
        assertThat(TypeDescriptors.I32.isReleased()).isFalse();
    }

    @Test
    void useAfterClose() {
        SemanticAnalyzer analyzer = new SemanticAnalyzer(AnalyzerConfig.forTesting());
        analyzer.close();
        analyzer.close();
        assertThatThrownBy(() -> analyzer.analyze(programWithErrors(1)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(analyzer::reset).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("作用域与 unsafe 守卫离开时恢复")
    void contextGuards() {
        try (SemanticAnalyzer analyzer = new SemanticAnalyzer(AnalyzerConfig.forTesting())) {
            SymbolTable global = analyzer.getCurrentScope();
            try (ContextGuard scope = analyzer.enterScope()) {
                assertThat(analyzer.getCurrentScope()).isNotSameAs(global);
                assertThat(analyzer.getCurrentScope().getParent()).isSameAs(global);
                try (ContextGuard unsafe = analyzer.enterUnsafe()) {
                    assertThat(analyzer.isInUnsafeContext()).isTrue();
                }
                assertThat(analyzer.isInUnsafeContext()).isFalse();
            }
            assertThat(analyzer.getCurrentScope()).isSameAs(global);
            assertThat(analyzer.getStatistics().getCurrentScopeDepth()).isZero();
        }
    }

    @Test
    @DisplayName("遮蔽检查默认不警告")
    void shadowing() {
        try (SemanticAnalyzer analyzer = new SemanticAnalyzer(AnalyzerConfig.forTesting())) {
            Symbol outer = new Symbol("limit", SymbolKind.VARIABLE, TypeDescriptors.I32, null, Visibility.PRIVATE);
            analyzer.getGlobalScope().insert("limit", outer);

            assertThat(analyzer.checkSymbolShadowing("limit")).isNull();
            try (ContextGuard scope = analyzer.enterScope()) {
                assertThat(analyzer.checkSymbolShadowing("limit", loc(), false)).isSameAs(outer);
                assertThat(analyzer.getDiagnostics().getWarningCount()).isZero();

                assertThat(analyzer.checkSymbolShadowing("limit", loc(), true)).isSameAs(outer);
                assertThat(analyzer.getDiagnostics().getWarnings())
                        .singleElement()
                        .extracting(SemanticDiagnostic::getKind)
                        .isEqualTo(ErrorKind.REDECLARATION);
                assertThat(analyzer.checkSymbolShadowing("other")).isNull();
            }
        }
    }

    @Test
    void lookupHelpers() {
        try (SemanticAnalyzer analyzer = new SemanticAnalyzer(AnalyzerConfig.forTesting())) {
            analyzer.analyze(program(constDecl("MAX", type("u8"), intLit(255))));
            assertThat(analyzer.resolve("MAX").getConstValue()).isEqualTo(ConstValue.ofInteger(255));
            assertThat(analyzer.resolve("missing")).isNull();
            assertThat(analyzer.getBuiltinType("f32")).isSameAs(TypeDescriptors.F32);
            assertThat(analyzer.getBuiltinType("Never")).isSameAs(TypeDescriptors.NEVER);
            assertThat(analyzer.getPackageName()).isEqualTo("main");
        }
    }
}
