package com.asthralang.compiler.analysis;

import com.asthralang.compiler.ast.decl.ImportDecl;
import com.asthralang.compiler.ast.stmt.SpawnStmt;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static com.asthralang.compiler.analysis.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 并发特性分级：第一级始终允许，第二级需要 #[non_deterministic]
 */
class ConcurrencyTierCheckerTest {

    private SemanticAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new SemanticAnalyzer(AnalyzerConfig.forTesting());
    }

    @AfterEach
    void tearDown() {
        analyzer.close();
    }

    private static List<ImportDecl> channels() {
        return Collections.singletonList(importDecl("stdlib/concurrent/channels", "ch"));
    }

    @Test
    @DisplayName("第二级模块要求外层函数声明 #[non_deterministic]")
    void tier2RequiresAnnotation() {
        AnalysisResult result = analyzer.analyze(program(channels(),
                fn("producer", null, exprStmt(memberCall(ident("ch"), "send", intLit(1))))));
        assertEquals(1, result.getErrorCount());
        SemanticDiagnostic d = result.getErrors().get(0);
        assertEquals(ErrorKind.MISSING_ANNOTATION, d.getKind());
        assertEquals("在函数 'producer' 上添加 #[non_deterministic]", d.getSuggestion());
    }

    @Test
    void tier2WithAnnotation() {
        AnalysisResult result = analyzer.analyze(program(channels(),
                annotatedFn(Collections.singletonList(annotation("non_deterministic")), "producer", null,
                        exprStmt(memberCall(ident("ch"), "send", intLit(1))),
                        let("n", type("i32"), fieldAccess(ident("ch"), "capacity")))));
        assertTrue(result.isSuccess(), () -> result.getDiagnostics().toString());
    }

    @Test
    @DisplayName("顶层访问第二级模块")
    void tier2AtTopLevel() {
        analyzer.getAliasTable().registerAlias("ch", "stdlib/concurrent/channels");
        assertFalse(analyzer.analyzeExpression(memberCall(ident("ch"), "send")));
        SemanticDiagnostic d = analyzer.getDiagnostics().getErrors().get(0);
        assertEquals(ErrorKind.MISSING_ANNOTATION, d.getKind());
        assertEquals("在函数 '<顶层>' 上添加 #[non_deterministic]", d.getSuggestion());
    }

    @Test
    @DisplayName("其他模块不受限制")
    void otherModulesUnrestricted() {
        AnalysisResult result = analyzer.analyze(program(
                Collections.singletonList(importDecl("stdlib/concurrency_utils", "cu")),
                fn("worker", null, exprStmt(memberCall(ident("cu"), "sleep", intLit(10))))));
        assertTrue(result.isSuccess(), () -> result.getDiagnostics().toString());
    }

    @Test
    @DisplayName("spawn 属于第一级，无需注解")
    void tier1AlwaysAllowed() {
        AnalysisResult result = analyzer.analyze(program(
                fn("job", null),
                mainFn(new SpawnStmt(loc(), call("job")))));
        assertTrue(result.isSuccess(), () -> result.getDiagnostics().toString());
    }
}
