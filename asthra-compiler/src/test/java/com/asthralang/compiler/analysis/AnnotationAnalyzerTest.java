package com.asthralang.compiler.analysis;

import com.asthralang.compiler.ast.Visibility;
import com.asthralang.compiler.ast.decl.Annotation;
import com.asthralang.compiler.ast.decl.StructDecl;
import com.asthralang.compiler.ast.expr.Expression;
import com.asthralang.compiler.ast.stmt.Block;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.asthralang.compiler.analysis.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 注解名称、位置、参数与互斥检查
 */
class AnnotationAnalyzerTest {

    private SemanticAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new SemanticAnalyzer(AnalyzerConfig.forTesting());
    }

    @AfterEach
    void tearDown() {
        analyzer.close();
    }

    private AnalysisResult analyzeFn(Annotation... annotations) {
        return analyzer.analyze(program(annotatedFn(Arrays.asList(annotations), "f", null)));
    }

    private static StructDecl annotatedStruct(Annotation... annotations) {
        return new StructDecl(loc(), Arrays.asList(annotations), Visibility.PUBLIC, "Buffer", null,
                Collections.singletonList(field("len", type("usize"))), false);
    }

    private static SemanticDiagnostic singleError(AnalysisResult result) {
        List<SemanticDiagnostic> errors = result.getErrors();
        assertEquals(1, errors.size(), errors::toString);
        assertEquals(ErrorKind.INVALID_ANNOTATION, errors.get(0).getKind());
        return errors.get(0);
    }

    @Test
    void knownFunctionAnnotations() {
        assertTrue(analyzeFn(annotation("inline")).isSuccess());
        analyzer.reset();
        assertTrue(analyzeFn(annotation("constant_time"), annotation("deprecated")).isSuccess());
    }

    @Test
    void unknownAnnotation() {
        SemanticDiagnostic d = singleError(analyzeFn(annotation("fast")));
        assertTrue(d.getMessage().contains("fast"));
    }

    @Test
    void duplicateAnnotation() {
        singleError(analyzeFn(annotation("inline"), annotation("inline")));
    }

    @Test
    void wrongContext() {
        singleError(analyzeFn(annotation("transfer_full")));
        analyzer.reset();
        singleError(analyzer.analyze(program(annotatedStruct(annotation("inline")))));
    }

    @Test
    void deprecatedArguments() {
        assertTrue(analyzeFn(annotation("deprecated", strLit("use g"))).isSuccess());
        analyzer.reset();
        singleError(analyzeFn(annotation("deprecated", intLit(3))));
    }

    @Test
    void argumentsOnNoArgAnnotation() {
        singleError(analyzeFn(annotation("inline", strLit("always"))));
    }

    @Test
    void ownershipModes() {
        assertTrue(analyzer.analyze(program(annotatedStruct(annotation("ownership", ident("gc"))))).isSuccess());
        analyzer.reset();
        assertTrue(analyzer.analyze(program(annotatedStruct(
                new Annotation(loc(), "ownership",
                        Collections.singletonList(new Annotation.AnnotationArg(loc(), "pinned", null)))))).isSuccess());
        analyzer.reset();
        singleError(analyzer.analyze(program(annotatedStruct(annotation("ownership", ident("arena"))))));
        analyzer.reset();
        singleError(analyzer.analyze(program(annotatedStruct(annotation("ownership")))));
    }

    @Test
    void transferAnnotationsAreExclusive() {
        AnalysisResult result = analyzer.analyze(program(extern("take",
                Arrays.asList(param("p", pointer(type("u8"), true),
                        annotation("transfer_full"), annotation("borrowed"))), null)));
        SemanticDiagnostic d = singleError(result);
        assertTrue(d.getMessage().contains("互斥"));
    }

    @Test
    void inlineWithNonDeterministicWarns() {
        AnalysisResult result = analyzeFn(annotation("inline"), annotation("non_deterministic"));
        assertTrue(result.isSuccess());
        assertEquals(1, result.getWarnings().size());
        assertEquals(ErrorKind.INVALID_ANNOTATION, result.getWarnings().get(0).getKind());
    }

    @Test
    void invalidAnnotationSkipsDeclaration() {
        analyzeFn(annotation("fast"));
        assertNull(analyzer.getGlobalScope().lookup("f"));
    }

    @Test
    void deprecatedCallWarns() {
        AnalysisResult result = analyzer.analyze(program(
                annotatedFn(Collections.singletonList(annotation("deprecated")), "old", null),
                mainFn(exprStmt(call("old")))));
        assertTrue(result.isSuccess());
        assertEquals(1, result.getWarnings().size());
        assertTrue(result.getWarnings().get(0).getMessage().contains("已弃用"));
    }

    @Test
    void statementAndExpressionAnnotations() {
        Block timed = block(let("x", null, intLit(1)));
        timed.setAnnotations(Collections.singletonList(annotation("constant_time")));
        assertTrue(analyzer.analyze(program(mainFn(timed))).isSuccess());

        analyzer.reset();
        Expression value = intLit(2);
        value.setAnnotations(Collections.singletonList(annotation("inline")));
        singleError(analyzer.analyze(program(mainFn(exprStmt(value)))));
    }
}
