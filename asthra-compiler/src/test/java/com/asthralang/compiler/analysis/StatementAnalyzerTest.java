package com.asthralang.compiler.analysis;

import com.asthralang.compiler.ast.decl.Declaration;
import com.asthralang.compiler.ast.expr.AwaitExpr;
import com.asthralang.compiler.ast.expr.Expression;
import com.asthralang.compiler.ast.stmt.BreakStmt;
import com.asthralang.compiler.ast.stmt.ContinueStmt;
import com.asthralang.compiler.ast.stmt.ForStmt;
import com.asthralang.compiler.ast.stmt.IfStmt;
import com.asthralang.compiler.ast.stmt.MatchStmt;
import com.asthralang.compiler.ast.stmt.SpawnStmt;
import com.asthralang.compiler.ast.stmt.SpawnWithHandleStmt;
import com.asthralang.compiler.ast.stmt.UnsafeBlock;
import com.asthralang.compiler.ast.stmt.WhileStmt;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.asthralang.compiler.analysis.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 语句：let、return、控制流、match 与并发语句
 */
class StatementAnalyzerTest {

    private SemanticAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new SemanticAnalyzer(AnalyzerConfig.forTesting());
    }

    @AfterEach
    void tearDown() {
        analyzer.close();
    }

    private AnalysisResult analyze(Declaration... decls) {
        return analyzer.analyze(program(decls));
    }

    private static SemanticDiagnostic singleError(AnalysisResult result) {
        List<SemanticDiagnostic> errors = result.getErrors();
        assertEquals(1, errors.size(), errors::toString);
        return errors.get(0);
    }

    private static void assertClean(AnalysisResult result) {
        assertTrue(result.isSuccess(), () -> result.getDiagnostics().toString());
        assertEquals(0, result.getErrorCount());
    }

    @Nested
    @DisplayName("let")
    class Let {

        @Test
        @DisplayName("类型不匹配在初始化表达式处报告")
        void mismatchAtInitializer() {
            Expression x = ident("x");
            AnalysisResult result = analyze(mainFn(
                    let("x", type("i32"), intLit(5)),
                    let("y", type("bool"), x)));
            SemanticDiagnostic d = singleError(result);
            assertEquals(ErrorKind.TYPE_MISMATCH, d.getKind());
            assertEquals(x.getLocation(), d.getLocation());
        }

        @Test
        void inferredFromInitializer() {
            Expression use = ident("s");
            AnalysisResult result = analyze(mainFn(
                    let("s", null, strLit("hi")),
                    exprStmt(use)));
            assertClean(result);
            assertEquals("string", result.getExprTypeName(use));
        }

        @Test
        @DisplayName("严格模式下既无类型也无初始化")
        void untypedWithoutInitializerInStrictMode() {
            try (SemanticAnalyzer strict = new SemanticAnalyzer(new AnalyzerConfig())) {
                AnalysisResult result = strict.analyze(program(mainFn(let("x", null, null))));
                SemanticDiagnostic d = singleError(result);
                assertEquals(ErrorKind.TYPE_INFERENCE_FAILED, d.getKind());
                assertNotNull(d.getSuggestion());
            }
        }

        @Test
        void voidInitializer() {
            AnalysisResult result = analyze(mainFn(let("v", null, call("log", strLit("x")))));
            assertEquals(ErrorKind.TYPE_INFERENCE_FAILED, singleError(result).getKind());
        }

        @Test
        void redeclarationInSameScope() {
            AnalysisResult result = analyze(mainFn(
                    let("x", null, intLit(1)),
                    let("x", null, intLit(2))));
            assertEquals(ErrorKind.REDECLARATION, singleError(result).getKind());
        }

        @Test
        @DisplayName("内层块可以遮蔽外层变量")
        void shadowingInNestedBlock() {
            Expression inner = ident("x");
            Expression outer = ident("x");
            AnalysisResult result = analyze(mainFn(
                    let("x", null, intLit(1)),
                    block(let("x", null, boolLit(true)), exprStmt(inner)),
                    exprStmt(outer)));
            assertClean(result);
            assertEquals("bool", result.getExprTypeName(inner));
            assertEquals("i32", result.getExprTypeName(outer));
        }

        @Test
        @DisplayName("块内变量离开块后不可见")
        void blockScopeEnds() {
            AnalysisResult result = analyze(mainFn(
                    block(let("inner", null, intLit(1))),
                    exprStmt(ident("inner"))));
            assertEquals(ErrorKind.UNDECLARED_IDENTIFIER, singleError(result).getKind());
        }
    }

    @Nested
    @DisplayName("return")
    class Return {

        @Test
        void wrongType() {
            AnalysisResult result = analyze(fn("f", type("i32"), ret(strLit("s"))));
            assertEquals(ErrorKind.TYPE_MISMATCH, singleError(result).getKind());
        }

        @Test
        void missingValue() {
            AnalysisResult result = analyze(fn("f", type("i32"), ret(null)));
            assertEquals(ErrorKind.TYPE_MISMATCH, singleError(result).getKind());
        }

        @Test
        void valueFromVoidFunction() {
            AnalysisResult result = analyze(fn("f", null, ret(intLit(1))));
            assertEquals(ErrorKind.TYPE_MISMATCH, singleError(result).getKind());
        }

        @Test
        void outsideFunction() {
            assertFalse(analyzer.analyzeStatement(ret(null)));
            assertEquals(ErrorKind.INVALID_EXPRESSION, analyzer.getDiagnostics().getErrors().get(0).getKind());
        }

        @Test
        @DisplayName("if/else 两侧都返回时不缺少 return")
        void returnInBothBranches() {
            AnalysisResult result = analyze(fn("pick", Arrays.asList(param("flag", type("bool"))), type("i32"),
                    new IfStmt(loc(), ident("flag"), block(ret(intLit(1))), block(ret(intLit(2))))));
            assertClean(result);
        }

        @Test
        void missingReturn() {
            AnalysisResult result = analyze(fn("pick", Arrays.asList(param("flag", type("bool"))), type("i32"),
                    new IfStmt(loc(), ident("flag"), block(ret(intLit(1))), null)));
            assertEquals(ErrorKind.MISSING_RETURN, singleError(result).getKind());
        }

        @Test
        @DisplayName("返回 Never 的函数")
        void neverFunctions() {
            assertClean(analyze(fn("fail", type("Never"), exprStmt(call("panic", strLit("x"))))));
            analyzer.reset();
            assertEquals(ErrorKind.MISSING_RETURN, singleError(analyze(fn("fail", type("Never")))).getKind());
            analyzer.reset();
            assertEquals(ErrorKind.INVALID_CONTROL_FLOW,
                    singleError(analyze(fn("fail", type("Never"), ret(null)))).getKind());
        }

        @Test
        @DisplayName("return 之后的语句给出不可达警告")
        void unreachableCodeWarning() {
            AnalysisResult result = analyze(fn("f", type("i32"),
                    ret(intLit(1)),
                    let("a", null, intLit(2)),
                    let("b", null, intLit(3))));
            assertClean(result);
            List<SemanticDiagnostic> warnings = result.getWarnings();
            assertEquals(1, warnings.size());
            assertEquals(ErrorKind.INVALID_CONTROL_FLOW, warnings.get(0).getKind());
        }
    }

    @Nested
    @DisplayName("控制流")
    class ControlFlow {

        @Test
        void conditionMustBeBool() {
            AnalysisResult result = analyze(mainFn(new IfStmt(loc(), intLit(1), block(), null)));
            assertEquals(ErrorKind.TYPE_MISMATCH, singleError(result).getKind());
        }

        @Test
        void whileWithBreak() {
            assertClean(analyze(mainFn(new WhileStmt(loc(), boolLit(true), block(new BreakStmt(loc()))))));
        }

        @Test
        @DisplayName("循环之外的 break 与 continue")
        void breakOutsideLoop() {
            AnalysisResult result = analyze(mainFn(new BreakStmt(loc())));
            assertEquals(ErrorKind.INVALID_CONTROL_FLOW, singleError(result).getKind());
            analyzer.reset();
            result = analyze(mainFn(new ContinueStmt(loc())));
            assertEquals(ErrorKind.INVALID_CONTROL_FLOW, singleError(result).getKind());
        }

        @Test
        @DisplayName("循环深度不跨越函数边界")
        void loopDepthResetInFunction() {
            assertEquals(0, analyzer.getLoopDepth());
            AnalysisResult result = analyze(
                    mainFn(new WhileStmt(loc(), boolLit(true), block())),
                    fn("g", null, new BreakStmt(loc())));
            assertEquals(ErrorKind.INVALID_CONTROL_FLOW, singleError(result).getKind());
            assertEquals(0, analyzer.getLoopDepth());
        }

        @Test
        void forOverRange() {
            Expression i = ident("i");
            AnalysisResult result = analyze(mainFn(new ForStmt(loc(), "i", call("range", intLit(10)),
                    block(exprStmt(i)))));
            assertClean(result);
            assertEquals("i32", result.getExprTypeName(i));
        }

        @Test
        @DisplayName("range 的边界不会被隐式截断为 i32")
        void forOverRangeWithWideBound() {
            Expression bound = ident("n");
            AnalysisResult result = analyze(mainFn(
                    let("n", type("u64"), intLit(10_000_000_000L)),
                    new ForStmt(loc(), "i", call("range", bound), block(let("k", null, ident("i"))))));
            SemanticDiagnostic d = singleError(result);
            assertEquals(ErrorKind.TYPE_MISMATCH, d.getKind());
            assertEquals(bound.getLocation(), d.getLocation());
            assertTrue(d.getMessage().contains("u64"), d.getMessage());

            analyzer.reset();
            AnalysisResult widened = analyze(mainFn(
                    let("small", type("i16"), intLit(7)),
                    new ForStmt(loc(), "i", call("range", intLit(0), ident("small")), block())));
            assertClean(widened);
        }

        @Test
        void forOverNonIterable() {
            AnalysisResult result = analyze(mainFn(new ForStmt(loc(), "i", intLit(3), block())));
            assertEquals(ErrorKind.TYPE_MISMATCH, singleError(result).getKind());
        }

        @Test
        @DisplayName("配置禁止 unsafe 时报告 UNSAFE_REQUIRED")
        void unsafeDisallowed() {
            AnalyzerConfig config = AnalyzerConfig.forTesting();
            config.setAllowUnsafe(false);
            try (SemanticAnalyzer noUnsafe = new SemanticAnalyzer(config)) {
                AnalysisResult result = noUnsafe.analyze(program(mainFn(new UnsafeBlock(loc(), block()))));
                assertEquals(ErrorKind.UNSAFE_REQUIRED, singleError(result).getKind());
            }
        }
    }

    @Nested
    @DisplayName("match")
    class Match {

        private Declaration color() {
            return enumDecl("Color", variant("Red"), variant("Green"), variant("Blue"));
        }

        private Declaration paint(MatchStmt match) {
            return fn("paint", Arrays.asList(param("c", type("Color"))), null, match);
        }

        @Test
        @DisplayName("未覆盖全部变体时警告")
        void nonExhaustiveWarning() {
            MatchStmt match = new MatchStmt(loc(), ident("c"), Arrays.asList(
                    arm(enumPattern("Color", "Red"), block()),
                    arm(enumPattern("Color", "Green"), block())));
            AnalysisResult result = analyze(color(), paint(match));
            assertClean(result);
            assertEquals(1, result.getWarnings().size());
            SemanticDiagnostic warning = result.getWarnings().get(0);
            assertEquals(ErrorKind.INVALID_CONTROL_FLOW, warning.getKind());
            assertTrue(warning.getMessage().contains("Blue"));
        }

        @Test
        void wildcardIsExhaustive() {
            MatchStmt match = new MatchStmt(loc(), ident("c"), Arrays.asList(
                    arm(enumPattern("Color", "Red"), block()),
                    arm(wildcard(), block())));
            AnalysisResult result = analyze(color(), paint(match));
            assertClean(result);
            assertTrue(result.getWarnings().isEmpty());
        }

        @Test
        void unknownVariantPattern() {
            MatchStmt match = new MatchStmt(loc(), ident("c"), Arrays.asList(
                    arm(enumPattern("Color", "Purple"), block()),
                    arm(wildcard(), block())));
            AnalysisResult result = analyze(color(), paint(match));
            assertEquals(ErrorKind.INVALID_EXPRESSION, singleError(result).getKind());
        }

        @Test
        @DisplayName("Option 的 Some 绑定负载")
        void optionPatterns() {
            Expression v = ident("v");
            MatchStmt match = new MatchStmt(loc(), ident("o"), Arrays.asList(
                    arm(enumPattern("Option", "Some", bindPattern("v")), block(exprStmt(v))),
                    arm(enumPattern("Option", "None"), block())));
            AnalysisResult result = analyze(fn("f", Arrays.asList(param("o", optionType(type("i64")))), null, match));
            assertClean(result);
            assertTrue(result.getWarnings().isEmpty());
            assertEquals("i64", result.getExprTypeName(v));
        }

        @Test
        void patternArityMismatch() {
            MatchStmt match = new MatchStmt(loc(), ident("o"), Arrays.asList(
                    arm(enumPattern("Option", "Some"), block()),
                    arm(wildcard(), block())));
            AnalysisResult result = analyze(fn("f", Arrays.asList(param("o", optionType(type("i64")))), null, match));
            assertEquals(ErrorKind.ARITY_MISMATCH, singleError(result).getKind());
        }
    }

    @Nested
    @DisplayName("并发语句")
    class Concurrency {

        private Declaration worker() {
            return fn("worker", null);
        }

        private Declaration compute() {
            return fn("compute", type("i64"), ret(intLit(42)));
        }

        @Test
        @DisplayName("spawn、spawn_with_handle 与 await")
        void spawnAndAwait() {
            Expression awaited = new AwaitExpr(loc(), ident("h"));
            AnalysisResult result = analyze(worker(), compute(), mainFn(
                    new SpawnStmt(loc(), call("worker")),
                    new SpawnWithHandleStmt(loc(), "h", call("compute")),
                    let("r", type("i64"), awaited)));
            assertClean(result);
            assertEquals("i64", result.getExprTypeName(awaited));
        }

        @Test
        @DisplayName("spawn 的函数必须返回 void")
        void spawnNonVoid() {
            AnalysisResult result = analyze(compute(), mainFn(new SpawnStmt(loc(), call("compute"))));
            SemanticDiagnostic d = singleError(result);
            assertEquals(ErrorKind.TYPE_MISMATCH, d.getKind());
            assertNotNull(d.getSuggestion());
        }

        @Test
        void spawnNeedsCall() {
            AnalysisResult result = analyze(worker(), mainFn(new SpawnStmt(loc(), ident("worker"))));
            assertEquals(ErrorKind.INVALID_EXPRESSION, singleError(result).getKind());
        }

        @Test
        void awaitNeedsHandle() {
            AnalysisResult result = analyze(mainFn(
                    let("n", type("i32"), intLit(1)),
                    exprStmt(new AwaitExpr(loc(), ident("n")))));
            assertEquals(ErrorKind.TYPE_MISMATCH, singleError(result).getKind());
        }

        @Test
        void handleType() {
            Expression handle = ident("h");
            AnalysisResult result = analyze(compute(), mainFn(
                    new SpawnWithHandleStmt(loc(), "h", call("compute")),
                    exprStmt(handle)));
            assertClean(result);
            assertEquals("TaskHandle<i64>", result.getExprTypeName(handle));
        }
    }
}
