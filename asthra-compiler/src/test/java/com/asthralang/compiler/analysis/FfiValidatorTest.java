package com.asthralang.compiler.analysis;

import com.asthralang.compiler.ast.decl.Declaration;
import com.asthralang.compiler.ast.type.TypeRef;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.asthralang.compiler.analysis.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 外部函数边界的类型检查与所有权注解提示
 */
class FfiValidatorTest {

    private SemanticAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new SemanticAnalyzer(AnalyzerConfig.forTesting());
    }

    @AfterEach
    void tearDown() {
        analyzer.close();
    }

    private AnalysisResult analyzeExtern(TypeRef paramType, TypeRef returnType, Declaration... others) {
        Declaration[] decls = Arrays.copyOf(others, others.length + 1);
        List<com.asthralang.compiler.ast.decl.Parameter> params = paramType != null
                ? Collections.singletonList(param("arg", paramType))
                : Collections.<com.asthralang.compiler.ast.decl.Parameter>emptyList();
        decls[others.length] = extern("native", params, returnType);
        return analyzer.analyze(program(decls));
    }

    private static SemanticDiagnostic singleError(AnalysisResult result) {
        List<SemanticDiagnostic> errors = result.getErrors();
        assertEquals(1, errors.size(), errors::toString);
        assertEquals(ErrorKind.FFI_INCOMPATIBLE_TYPE, errors.get(0).getKind());
        return errors.get(0);
    }

    @Test
    @DisplayName("原始类型与指针可以跨越边界")
    void safeTypes() {
        assertTrue(analyzeExtern(type("i32"), type("f64")).isSuccess());
        analyzer.reset();
        assertTrue(analyzeExtern(pointer(type("u8"), false), pointer(type("void"), true)).isSuccess());
        analyzer.reset();
        assertTrue(analyzeExtern(null, null).isSuccess());
    }

    @Test
    @DisplayName("切片参数建议拆成指针与长度")
    void sliceParameter() {
        SemanticDiagnostic d = singleError(analyzeExtern(slice(type("i32")), null));
        assertEquals("改为传递两个参数: ptr: *const i32, len: usize", d.getSuggestion());
    }

    @Test
    void stringParameterAndReturn() {
        assertEquals("使用 *const u8", singleError(analyzeExtern(type("string"), null)).getSuggestion());
        analyzer.reset();
        assertEquals("使用 *const u8", singleError(analyzeExtern(null, type("string"))).getSuggestion());
    }

    @Test
    void voidParameter() {
        singleError(analyzeExtern(type("void"), null));
    }

    @Test
    void genericType() {
        singleError(analyzeExtern(optionType(type("i32")), null));
        analyzer.reset();
        Declaration box = genericStruct("Box", Collections.singletonList("T"), field("value", type("T")));
        singleError(analyzeExtern(generic("Box", type("i32")), null, box));
    }

    @Test
    @DisplayName("枚举只有无负载时可以跨越边界")
    void enums() {
        Declaration flags = enumDecl("Mode", variant("Read"), variant("Write"));
        assertTrue(analyzeExtern(type("Mode"), null, flags).isSuccess());
        analyzer.reset();
        Declaration payload = enumDecl("Event", variant("Key", type("u32")), variant("Quit"));
        singleError(analyzeExtern(type("Event"), null, payload));
    }

    @Test
    @DisplayName("结构体的字段必须全部可跨越边界")
    void structs() {
        Declaration header = struct("Header",
                field("len", type("u32")),
                field("data", pointer(type("u8"), false)),
                field("next", pointer(type("Header"), true)));
        assertTrue(analyzeExtern(type("Header"), null, header).isSuccess());
        analyzer.reset();
        Declaration named = struct("Named", field("name", type("string")));
        singleError(analyzeExtern(type("Named"), null, named));
    }

    @Test
    @DisplayName("关闭 FFI 检查时不报告")
    void validationDisabled() {
        AnalyzerConfig config = AnalyzerConfig.forTesting();
        config.setValidateFfi(false);
        try (SemanticAnalyzer lenient = new SemanticAnalyzer(config)) {
            AnalysisResult result = lenient.analyze(program(extern("native",
                    Collections.singletonList(param("s", slice(type("u8")))), type("string"))));
            assertTrue(result.isSuccess());
        }
    }

    @Test
    @DisplayName("开启所有权检查时指针缺少转移注解给出警告")
    void ownershipWarnings() {
        AnalyzerConfig config = AnalyzerConfig.forTesting();
        config.setCheckOwnership(true);
        try (SemanticAnalyzer strict = new SemanticAnalyzer(config)) {
            AnalysisResult result = strict.analyze(program(
                    extern("dup", Collections.singletonList(param("src", pointer(type("u8"), false))),
                            pointer(type("u8"), true)),
                    extern("free", Collections.singletonList(
                            param("p", pointer(type("void"), true), annotation("transfer_full"))), null),
                    extern("strdup", Collections.singletonList(
                            param("s", pointer(type("u8"), false), annotation("borrowed"))),
                            pointer(type("u8"), true), Collections.singletonList(annotation("transfer_full")))));
            assertTrue(result.isSuccess());
            assertEquals(2, result.getWarnings().size());
            for (SemanticDiagnostic w : result.getWarnings()) {
                assertEquals(ErrorKind.MISSING_ANNOTATION, w.getKind());
            }
        }
    }
}
