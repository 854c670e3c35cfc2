package com.asthralang.compiler.analysis;

import com.asthralang.compiler.analysis.types.TypeDescriptors;
import com.asthralang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.asthralang.compiler.ast.expr.Expression;
import com.asthralang.compiler.ast.expr.UnaryExpr.UnaryOp;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.asthralang.compiler.analysis.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 编译期常量求值：64 位回绕、移位取模、除零、类型转换与常量引用
 */
class ConstEvaluatorTest {

    private SemanticAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new SemanticAnalyzer(AnalyzerConfig.forTesting());
    }

    @AfterEach
    void tearDown() {
        analyzer.close();
    }

    private ConstValue eval(Expression expr) {
        return analyzer.evaluateConst(expr);
    }

    private ConstEvaluationException evalFails(Expression expr) {
        return assertThrows(ConstEvaluationException.class, () -> analyzer.evaluateConst(expr));
    }

    @Nested
    @DisplayName("整数运算")
    class IntegerFolding {

        @Test
        void arithmetic() {
            assertEquals(7, eval(binary(intLit(1), BinaryOp.ADD, binary(intLit(2), BinaryOp.MUL, intLit(3)))).asLong());
            assertEquals(-3, eval(binary(intLit(-7), BinaryOp.DIV, intLit(2))).asLong());
            assertEquals(-1, eval(binary(intLit(-7), BinaryOp.MOD, intLit(2))).asLong());
            assertEquals(-5, eval(unary(UnaryOp.NEG, intLit(5))).asLong());
            assertEquals(~12L, eval(unary(UnaryOp.BIT_NOT, intLit(12))).asLong());
        }

        @Test
        @DisplayName("溢出按 64 位补码回绕")
        void wraparound() {
            ConstValue v = eval(binary(intLit(Long.MAX_VALUE), BinaryOp.ADD, intLit(1)));
            assertEquals(Long.MIN_VALUE, v.asLong());
            assertEquals(0, eval(binary(intLit(Long.MIN_VALUE), BinaryOp.MUL, intLit(2))).asLong());
        }

        @Test
        @DisplayName("移位量取低 6 位")
        void shiftMasking() {
            assertEquals(2, eval(binary(intLit(1), BinaryOp.SHL, intLit(65))).asLong());
            assertEquals(-1, eval(binary(intLit(-8), BinaryOp.SHR, intLit(67))).asLong());
            assertEquals(1L << 63, eval(binary(intLit(1), BinaryOp.SHL, intLit(63))).asLong());
        }

        @Test
        void bitwiseAndComparison() {
            assertEquals(0b1000, eval(binary(intLit(0b1100), BinaryOp.BIT_AND, intLit(0b1010))).asLong());
            assertEquals(0b0110, eval(binary(intLit(0b1100), BinaryOp.BIT_XOR, intLit(0b1010))).asLong());
            assertTrue(eval(binary(intLit(3), BinaryOp.LT, intLit(4))).asBoolean());
            assertFalse(eval(binary(intLit(3), BinaryOp.EQ, intLit(4))).asBoolean());
        }

        @Test
        @DisplayName("除以零和对零取模不是常量")
        void divisionByZero() {
            ConstEvaluationException div = evalFails(binary(intLit(1), BinaryOp.DIV, intLit(0)));
            assertEquals(ErrorKind.INVALID_EXPRESSION, div.getKind());
            ConstEvaluationException mod = evalFails(binary(intLit(1), BinaryOp.MOD, intLit(0)));
            assertEquals(ErrorKind.INVALID_EXPRESSION, mod.getKind());
        }
    }

    @Nested
    @DisplayName("其他值种类")
    class OtherKinds {

        @Test
        void floats() {
            assertEquals(3.0, eval(binary(floatLit(1.5), BinaryOp.MUL, floatLit(2.0))).asDouble(), 1e-9);
            assertEquals(2.5, eval(binary(intLit(2), BinaryOp.ADD, floatLit(0.5))).asDouble(), 1e-9);
            assertTrue(Double.isInfinite(eval(binary(floatLit(1.0), BinaryOp.DIV, floatLit(0.0))).asDouble()));
        }

        @Test
        void booleans() {
            assertFalse(eval(binary(boolLit(true), BinaryOp.AND, boolLit(false))).asBoolean());
            assertTrue(eval(unary(UnaryOp.NOT, boolLit(false))).asBoolean());
            assertTrue(eval(binary(boolLit(true), BinaryOp.EQ, boolLit(true))).asBoolean());
        }

        @Test
        void strings() {
            assertEquals("ab", eval(binary(strLit("a"), BinaryOp.ADD, strLit("b"))).asString());
            assertTrue(eval(binary(strLit("x"), BinaryOp.NE, strLit("y"))).asBoolean());
            assertEquals(ErrorKind.TYPE_MISMATCH, evalFails(binary(strLit("a"), BinaryOp.MUL, strLit("b"))).getKind());
        }

        @Test
        @DisplayName("不同种类的操作数报告 TYPE_MISMATCH")
        void mismatchedKinds() {
            assertEquals(ErrorKind.TYPE_MISMATCH, evalFails(binary(boolLit(true), BinaryOp.ADD, intLit(1))).getKind());
            assertEquals(ErrorKind.TYPE_MISMATCH, evalFails(binary(strLit("a"), BinaryOp.ADD, intLit(1))).getKind());
        }

        @Test
        void charIsInteger() {
            assertEquals('A', eval(charLit('A')).asLong());
        }
    }

    @Nested
    @DisplayName("类型转换与 sizeof")
    class Casts {

        @Test
        @DisplayName("转换为窄整数时截断并按符号扩展")
        void narrowingCasts() {
            assertEquals(44, eval(cast(intLit(300), type("u8"))).asLong());
            assertEquals(255, eval(cast(intLit(-1), type("u8"))).asLong());
            assertEquals(-56, eval(cast(intLit(200), type("i8"))).asLong());
            assertEquals(65535, eval(cast(intLit(-1), type("u16"))).asLong());
        }

        @Test
        void otherCasts() {
            assertEquals(1, eval(cast(boolLit(true), type("i32"))).asLong());
            assertEquals(3, eval(cast(floatLit(3.9), type("i64"))).asLong());
            assertEquals(2.0, eval(cast(intLit(2), type("f64"))).asDouble(), 1e-9);
            evalFails(cast(strLit("1"), type("i32")));
        }

        @Test
        void wrapToWidth() {
            assertEquals(-128, ConstEvaluator.wrapToWidth(128, com.asthralang.compiler.analysis.types.PrimitiveKind.I8));
            assertEquals(0, ConstEvaluator.wrapToWidth(1L << 32, com.asthralang.compiler.analysis.types.PrimitiveKind.U32));
            assertEquals(Long.MAX_VALUE,
                    ConstEvaluator.wrapToWidth(Long.MAX_VALUE, com.asthralang.compiler.analysis.types.PrimitiveKind.I64));
        }

        @Test
        void sizeofPrimitive() {
            assertEquals(8, eval(new com.asthralang.compiler.ast.expr.SizeofExpr(loc(), type("i64"))).asLong());
        }
    }

    @Nested
    @DisplayName("常量引用")
    class ConstReferences {

        @Test
        @DisplayName("引用其他常量，包括前向引用")
        void forwardReference() {
            analyzer.analyzeProgram(program(
                    constDecl("B", null, binary(ident("A"), BinaryOp.MUL, intLit(3))),
                    constDecl("A", null, intLit(2))));
            assertEquals(0, analyzer.getErrorCount());
            assertEquals(6, eval(ident("B")).asLong());
            Symbol b = analyzer.getGlobalScope().lookup("B");
            assertEquals(TypeDescriptors.I32, b.getType());
            assertEquals(ConstValue.ofInteger(6), b.getConstValue());
        }

        @Test
        @DisplayName("无注解常量链式前向引用")
        void chainedForwardReference() {
            analyzer.analyzeProgram(program(
                    constDecl("X", null, ident("Y")),
                    constDecl("Y", null, ident("Z")),
                    constDecl("Z", null, intLit(42))));
            assertEquals(0, analyzer.getErrorCount(), () -> analyzer.getDiagnostics().getDiagnostics().toString());
            assertEquals(42, eval(ident("X")).asLong());
            assertEquals(TypeDescriptors.I32, analyzer.getGlobalScope().lookup("X").getType());
        }

        @Test
        @DisplayName("循环引用报告 INVALID_EXPRESSION")
        void cycleDetected() {
            analyzer.analyzeProgram(program(
                    constDecl("P", null, ident("Q")),
                    constDecl("Q", null, ident("P"))));
            assertTrue(analyzer.getErrorCount() > 0);
            for (SemanticDiagnostic d : analyzer.getDiagnostics().getErrors()) {
                assertEquals(ErrorKind.INVALID_EXPRESSION, d.getKind());
            }
        }

        @Test
        @DisplayName("带类型注解的循环引用同样被检测")
        void typedCycleDetected() {
            analyzer.analyzeProgram(program(
                    constDecl("P", type("i32"), binary(ident("Q"), BinaryOp.ADD, intLit(1))),
                    constDecl("Q", type("i32"), ident("P"))));
            assertTrue(analyzer.getErrorCount() > 0);
            assertTrue(analyzer.getDiagnostics().getErrors().get(0).getMessage().contains("循环引用"));
        }

        @Test
        @DisplayName("变量不是常量")
        void variableIsNotConst() {
            Symbol v = new Symbol("v", SymbolKind.VARIABLE, TypeDescriptors.I32, null,
                    com.asthralang.compiler.ast.Visibility.PRIVATE);
            analyzer.getGlobalScope().insert("v", v);
            assertEquals(ErrorKind.INVALID_EXPRESSION, evalFails(ident("v")).getKind());
            assertEquals(ErrorKind.UNDECLARED_IDENTIFIER, evalFails(ident("nope")).getKind());
        }

        @Test
        @DisplayName("常量初始化表达式不是常量时报告错误")
        void nonConstInitializer() {
            analyzer.analyzeProgram(program(
                    fn("f", type("i32"), ret(intLit(1))),
                    constDecl("C", type("i32"), call("f"))));
            assertEquals(1, analyzer.getErrorCount());
            assertEquals(ErrorKind.INVALID_EXPRESSION, analyzer.getDiagnostics().getErrors().get(0).getKind());
        }

        @Test
        @DisplayName("常量值超出声明的整数类型时报告溢出，不保存回绕前的值")
        void declaredWidthOverflow() {
            analyzer.analyzeProgram(program(
                    constDecl("X", type("u8"), binary(intLit(255), BinaryOp.ADD, intLit(1))),
                    constDecl("Y", type("i32"), binary(intLit(Integer.MAX_VALUE), BinaryOp.ADD, intLit(1))),
                    constDecl("Z", type("u8"), binary(intLit(200), BinaryOp.ADD, intLit(55)))));
            java.util.List<SemanticDiagnostic> errors = analyzer.getDiagnostics().getErrors();
            assertEquals(2, errors.size(), errors::toString);
            for (SemanticDiagnostic d : errors) {
                assertEquals(ErrorKind.TYPE_MISMATCH, d.getKind());
                assertTrue(d.getMessage().contains("溢出"), d.getMessage());
            }
            assertTrue(errors.get(0).getMessage().contains("u8"));
            assertTrue(errors.get(1).getMessage().contains("i32"));
            assertNull(analyzer.getGlobalScope().lookup("X").getConstValue());
            assertNull(analyzer.getGlobalScope().lookup("Y").getConstValue());
            assertEquals(ConstValue.ofInteger(255), analyzer.getGlobalScope().lookup("Z").getConstValue());
        }

        @Test
        @DisplayName("溢出的常量不能作为数组长度")
        void overflowingConstAsArraySize() {
            analyzer.analyzeProgram(program(
                    constDecl("X", type("u8"), binary(intLit(255), BinaryOp.ADD, intLit(1))),
                    fn("f", null, let("arr", array(type("i32"), ident("X")), null))));
            java.util.List<SemanticDiagnostic> errors = analyzer.getDiagnostics().getErrors();
            assertEquals(2, errors.size(), errors::toString);
            assertEquals(ErrorKind.TYPE_MISMATCH, errors.get(0).getKind());
            assertEquals(ErrorKind.INVALID_EXPRESSION, errors.get(1).getKind());
            assertTrue(errors.get(1).getMessage().contains("256"), errors.get(1).getMessage());
            assertEquals(ErrorKind.TYPE_MISMATCH, evalFails(ident("X")).getKind());
        }
    }
}
