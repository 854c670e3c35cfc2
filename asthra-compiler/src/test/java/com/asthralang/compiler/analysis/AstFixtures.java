package com.asthralang.compiler.analysis;

import com.asthralang.compiler.ast.SourceLocation;
import com.asthralang.compiler.ast.Visibility;
import com.asthralang.compiler.ast.decl.Annotation;
import com.asthralang.compiler.ast.decl.ConstDecl;
import com.asthralang.compiler.ast.decl.Declaration;
import com.asthralang.compiler.ast.decl.EnumDecl;
import com.asthralang.compiler.ast.decl.ExternDecl;
import com.asthralang.compiler.ast.decl.FunctionDecl;
import com.asthralang.compiler.ast.decl.ImplBlock;
import com.asthralang.compiler.ast.decl.ImportDecl;
import com.asthralang.compiler.ast.decl.MethodDecl;
import com.asthralang.compiler.ast.decl.PackageDecl;
import com.asthralang.compiler.ast.decl.Parameter;
import com.asthralang.compiler.ast.decl.Program;
import com.asthralang.compiler.ast.decl.StructDecl;
import com.asthralang.compiler.ast.decl.StructFieldDecl;
import com.asthralang.compiler.ast.expr.ArrayLiteral;
import com.asthralang.compiler.ast.expr.AssignExpr;
import com.asthralang.compiler.ast.expr.BinaryExpr;
import com.asthralang.compiler.ast.expr.CallExpr;
import com.asthralang.compiler.ast.expr.CastExpr;
import com.asthralang.compiler.ast.expr.Expression;
import com.asthralang.compiler.ast.expr.FieldAccessExpr;
import com.asthralang.compiler.ast.expr.Identifier;
import com.asthralang.compiler.ast.expr.Literal;
import com.asthralang.compiler.ast.expr.RepeatedArrayLiteral;
import com.asthralang.compiler.ast.expr.StructLiteral;
import com.asthralang.compiler.ast.expr.TupleLiteral;
import com.asthralang.compiler.ast.expr.UnaryExpr;
import com.asthralang.compiler.ast.pattern.EnumPattern;
import com.asthralang.compiler.ast.pattern.IdentifierPattern;
import com.asthralang.compiler.ast.pattern.Pattern;
import com.asthralang.compiler.ast.pattern.WildcardPattern;
import com.asthralang.compiler.ast.stmt.Block;
import com.asthralang.compiler.ast.stmt.ExpressionStmt;
import com.asthralang.compiler.ast.stmt.LetStmt;
import com.asthralang.compiler.ast.stmt.MatchArm;
import com.asthralang.compiler.ast.stmt.ReturnStmt;
import com.asthralang.compiler.ast.stmt.Statement;
import com.asthralang.compiler.ast.type.ArrayTypeRef;
import com.asthralang.compiler.ast.type.GenericTypeRef;
import com.asthralang.compiler.ast.type.NamedTypeRef;
import com.asthralang.compiler.ast.type.OptionTypeRef;
import com.asthralang.compiler.ast.type.PointerTypeRef;
import com.asthralang.compiler.ast.type.SliceTypeRef;
import com.asthralang.compiler.ast.type.TupleTypeRef;
import com.asthralang.compiler.ast.type.TypeParameter;
import com.asthralang.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 测试用 AST 构造辅助。每个节点分配独立行号，便于断言诊断位置。
 */
final class AstFixtures {

    static final String FILE = "test.asthra";

    private static final AtomicInteger LINE = new AtomicInteger(1);

    private AstFixtures() {}

    static SourceLocation loc() {
        return new SourceLocation(FILE, LINE.getAndIncrement(), 1);
    }

    // ============ 程序与声明 ============

    static Program program(Declaration... decls) {
        return new Program(loc(), new PackageDecl(loc(), "main"),
                Collections.<ImportDecl>emptyList(), Arrays.asList(decls));
    }

    static Program program(List<ImportDecl> imports, Declaration... decls) {
        return new Program(loc(), new PackageDecl(loc(), "main"), imports, Arrays.asList(decls));
    }

    static ImportDecl importDecl(String path, String alias) {
        return new ImportDecl(loc(), path, alias);
    }

    static FunctionDecl fn(String name, TypeRef returnType, Statement... body) {
        return fn(name, Collections.<Parameter>emptyList(), returnType, body);
    }

    static FunctionDecl fn(String name, List<Parameter> params, TypeRef returnType, Statement... body) {
        return new FunctionDecl(loc(), null, Visibility.PUBLIC, name, null, params, returnType, block(body));
    }

    static FunctionDecl annotatedFn(List<Annotation> annotations, String name, TypeRef returnType,
                                    Statement... body) {
        return new FunctionDecl(loc(), annotations, Visibility.PUBLIC, name, null,
                Collections.<Parameter>emptyList(), returnType, block(body));
    }

    static FunctionDecl genericFn(String name, List<String> typeParams, List<Parameter> params,
                                  TypeRef returnType, Statement... body) {
        List<TypeParameter> tps = new ArrayList<TypeParameter>();
        for (String tp : typeParams) {
            tps.add(new TypeParameter(loc(), tp));
        }
        return new FunctionDecl(loc(), null, Visibility.PUBLIC, name, tps, params, returnType, block(body));
    }

    /** main 函数，返回 void */
    static FunctionDecl mainFn(Statement... body) {
        return fn("main", null, body);
    }

    static Parameter param(String name, TypeRef type) {
        return new Parameter(loc(), name, type);
    }

    static Parameter param(String name, TypeRef type, Annotation... annotations) {
        return new Parameter(loc(), name, type, false, Arrays.asList(annotations));
    }

    static StructDecl struct(String name, StructFieldDecl... fields) {
        return new StructDecl(loc(), null, Visibility.PUBLIC, name, null, Arrays.asList(fields), false);
    }

    static StructDecl genericStruct(String name, List<String> typeParams, StructFieldDecl... fields) {
        List<TypeParameter> tps = new ArrayList<TypeParameter>();
        for (String tp : typeParams) {
            tps.add(new TypeParameter(loc(), tp));
        }
        return new StructDecl(loc(), null, Visibility.PUBLIC, name, tps, Arrays.asList(fields), false);
    }

    static StructFieldDecl field(String name, TypeRef type) {
        return new StructFieldDecl(loc(), name, type, Visibility.PUBLIC, null);
    }

    static StructFieldDecl privateField(String name, TypeRef type) {
        return new StructFieldDecl(loc(), name, type, Visibility.PRIVATE, null);
    }

    static EnumDecl enumDecl(String name, EnumDecl.EnumVariantDecl... variants) {
        return new EnumDecl(loc(), null, Visibility.PUBLIC, name, null, Arrays.asList(variants));
    }

    static EnumDecl.EnumVariantDecl variant(String name, TypeRef... payload) {
        return new EnumDecl.EnumVariantDecl(loc(), name, Arrays.asList(payload));
    }

    static ImplBlock impl(String structName, MethodDecl... methods) {
        return new ImplBlock(loc(), null, structName, Arrays.asList(methods));
    }

    static MethodDecl method(String name, MethodDecl.SelfKind selfKind, List<Parameter> params,
                             TypeRef returnType, Statement... body) {
        return new MethodDecl(loc(), null, Visibility.PUBLIC, name, selfKind, params, returnType, block(body));
    }

    static ExternDecl extern(String name, List<Parameter> params, TypeRef returnType) {
        return new ExternDecl(loc(), null, Visibility.PUBLIC, name, "libc", params, returnType, null);
    }

    static ExternDecl extern(String name, List<Parameter> params, TypeRef returnType,
                             List<Annotation> returnAnnotations) {
        return new ExternDecl(loc(), null, Visibility.PUBLIC, name, "libc", params, returnType, returnAnnotations);
    }

    static ConstDecl constDecl(String name, TypeRef type, Expression value) {
        return new ConstDecl(loc(), null, Visibility.PUBLIC, name, type, value);
    }

    static Annotation annotation(String name) {
        return new Annotation(loc(), name);
    }

    static Annotation annotation(String name, Expression value) {
        return new Annotation(loc(), name,
                Collections.singletonList(new Annotation.AnnotationArg(loc(), null, value)));
    }

    // ============ 类型 ============

    static TypeRef type(String name) {
        return new NamedTypeRef(loc(), name);
    }

    static TypeRef generic(String name, TypeRef... args) {
        return new GenericTypeRef(loc(), name, Arrays.asList(args));
    }

    static TypeRef pointer(TypeRef pointee, boolean mutable) {
        return new PointerTypeRef(loc(), pointee, mutable);
    }

    static TypeRef slice(TypeRef element) {
        return new SliceTypeRef(loc(), element, false);
    }

    static TypeRef array(TypeRef element, Expression size) {
        return new ArrayTypeRef(loc(), element, size);
    }

    static TypeRef tupleType(TypeRef... elements) {
        return new TupleTypeRef(loc(), Arrays.asList(elements));
    }

    static TypeRef optionType(TypeRef value) {
        return new OptionTypeRef(loc(), value);
    }

    // ============ 语句 ============

    static Block block(Statement... statements) {
        return new Block(loc(), Arrays.asList(statements));
    }

    static LetStmt let(String name, TypeRef type, Expression init) {
        return new LetStmt(loc(), name, type, init, false);
    }

    static LetStmt letMut(String name, TypeRef type, Expression init) {
        return new LetStmt(loc(), name, type, init, true);
    }

    static ExpressionStmt exprStmt(Expression expr) {
        return new ExpressionStmt(expr);
    }

    static ReturnStmt ret(Expression value) {
        return new ReturnStmt(loc(), value);
    }

    static MatchArm arm(Pattern pattern, Statement body) {
        return new MatchArm(loc(), pattern, null, body);
    }

    // ============ 模式 ============

    static Pattern wildcard() {
        return new WildcardPattern(loc());
    }

    static Pattern bindPattern(String name) {
        return new IdentifierPattern(loc(), name, false);
    }

    static Pattern enumPattern(String enumName, String variantName, Pattern... payload) {
        return new EnumPattern(loc(), enumName, variantName, Arrays.asList(payload));
    }

    // ============ 表达式 ============

    static Literal intLit(long value) {
        return new Literal(loc(), Long.valueOf(value), Literal.LiteralKind.INT);
    }

    static Literal floatLit(double value) {
        return new Literal(loc(), Double.valueOf(value), Literal.LiteralKind.FLOAT);
    }

    static Literal boolLit(boolean value) {
        return new Literal(loc(), Boolean.valueOf(value), Literal.LiteralKind.BOOL);
    }

    static Literal strLit(String value) {
        return new Literal(loc(), value, Literal.LiteralKind.STRING);
    }

    static Literal charLit(int codePoint) {
        return new Literal(loc(), Integer.valueOf(codePoint), Literal.LiteralKind.CHAR);
    }

    static Identifier ident(String name) {
        return new Identifier(loc(), name);
    }

    static BinaryExpr binary(Expression left, BinaryExpr.BinaryOp op, Expression right) {
        return new BinaryExpr(loc(), left, op, right);
    }

    static UnaryExpr unary(UnaryExpr.UnaryOp op, Expression operand) {
        return new UnaryExpr(loc(), op, operand);
    }

    static CallExpr call(String name, Expression... args) {
        return new CallExpr(loc(), ident(name), Arrays.asList(args));
    }

    static CallExpr memberCall(Expression target, String member, Expression... args) {
        return new CallExpr(loc(), new FieldAccessExpr(loc(), target, member), Arrays.asList(args));
    }

    static FieldAccessExpr fieldAccess(Expression target, String field) {
        return new FieldAccessExpr(loc(), target, field);
    }

    static AssignExpr assign(Expression target, Expression value) {
        return new AssignExpr(loc(), target, value);
    }

    static CastExpr cast(Expression expr, TypeRef target) {
        return new CastExpr(loc(), expr, target);
    }

    static ArrayLiteral arrayLit(Expression... elements) {
        return new ArrayLiteral(loc(), Arrays.asList(elements));
    }

    static RepeatedArrayLiteral repeat(Expression value, Expression count) {
        return new RepeatedArrayLiteral(loc(), value, count);
    }

    static TupleLiteral tuple(Expression... elements) {
        return new TupleLiteral(loc(), Arrays.asList(elements));
    }

    static StructLiteral structLit(String name, StructLiteral.FieldInit... fields) {
        return new StructLiteral(loc(), name, null, Arrays.asList(fields));
    }

    static StructLiteral.FieldInit init(String name, Expression value) {
        return new StructLiteral.FieldInit(loc(), name, value);
    }
}
