package com.asthralang.compiler.ast;

import com.asthralang.compiler.ast.decl.*;
import com.asthralang.compiler.ast.expr.*;
import com.asthralang.compiler.ast.pattern.*;
import com.asthralang.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。
 * 分析器把 null 视为"不支持的节点"。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitProgram(Program node, C ctx) { return null; }

    default R visitPackageDecl(PackageDecl node, C ctx) { return null; }

    default R visitImportDecl(ImportDecl node, C ctx) { return null; }

    default R visitFunctionDecl(FunctionDecl node, C ctx) { return null; }

    default R visitMethodDecl(MethodDecl node, C ctx) { return null; }

    default R visitParameter(Parameter node, C ctx) { return null; }

    default R visitStructDecl(StructDecl node, C ctx) { return null; }

    default R visitStructFieldDecl(StructFieldDecl node, C ctx) { return null; }

    default R visitEnumDecl(EnumDecl node, C ctx) { return null; }

    default R visitExternDecl(ExternDecl node, C ctx) { return null; }

    default R visitImplBlock(ImplBlock node, C ctx) { return null; }

    default R visitConstDecl(ConstDecl node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitBlock(Block node, C ctx) { return null; }

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return null; }

    default R visitLetStmt(LetStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitIfLetStmt(IfLetStmt node, C ctx) { return null; }

    default R visitMatchStmt(MatchStmt node, C ctx) { return null; }

    default R visitForStmt(ForStmt node, C ctx) { return null; }

    default R visitWhileStmt(WhileStmt node, C ctx) { return null; }

    default R visitBreakStmt(BreakStmt node, C ctx) { return null; }

    default R visitContinueStmt(ContinueStmt node, C ctx) { return null; }

    default R visitSpawnStmt(SpawnStmt node, C ctx) { return null; }

    default R visitSpawnWithHandleStmt(SpawnWithHandleStmt node, C ctx) { return null; }

    default R visitUnsafeBlock(UnsafeBlock node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitAssociatedCallExpr(AssociatedCallExpr node, C ctx) { return null; }

    default R visitFieldAccessExpr(FieldAccessExpr node, C ctx) { return null; }

    default R visitIndexExpr(IndexExpr node, C ctx) { return null; }

    default R visitSliceExpr(SliceExpr node, C ctx) { return null; }

    default R visitAssignExpr(AssignExpr node, C ctx) { return null; }

    default R visitArrayLiteral(ArrayLiteral node, C ctx) { return null; }

    default R visitRepeatedArrayLiteral(RepeatedArrayLiteral node, C ctx) { return null; }

    default R visitTupleLiteral(TupleLiteral node, C ctx) { return null; }

    default R visitStructLiteral(StructLiteral node, C ctx) { return null; }

    default R visitEnumVariantExpr(EnumVariantExpr node, C ctx) { return null; }

    default R visitCastExpr(CastExpr node, C ctx) { return null; }

    default R visitMatchExpr(MatchExpr node, C ctx) { return null; }

    default R visitAwaitExpr(AwaitExpr node, C ctx) { return null; }

    default R visitSizeofExpr(SizeofExpr node, C ctx) { return null; }

    // ============ 模式 ============

    default R visitWildcardPattern(WildcardPattern node, C ctx) { return null; }

    default R visitIdentifierPattern(IdentifierPattern node, C ctx) { return null; }

    default R visitLiteralPattern(LiteralPattern node, C ctx) { return null; }

    default R visitEnumPattern(EnumPattern node, C ctx) { return null; }

    default R visitStructPattern(StructPattern node, C ctx) { return null; }

    default R visitTuplePattern(TuplePattern node, C ctx) { return null; }
}
