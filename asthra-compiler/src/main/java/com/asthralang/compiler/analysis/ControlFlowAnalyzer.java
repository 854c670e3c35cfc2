package com.asthralang.compiler.analysis;

import com.asthralang.compiler.analysis.types.TypeDescriptor;
import com.asthralang.compiler.ast.stmt.Block;
import com.asthralang.compiler.ast.stmt.BreakStmt;
import com.asthralang.compiler.ast.stmt.ContinueStmt;
import com.asthralang.compiler.ast.stmt.ExpressionStmt;
import com.asthralang.compiler.ast.stmt.IfLetStmt;
import com.asthralang.compiler.ast.stmt.IfStmt;
import com.asthralang.compiler.ast.stmt.MatchArm;
import com.asthralang.compiler.ast.stmt.MatchStmt;
import com.asthralang.compiler.ast.stmt.ReturnStmt;
import com.asthralang.compiler.ast.stmt.Statement;
import com.asthralang.compiler.ast.stmt.UnsafeBlock;

import java.util.List;

/**
 * 保守的控制流判定，基于已分析语句上挂接的类型。
 * 用于缺失 return 检查、不可达代码警告与 match 分支的 Never 判定。
 */
final class ControlFlowAnalyzer {

    private final SemanticAnalyzer analyzer;

    ControlFlowAnalyzer(SemanticAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    /** 块内所有路径都以 return 或发散表达式结束 */
    boolean allPathsReturn(Block block) {
        return block != null && blockDiverges(block.getStatements(), false);
    }

    /**
     * 块不会正常落到结尾：return、break、continue 或发散表达式。
     * match 分支的 Block 体据此判定类型为 Never。
     */
    boolean blockReturnsNever(Block block) {
        return block != null && blockDiverges(block.getStatements(), true);
    }

    /** 单条语句之后的代码不可达 */
    boolean isTerminator(Statement stmt) {
        return diverges(stmt, true);
    }

    private boolean blockDiverges(List<Statement> statements, boolean loopExits) {
        for (Statement stmt : statements) {
            if (diverges(stmt, loopExits)) return true;
        }
        return false;
    }

    private boolean diverges(Statement stmt, boolean loopExits) {
        if (stmt instanceof ReturnStmt) return true;
        if (stmt instanceof BreakStmt || stmt instanceof ContinueStmt) return loopExits;
        if (stmt instanceof ExpressionStmt) {
            TypeDescriptor t = analyzer.getExpressionType(((ExpressionStmt) stmt).getExpression());
            return t != null && t.isNever();
        }
        if (stmt instanceof Block) {
            return blockDiverges(((Block) stmt).getStatements(), loopExits);
        }
        if (stmt instanceof UnsafeBlock) {
            return blockDiverges(((UnsafeBlock) stmt).getBlock().getStatements(), loopExits);
        }
        if (stmt instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) stmt;
            return ifStmt.hasElse()
                    && blockDiverges(ifStmt.getThenBlock().getStatements(), loopExits)
                    && diverges(ifStmt.getElseBranch(), loopExits);
        }
        if (stmt instanceof IfLetStmt) {
            IfLetStmt ifLet = (IfLetStmt) stmt;
            return ifLet.getElseBlock() != null
                    && blockDiverges(ifLet.getThenBlock().getStatements(), loopExits)
                    && blockDiverges(ifLet.getElseBlock().getStatements(), loopExits);
        }
        if (stmt instanceof MatchStmt) {
            List<MatchArm> arms = ((MatchStmt) stmt).getArms();
            if (arms.isEmpty()) return false;
            for (MatchArm arm : arms) {
                if (!diverges(arm.getBody(), loopExits)) return false;
            }
            return true;
        }
        // 循环体可能一次都不执行
        return false;
    }
}
