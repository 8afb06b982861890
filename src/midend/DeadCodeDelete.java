package midend;

import frontend.syntax.Ast;

/**
 * 删除条件为常量的 IF: true 留下 then 分支, false 留下 else 分支(没有则整个删掉)
 */
public class DeadCodeDelete {
    private final MidEndRunner runner;
    private final OptContext ctx;

    public DeadCodeDelete(MidEndRunner runner, OptContext ctx) {
        this.runner = runner;
        this.ctx = ctx;
    }

    public boolean isEnabled() {
        return ctx.isEnabled(OptPass.DEAD_CODE_ELIMINATION);
    }

    // null => 删除
    public Ast.Node Run(Ast.IfStmt stmt) {
        stmt.setCondition(runner.optimize(stmt.getCondition()));
        if (isEnabled() && stmt.getCondition() instanceof Ast.BooleanLiteral) {
            ctx.applied();
            boolean cond = ((Ast.BooleanLiteral) stmt.getCondition()).getValue();
            Ast.Node chosen = cond ? stmt.getThenBranch() : stmt.getElseBranch();
            return runner.optimize(chosen);
        }
        stmt.setThenBranch(runner.optimize(stmt.getThenBranch()));
        if (stmt.getElseBranch() != null) {
            stmt.setElseBranch(runner.optimize(stmt.getElseBranch()));
        }
        return stmt;
    }
}
