package midend;

import frontend.syntax.Ast;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * 语法树上的优化驱动: 常量折叠 + 死代码删除
 * optimize 返回替换后的节点, 由父节点写回; 返回 null 表示删除
 * FOR / WHILE 以及各种定义原样返回, 不进入内部
 */
public class MidEndRunner {
    private static final Logger log = LoggerFactory.getLogger(MidEndRunner.class);

    private final OptContext ctx;
    private final ConstFold constFold;
    private final DeadCodeDelete deadCodeDelete;

    public MidEndRunner(OptContext ctx) {
        if (ctx == null) {
            throw new NullPointerException("ctx");
        }
        this.ctx = ctx;
        this.constFold = new ConstFold(ctx);
        this.deadCodeDelete = new DeadCodeDelete(this, ctx);
    }

    public static Ast.Node optimize(Ast.Node node, OptContext ctx) {
        return new MidEndRunner(ctx).Run(node);
    }

    public Ast.Node Run(Ast.Node node) {
        int before = ctx.getApplied();
        Ast.Node result = optimize(node);
        log.debug("optimizer applied {} rewrites", ctx.getApplied() - before);
        return result;
    }

    Ast.Node optimize(Ast.Node node) {
        if (node == null) {
            return null;
        }
        if (node instanceof Ast.Program) {
            optimizeList(((Ast.Program) node).getStatements());
            return node;
        } else if (node instanceof Ast.ListNode) {
            optimizeList(((Ast.ListNode) node).getElements());
            return node;
        } else if (node instanceof Ast.BinaryExpr) {
            Ast.BinaryExpr expr = (Ast.BinaryExpr) node;
            expr.setLeft(optimize(expr.getLeft()));
            expr.setRight(optimize(expr.getRight()));
            return constFold.isEnabled() ? constFold.fold(expr) : expr;
        } else if (node instanceof Ast.UnaryExpr) {
            Ast.UnaryExpr expr = (Ast.UnaryExpr) node;
            expr.setOperand(optimize(expr.getOperand()));
            return constFold.isEnabled() ? constFold.fold(expr) : expr;
        } else if (node instanceof Ast.Call) {
            optimizeList(((Ast.Call) node).getArguments().getElements());
            return node;
        } else if (node instanceof Ast.IfStmt) {
            return deadCodeDelete.Run((Ast.IfStmt) node);
        }
        return node;
    }

    // 删除的节点从列表中去掉; IF 被换成分支块时把块里的内容摊平到当前列表
    private void optimizeList(ArrayList<Ast.Node> items) {
        ArrayList<Ast.Node> result = new ArrayList<>(items.size());
        for (Ast.Node item : items) {
            Ast.Node replaced = optimize(item);
            if (replaced == null) {
                continue;
            }
            if (item instanceof Ast.IfStmt && replaced != item && replaced instanceof Ast.ListNode) {
                result.addAll(((Ast.ListNode) replaced).getElements());
            } else {
                result.add(replaced);
            }
        }
        items.clear();
        items.addAll(result);
    }
}
