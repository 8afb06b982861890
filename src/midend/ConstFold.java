package midend;

import frontend.lexer.TokenType;
import frontend.syntax.Ast;

/**
 * 常量折叠: 子节点已经折叠过, 这里只看当前节点
 * 只折叠 数字 op 数字, 取负和 NOT; 除零和模零保持原样
 */
public class ConstFold {
    private final OptContext ctx;

    public ConstFold(OptContext ctx) {
        this.ctx = ctx;
    }

    public boolean isEnabled() {
        return ctx.isEnabled(OptPass.CONSTANT_FOLDING);
    }

    public Ast.Node fold(Ast.BinaryExpr expr) {
        if (!(expr.getLeft() instanceof Ast.NumberLiteral) || !(expr.getRight() instanceof Ast.NumberLiteral)) {
            return expr;
        }
        double l = ((Ast.NumberLiteral) expr.getLeft()).getValue();
        double r = ((Ast.NumberLiteral) expr.getRight()).getValue();
        double value;
        switch (expr.getOperator()) {
            case ADD -> value = l + r;
            case SUB -> value = l - r;
            case MUL -> value = l * r;
            case POW -> value = Math.pow(l, r);
            case DIV -> {
                if (r == 0) {
                    return expr;
                }
                value = l / r;
            }
            case MOD -> {
                if (r == 0) {
                    return expr;
                }
                value = l % r;
            }
            default -> {
                return expr; // 比较和逻辑运算不折叠
            }
        }
        ctx.applied();
        return new Ast.NumberLiteral(value, expr.getPosition());
    }

    public Ast.Node fold(Ast.UnaryExpr expr) {
        Ast.Node operand = expr.getOperand();
        if (expr.getOperator() == TokenType.SUB && operand instanceof Ast.NumberLiteral) {
            ctx.applied();
            return new Ast.NumberLiteral(-((Ast.NumberLiteral) operand).getValue(), expr.getPosition());
        }
        if (expr.getOperator() == TokenType.NOT && operand instanceof Ast.BooleanLiteral) {
            ctx.applied();
            return new Ast.BooleanLiteral(!((Ast.BooleanLiteral) operand).getValue(), expr.getPosition());
        }
        return expr;
    }
}
