package backend;

import frontend.syntax.Ast;

import java.util.ArrayList;

/**
 * 一种输出格式, 把语法树写进 CodeGen 持有的缓冲区
 */
public abstract class Emitter {
    protected final StringBuilder out;

    protected Emitter(StringBuilder out) {
        this.out = out;
    }

    public abstract void emit(Ast.Node node);

    // 类似源码的中缀形式, 嵌套的二元表达式加括号
    protected String expression(Ast.Node node) {
        if (node instanceof Ast.NumberLiteral) {
            return Ast.NumberLiteral.format(((Ast.NumberLiteral) node).getValue());
        } else if (node instanceof Ast.StringLiteral) {
            return quoted(((Ast.StringLiteral) node).getValue());
        } else if (node instanceof Ast.BooleanLiteral) {
            return String.valueOf(((Ast.BooleanLiteral) node).getValue());
        } else if (node instanceof Ast.VariableRef) {
            return "$" + ((Ast.VariableRef) node).getName();
        } else if (node instanceof Ast.Identifier) {
            return ((Ast.Identifier) node).getName();
        } else if (node instanceof Ast.Call) {
            Ast.Call call = (Ast.Call) node;
            String prefix = call.getType() == Ast.NodeType.TEMPLATE_CALL ? "@" : "";
            return prefix + call.getName() + "(" + joined(call.getArguments()) + ")";
        } else if (node instanceof Ast.BinaryExpr) {
            Ast.BinaryExpr expr = (Ast.BinaryExpr) node;
            return operand(expr.getLeft()) + " " + expr.getOperator().getText() + " " + operand(expr.getRight());
        } else if (node instanceof Ast.UnaryExpr) {
            Ast.UnaryExpr expr = (Ast.UnaryExpr) node;
            String op = expr.getOperator().getText();
            return (op.equals("-") ? op : op + " ") + operand(expr.getOperand());
        } else if (node instanceof Ast.ListNode && node.getType() == Ast.NodeType.EXPRESSION_LIST) {
            return "[" + joined((Ast.ListNode) node) + "]";
        }
        return node == null ? "" : node.getType().name();
    }

    // 按源码的转义规则写回字符串字面量
    static String quoted(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private String operand(Ast.Node node) {
        String text = expression(node);
        return node instanceof Ast.BinaryExpr ? "(" + text + ")" : text;
    }

    protected String joined(Ast.ListNode list) {
        ArrayList<String> parts = new ArrayList<>();
        for (Ast.Node item : list.getElements()) {
            parts.add(expression(item));
        }
        return String.join(", ", parts);
    }

    protected String constraint(Ast.ConstraintExpr expr) {
        return expr.getVariable() + " " + expr.getOperatorText() + " " + expression(expr.getValue());
    }
}
