package frontend.syntax;

/**
 * 语法树的调试输出, 每个节点一行, 子节点缩进两格
 */
public class AstPrinter {
    private final StringBuilder sb = new StringBuilder();

    public static String print(Ast.Node root) {
        AstPrinter printer = new AstPrinter();
        if (root == null) {
            return "(removed)\n";
        }
        printer.visit(root, 0);
        return printer.sb.toString();
    }

    private void visit(Ast.Node node, int depth) {
        sb.append("  ".repeat(depth)).append(node.getType());
        String summary = summarize(node);
        if (!summary.isEmpty()) {
            sb.append(' ').append(summary);
        }
        sb.append(" (line ").append(node.getPosition().getLine())
                .append(", col ").append(node.getPosition().getColumn()).append(")\n");
        for (Ast.Node child : node.children()) {
            visit(child, depth + 1);
        }
    }

    private static String summarize(Ast.Node node) {
        if (node instanceof Ast.PromptDef) {
            return ((Ast.PromptDef) node).getName();
        } else if (node instanceof Ast.VarDecl) {
            return ((Ast.VarDecl) node).getName();
        } else if (node instanceof Ast.TemplateDef) {
            Ast.TemplateDef def = (Ast.TemplateDef) node;
            return def.getName() + "(" + String.join(", ", def.getParameters()) + ")";
        } else if (node instanceof Ast.ConstraintDef) {
            return ((Ast.ConstraintDef) node).getName();
        } else if (node instanceof Ast.OutputSpec) {
            Ast.OutputSpec spec = (Ast.OutputSpec) node;
            return spec.getFormat() == null ? spec.getName() : spec.getName() + " AS " + spec.getFormat();
        } else if (node instanceof Ast.Identifier) {
            return ((Ast.Identifier) node).getName();
        } else if (node instanceof Ast.StringLiteral) {
            return "\"" + ((Ast.StringLiteral) node).getValue() + "\"";
        } else if (node instanceof Ast.NumberLiteral) {
            return Ast.NumberLiteral.format(((Ast.NumberLiteral) node).getValue());
        } else if (node instanceof Ast.BooleanLiteral) {
            return String.valueOf(((Ast.BooleanLiteral) node).getValue());
        } else if (node instanceof Ast.BinaryExpr) {
            return ((Ast.BinaryExpr) node).getOperator().getText();
        } else if (node instanceof Ast.UnaryExpr) {
            return ((Ast.UnaryExpr) node).getOperator().getText();
        } else if (node instanceof Ast.VariableRef) {
            return "$" + ((Ast.VariableRef) node).getName();
        } else if (node instanceof Ast.Call) {
            return ((Ast.Call) node).getName();
        } else if (node instanceof Ast.ForStmt) {
            return ((Ast.ForStmt) node).getVariable();
        } else if (node instanceof Ast.TextElement) {
            Ast.TextElement text = (Ast.TextElement) node;
            return (text.isRaw() ? "raw " : "") + "\"" + text.getText() + "\"";
        } else if (node instanceof Ast.ConstraintExpr) {
            Ast.ConstraintExpr expr = (Ast.ConstraintExpr) node;
            return expr.getVariable() + " " + expr.getOperatorText();
        } else if (node instanceof Ast.ListNode) {
            return "[" + ((Ast.ListNode) node).size() + "]";
        }
        return "";
    }
}
