package backend;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import frontend.syntax.Ast;
import util.CenterControl;

import java.util.List;
import java.util.Locale;

/**
 * 每个节点输出为 {"type":...} 对象, 紧凑格式, 不带多余空白
 */
public class JsonEmitter extends Emitter {
    private static final JsonStringEncoder ENCODER = JsonStringEncoder.getInstance();

    public JsonEmitter(StringBuilder out) {
        super(out);
    }

    private void string(String value) {
        if (value == null) {
            out.append("null");
            return;
        }
        out.append('"');
        if (CenterControl._ESCAPE_JSON) {
            out.append(ENCODER.quoteAsString(value));
        } else {
            out.append(value);
        }
        out.append('"');
    }

    private void key(String name) {
        out.append(",\"").append(name).append("\":");
    }

    private void begin(String type) {
        out.append("{\"type\":\"").append(type).append('"');
    }

    private void field(String name, String value) {
        key(name);
        string(value);
    }

    private void child(String name, Ast.Node node) {
        key(name);
        if (node == null) {
            out.append("null");
        } else {
            emit(node);
        }
    }

    private void array(String name, List<Ast.Node> items) {
        key(name);
        out.append('[');
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                out.append(',');
            }
            emit(items.get(i));
        }
        out.append(']');
    }

    private void number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            out.append("null");
        } else {
            out.append(Ast.NumberLiteral.format(value));
        }
    }

    @Override
    public void emit(Ast.Node node) {
        switch (node.getType()) {
            case PROGRAM -> {
                begin("program");
                array("statements", ((Ast.Program) node).getStatements());
            }
            case PROMPT_DEF -> {
                Ast.PromptDef def = (Ast.PromptDef) node;
                begin("prompt_def");
                field("name", def.getName());
                child("body", def.getBody());
            }
            case VAR_DECL -> {
                Ast.VarDecl decl = (Ast.VarDecl) node;
                begin("var_decl");
                field("name", decl.getName());
                child("value", decl.getInitializer());
            }
            case TEMPLATE_DEF -> {
                Ast.TemplateDef def = (Ast.TemplateDef) node;
                begin("template_def");
                field("name", def.getName());
                key("parameters");
                out.append('[');
                for (int i = 0; i < def.getParameters().size(); i++) {
                    if (i > 0) {
                        out.append(',');
                    }
                    string(def.getParameters().get(i));
                }
                out.append(']');
                child("body", def.getBody());
            }
            case CONSTRAINT_DEF -> {
                Ast.ConstraintDef def = (Ast.ConstraintDef) node;
                begin("constraint_def");
                field("name", def.getName());
                child("constraints", def.getConstraints());
            }
            case CONSTRAINT_EXPR -> {
                Ast.ConstraintExpr expr = (Ast.ConstraintExpr) node;
                begin("constraint");
                field("variable", expr.getVariable());
                field("operator", expr.getOperatorText());
                child("value", expr.getValue());
            }
            case OUTPUT_SPEC -> {
                Ast.OutputSpec spec = (Ast.OutputSpec) node;
                begin("output_spec");
                field("name", spec.getName());
                field("format", spec.getFormat());
            }
            case TEXT_ELEMENT -> {
                Ast.TextElement text = (Ast.TextElement) node;
                begin("text");
                field("text", text.getText());
                key("raw");
                out.append(text.isRaw());
            }
            case VARIABLE_REF -> {
                begin("variable_ref");
                field("name", ((Ast.VariableRef) node).getName());
            }
            case IDENTIFIER -> {
                begin("identifier");
                field("name", ((Ast.Identifier) node).getName());
            }
            case TEMPLATE_CALL, FUNCTION_CALL -> {
                Ast.Call call = (Ast.Call) node;
                begin(node.getType() == Ast.NodeType.TEMPLATE_CALL ? "template_call" : "function_call");
                field("name", call.getName());
                array("arguments", call.getArguments().getElements());
            }
            case STRING_LITERAL -> {
                begin("string");
                field("value", ((Ast.StringLiteral) node).getValue());
            }
            case NUMBER_LITERAL -> {
                begin("number");
                key("value");
                number(((Ast.NumberLiteral) node).getValue());
            }
            case BOOLEAN_LITERAL -> {
                begin("boolean");
                key("value");
                out.append(((Ast.BooleanLiteral) node).getValue());
            }
            case BINARY_EXPR -> {
                Ast.BinaryExpr expr = (Ast.BinaryExpr) node;
                begin("binary_expr");
                field("operator", expr.getOperator().getText());
                child("left", expr.getLeft());
                child("right", expr.getRight());
            }
            case UNARY_EXPR -> {
                Ast.UnaryExpr expr = (Ast.UnaryExpr) node;
                begin("unary_expr");
                field("operator", expr.getOperator().getText());
                child("operand", expr.getOperand());
            }
            case IF_STMT -> {
                Ast.IfStmt stmt = (Ast.IfStmt) node;
                begin("if");
                child("condition", stmt.getCondition());
                child("then", stmt.getThenBranch());
                child("else", stmt.getElseBranch());
            }
            case FOR_STMT -> {
                Ast.ForStmt stmt = (Ast.ForStmt) node;
                begin("for");
                field("variable", stmt.getVariable());
                child("iterable", stmt.getIterable());
                child("body", stmt.getBody());
            }
            case WHILE_STMT -> {
                Ast.WhileStmt stmt = (Ast.WhileStmt) node;
                begin("while");
                child("condition", stmt.getCondition());
                child("body", stmt.getBody());
            }
            case STATEMENT_LIST, EXPRESSION_LIST, ARGUMENT_LIST, CONSTRAINT_LIST, ELEMENT_LIST -> {
                begin(node.getType().name().toLowerCase(Locale.ROOT));
                array("elements", ((Ast.ListNode) node).getElements());
            }
            default -> begin(node.getType().name());
        }
        out.append('}');
    }
}
